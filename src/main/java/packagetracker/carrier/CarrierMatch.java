package packagetracker.carrier;

import java.util.Optional;

/**
 * Result of carrier detection. A code of 0 asks the provider to work the carrier out itself.
 */
public record CarrierMatch(String carrierName, int carrierCode) {

    public static final CarrierMatch UNKNOWN = new CarrierMatch(null, 0);

    public boolean isDetected() {
        return carrierName != null;
    }

    public Optional<String> carrier() {
        return Optional.ofNullable(carrierName);
    }
}
