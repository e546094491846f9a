package packagetracker.carrier;

import java.util.regex.Pattern;

/**
 * @param name        carrier display name
 * @param carrierCode the provider's numeric code for this carrier
 * @param pattern     anchored pattern a tracking number must match in full
 */
public record CarrierRule(String name, int carrierCode, Pattern pattern) {

    public boolean matches(String trackingNumber) {
        return pattern.matcher(trackingNumber).matches();
    }
}
