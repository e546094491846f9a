package packagetracker.carrier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Guesses a carrier from the shape of a tracking number.
 * <p>
 * Rules are tried in order and the first match wins. Several numbering schemes overlap, so the
 * generic all-digit rules sit at the end of the table.
 */
public class CarrierDetector {

    public static final List<CarrierRule> DEFAULT_RULES = List.of(
            rule("CTT Portugal", 2151, "^[A-Z]{2}\\d{9}PT$"),
            rule("China Post", 3011, "^[A-Z]{2}\\d{9}CN$"),
            rule("Royal Mail", 1051, "^[A-Z]{2}\\d{9}GB$"),
            rule("La Poste", 1031, "^[A-Z]{2}\\d{9}FR$"),
            rule("Deutsche Post", 1011, "^[A-Z]{2}\\d{9}DE$"),
            rule("USPS", 21051, "^(92|93|94)\\d{18,22}$"),
            rule("PostNL", 1071, "^3S[A-Z0-9]{13,15}$"),
            rule("UPS", 100002, "^1Z[A-Z0-9]{16}$"),
            rule("FedEx", 100003, "^\\d{12}(\\d{3})?(\\d{5})?(\\d{7})?$"),
            rule("DHL", 100001, "^\\d{10,11}$"));

    private final List<CarrierRule> rules;

    public CarrierDetector() {
        this(DEFAULT_RULES);
    }

    public CarrierDetector(List<CarrierRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public CarrierMatch detect(String trackingNumber) {
        if (trackingNumber == null) {
            return CarrierMatch.UNKNOWN;
        }
        String candidate = trackingNumber.trim();
        for (CarrierRule rule : rules) {
            if (rule.matches(candidate)) {
                return new CarrierMatch(rule.name(), rule.carrierCode());
            }
        }
        return CarrierMatch.UNKNOWN;
    }

    public List<CarrierRule> getRules() {
        return rules;
    }

    private static CarrierRule rule(String name, int code, String regex) {
        return new CarrierRule(name, code, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
}
