package packagetracker.carrier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a link a person can open to follow a shipment on the carrier's own site.
 */
public class TrackingUrlResolver {

    public static final String FALLBACK_TEMPLATE = "https://t.17track.net/en#nums={tn}";

    private static final Map<String, String> URL_TEMPLATES;

    static {
        Map<String, String> templates = new LinkedHashMap<>();
        templates.put("FedEx", "https://www.fedex.com/fedextrack/?trknbr={tn}");
        templates.put("UPS", "https://www.ups.com/track?tracknum={tn}");
        templates.put("DHL", "https://www.dhl.com/en/express/tracking.html?AWB={tn}");
        templates.put("CTT Portugal", "https://www.ctt.pt/feapl_2/app/open/objectSearch/objectSearch.jspx?objects={tn}");
        templates.put("USPS", "https://tools.usps.com/go/TrackConfirmAction?tLabels={tn}");
        templates.put("Royal Mail", "https://www.royalmail.com/track-your-item#/tracking-results/{tn}");
        templates.put("La Poste", "https://www.laposte.fr/outils/suivre-vos-envois?code={tn}");
        templates.put("Deutsche Post", "https://www.deutschepost.de/de/s/sendungsverfolgung.html?piececode={tn}");
        templates.put("PostNL", "https://jouw.postnl.nl/track-and-trace/{tn}");
        templates.put("China Post", "https://t.17track.net/en#nums={tn}");
        URL_TEMPLATES = Collections.unmodifiableMap(templates);
    }

    private final CarrierDetector carrierDetector;

    public TrackingUrlResolver(CarrierDetector carrierDetector) {
        this.carrierDetector = carrierDetector;
    }

    public String resolve(String trackingNumber) {
        return resolve(trackingNumber, null);
    }

    /**
     * @param carrier carrier name to prefer, matched case-insensitively; may be null
     * @return a URL, never null or empty
     */
    public String resolve(String trackingNumber, String carrier) {
        String tn = trackingNumber == null ? "" : trackingNumber.trim();

        if (carrier != null && !carrier.isBlank()) {
            String wanted = carrier.trim().toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> entry : URL_TEMPLATES.entrySet()) {
                if (entry.getKey().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return fill(entry.getValue(), tn);
                }
            }
        }

        CarrierMatch detected = carrierDetector.detect(tn);
        if (detected.isDetected() && URL_TEMPLATES.containsKey(detected.carrierName())) {
            return fill(URL_TEMPLATES.get(detected.carrierName()), tn);
        }
        return fill(FALLBACK_TEMPLATE, tn);
    }

    public static Map<String, String> getUrlTemplates() {
        return URL_TEMPLATES;
    }

    private static String fill(String template, String trackingNumber) {
        return template.replace("{tn}", trackingNumber);
    }
}
