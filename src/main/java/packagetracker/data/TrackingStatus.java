package packagetracker.data;

import java.util.Optional;

/**
 * Shipment states reported by the provider, keyed by its numeric status code.
 * Packages store the display label, so codes the provider adds later still round-trip as {@code Unknown (n)}.
 */
public enum TrackingStatus {
    NOT_FOUND(0, "Not Found"),
    IN_TRANSIT(10, "In Transit"),
    EXPIRED(20, "Expired"),
    PICK_UP(30, "Pick Up"),
    UNDELIVERED(35, "Undelivered"),
    DELIVERED(40, "Delivered"),
    ALERT(50, "Alert");

    /**
     * Label given to a package before its first check.
     */
    public static final String PENDING_LABEL = "pending";

    private final int code;
    private final String label;

    TrackingStatus(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == DELIVERED;
    }

    public static Optional<TrackingStatus> fromCode(int code) {
        for (TrackingStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public static String labelFor(int code) {
        return fromCode(code).map(TrackingStatus::getLabel).orElse("Unknown (" + code + ")");
    }

    public static boolean isTerminalCode(int code) {
        return fromCode(code).map(TrackingStatus::isTerminal).orElse(false);
    }
}
