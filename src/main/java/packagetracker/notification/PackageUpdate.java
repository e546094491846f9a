package packagetracker.notification;

/**
 * Payload handed to the messaging relay when a package changed during a check cycle.
 *
 * @param carrier        carrier name, null when it was never detected or supplied
 * @param description    the owner's note for the package, may be null
 * @param latestEvent    newest provider event, null when the provider reported none
 * @param newEventsCount number of events stored for the first time in this cycle
 */
public record PackageUpdate(
        String trackingNumber,
        String description,
        String carrier,
        String oldStatus,
        String newStatus,
        LatestEvent latestEvent,
        int newEventsCount,
        String trackingUrl) {

    public boolean statusChanged() {
        return !newStatus.equals(oldStatus);
    }
}
