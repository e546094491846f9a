package packagetracker.notification;

/**
 * Most recent provider event attached to an update. {@code date} and {@code location} may be blank.
 */
public record LatestEvent(String date, String location, String description) {
}
