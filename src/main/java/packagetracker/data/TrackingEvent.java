package packagetracker.data;

import java.time.OffsetDateTime;

/**
 * One stored line of a package's tracking history. Rows are written once and never changed.
 */
public class TrackingEvent {
    private final long eventId;
    private final long packageId;
    private final String eventDate;
    private final String location;
    private final String description;
    private final String statusCode;
    private final OffsetDateTime createdAt;

    public TrackingEvent(long eventId, long packageId, String eventDate, String location, String description, String statusCode, OffsetDateTime createdAt) {
        this.eventId = eventId;
        this.packageId = packageId;
        this.eventDate = eventDate;
        this.location = location;
        this.description = description;
        this.statusCode = statusCode;
        this.createdAt = createdAt;
    }

    public long getEventId() {
        return eventId;
    }

    public long getPackageId() {
        return packageId;
    }

    public String getEventDate() {
        return eventDate;
    }

    public String getLocation() {
        return location;
    }

    public String getDescription() {
        return description;
    }

    public String getStatusCode() {
        return statusCode;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public EventKey key() {
        return new EventKey(eventDate, description);
    }
}
