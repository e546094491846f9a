package packagetracker.dao;

import packagetracker.data.EventKey;
import packagetracker.data.TrackingEvent;
import packagetracker.db.DatabaseConnection;
import packagetracker.service.dto.ProviderEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only access to {@code tracking_events}; rows are never updated or deleted.
 */
public class TrackingEventDAO {

    private final DatabaseConnection db;

    public TrackingEventDAO(DatabaseConnection db) {
        this.db = db;
    }

    public Set<EventKey> findEventKeys(Connection conn, long packageId) throws SQLException {
        String sql = "SELECT event_date, description FROM tracking_events WHERE package_id = ?";
        Set<EventKey> keys = new HashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, packageId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(new EventKey(rs.getString("event_date"), rs.getString("description")));
                }
            }
        }
        return keys;
    }

    public void addEvents(Connection conn, long packageId, List<ProviderEvent> events, String statusCode, OffsetDateTime createdAt) throws SQLException {
        if (events.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO tracking_events (package_id, event_date, location, description, status_code, created_at) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (ProviderEvent event : events) {
                stmt.setLong(1, packageId);
                stmt.setString(2, event.date());
                stmt.setString(3, event.location());
                stmt.setString(4, event.description());
                stmt.setString(5, statusCode);
                stmt.setObject(6, createdAt);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    /**
     * History for one package, newest provider date first.
     */
    public List<TrackingEvent> findEventsForPackage(long packageId) throws SQLException {
        String sql = "SELECT * FROM tracking_events WHERE package_id = ? ORDER BY event_date DESC, id ASC";
        List<TrackingEvent> events = new ArrayList<>();
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, packageId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(new TrackingEvent(
                            rs.getLong("id"),
                            rs.getLong("package_id"),
                            rs.getString("event_date"),
                            rs.getString("location"),
                            rs.getString("description"),
                            rs.getString("status_code"),
                            rs.getObject("created_at", OffsetDateTime.class)));
                }
            }
        }
        return events;
    }
}
