package packagetracker.notification;

import packagetracker.data.TrackingStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link PackageUpdate}s as the plain text the relay forwards to chat apps.
 */
public final class NotificationFormatter {

    private static final Map<String, String> STATUS_EMOJI;

    static {
        Map<String, String> emoji = new HashMap<>();
        emoji.put(TrackingStatus.PENDING_LABEL, "⏳");
        emoji.put(TrackingStatus.NOT_FOUND.getLabel(), "❓");
        emoji.put(TrackingStatus.IN_TRANSIT.getLabel(), "🚚");
        emoji.put(TrackingStatus.EXPIRED.getLabel(), "⌛");
        emoji.put(TrackingStatus.PICK_UP.getLabel(), "📬");
        emoji.put(TrackingStatus.UNDELIVERED.getLabel(), "⚠️");
        emoji.put(TrackingStatus.DELIVERED.getLabel(), "✅");
        emoji.put(TrackingStatus.ALERT.getLabel(), "🚨");
        STATUS_EMOJI = Collections.unmodifiableMap(emoji);
    }

    private NotificationFormatter() {
    }

    public static String format(PackageUpdate update) {
        String carrier = update.carrier() == null || update.carrier().isBlank() ? "Auto-detect" : update.carrier();
        String header = TrackingStatus.DELIVERED.getLabel().equals(update.newStatus()) ? "✅" : "📦";
        String statusChange = statusChange(update);

        List<String> lines = new ArrayList<>();
        lines.add(header + " Package Update");
        lines.add("📮 Tracking: " + update.trackingNumber());
        lines.add("📦 Carrier: " + carrier);
        lines.add("📊 Status: " + statusChange);

        if (update.description() != null && !update.description().isBlank()) {
            lines.add("📝 Description: " + update.description());
        }

        LatestEvent latest = update.latestEvent();
        if (latest != null) {
            StringBuilder line = new StringBuilder("📍 Latest: ").append(latest.description());
            if (latest.location() != null && !latest.location().isBlank()) {
                line.append(" — ").append(latest.location());
            }
            if (latest.date() != null && !latest.date().isBlank()) {
                line.append(" (").append(latest.date()).append(")");
            }
            lines.add(line.toString());
        }

        lines.add("🔗 Track online: " + update.trackingUrl());
        return String.join("\n", lines);
    }

    /**
     * One-line digest of an update, e.g. {@code 🚚 1Z999AA10123456784: pending → In Transit}.
     */
    public static String summaryLine(PackageUpdate update) {
        return statusEmoji(update.newStatus()) + " " + update.trackingNumber() + ": " + statusChange(update);
    }

    public static String statusEmoji(String statusLabel) {
        return STATUS_EMOJI.getOrDefault(statusLabel, "📦");
    }

    private static String statusChange(PackageUpdate update) {
        return update.statusChanged() ? update.oldStatus() + " → " + update.newStatus() : update.newStatus();
    }
}
