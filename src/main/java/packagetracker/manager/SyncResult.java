package packagetracker.manager;

import packagetracker.notification.PackageUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one check cycle. A cycle that did not complete wrote nothing and carries no updates.
 */
public record SyncResult(boolean completed, List<PackageUpdate> updates, Optional<String> error) {

    public SyncResult {
        updates = List.copyOf(updates);
    }

    public static SyncResult completed(List<PackageUpdate> updates) {
        return new SyncResult(true, updates, Optional.empty());
    }

    public static SyncResult failed(String error) {
        return new SyncResult(false, List.of(), Optional.of(error));
    }
}
