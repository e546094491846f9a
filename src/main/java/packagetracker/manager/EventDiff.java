package packagetracker.manager;

import packagetracker.data.EventKey;
import packagetracker.service.dto.ProviderEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class EventDiff {

    private EventDiff() {
    }

    /**
     * Returns the fetched events whose (date, description) key is not among the stored keys, in fetched order.
     * A key repeated within {@code fetched} is kept only once.
     */
    public static List<ProviderEvent> newEvents(Set<EventKey> storedKeys, List<ProviderEvent> fetched) {
        Set<EventKey> seen = new HashSet<>(storedKeys);
        List<ProviderEvent> fresh = new ArrayList<>();
        for (ProviderEvent event : fetched) {
            if (seen.add(event.key())) {
                fresh.add(event);
            }
        }
        return fresh;
    }
}
