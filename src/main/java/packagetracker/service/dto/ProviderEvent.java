package packagetracker.service.dto;

import packagetracker.data.EventKey;

/**
 * A tracking event as the provider reports it. {@code location} is null when the provider leaves it blank.
 */
public record ProviderEvent(String date, String location, String description) {

    public EventKey key() {
        return new EventKey(date, description);
    }
}
