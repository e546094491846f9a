package packagetracker.service.dto;

import java.util.List;

/**
 * One accepted entry of a {@code gettrackinfo} response.
 *
 * @param number     tracking number as echoed by the provider
 * @param statusCode numeric provider status ({@code track.e})
 * @param events     provider events, newest first
 * @param rawJson    the entry exactly as received, kept for debugging
 */
public record TrackInfoItem(String number, int statusCode, List<ProviderEvent> events, String rawJson) {

    public TrackInfoItem {
        events = List.copyOf(events);
    }
}
