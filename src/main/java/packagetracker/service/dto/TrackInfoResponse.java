package packagetracker.service.dto;

import java.util.List;

public record TrackInfoResponse(List<TrackInfoItem> accepted) {

    public TrackInfoResponse {
        accepted = List.copyOf(accepted);
    }
}
