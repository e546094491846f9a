package packagetracker.service.dto;

import java.util.List;

public record RegisterResponse(List<AcceptedRegistration> accepted, List<RejectedRegistration> rejected, String rawJson) {

    public RegisterResponse {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }
}
