package packagetracker.manager;

import java.util.List;

/**
 * Outcome of adding a package.
 *
 * @param registered  whether the provider has confirmed it is monitoring the number
 * @param reactivated true when an existing inactive package was switched back on instead of created
 * @param warnings    side-channel notices such as low quota or a deferred registration
 */
public record AddResult(
        boolean ok,
        FailureReason failure,
        String message,
        Long packageId,
        String trackingNumber,
        String carrier,
        boolean registered,
        boolean reactivated,
        String trackingUrl,
        List<String> warnings) {

    public AddResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static AddResult failure(FailureReason failure, String message, List<String> warnings) {
        return new AddResult(false, failure, message, null, null, null, false, false, null, warnings);
    }

    public static AddResult failure(FailureReason failure, String message) {
        return failure(failure, message, List.of());
    }
}
