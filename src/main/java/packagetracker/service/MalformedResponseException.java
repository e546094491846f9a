package packagetracker.service;

/**
 * The provider answered, but not in the shape we expect.
 */
public class MalformedResponseException extends TrackingApiException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
