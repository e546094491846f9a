package packagetracker.service;

/**
 * The request did not complete: connection failure, timeout, or a non-2xx HTTP status.
 */
public class ApiTransportException extends TrackingApiException {

    public ApiTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiTransportException(String message, int httpStatus) {
        super(message, httpStatus, null);
    }
}
