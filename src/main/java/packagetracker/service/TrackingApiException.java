package packagetracker.service;

import java.util.OptionalInt;

/**
 * Base class for every failure talking to the tracking provider.
 */
public class TrackingApiException extends Exception {

    private final Integer httpStatus;

    public TrackingApiException(String message) {
        this(message, null, null);
    }

    public TrackingApiException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TrackingApiException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public OptionalInt getHttpStatus() {
        return httpStatus == null ? OptionalInt.empty() : OptionalInt.of(httpStatus);
    }
}
