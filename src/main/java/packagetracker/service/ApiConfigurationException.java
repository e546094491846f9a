package packagetracker.service;

/**
 * The client is not configured to call the provider at all, e.g. the API key is missing. Retrying will not help.
 */
public class ApiConfigurationException extends TrackingApiException {
    public ApiConfigurationException(String message) {
        super(message);
    }
}
