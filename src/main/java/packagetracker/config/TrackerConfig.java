package packagetracker.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable runtime settings, loaded once at startup and handed to the components that need them.
 */
public record TrackerConfig(String dbUrl, String dbUser, String dbPassword, String apiBaseUrl, String apiKey, Duration apiTimeout) {

    public static final String API_KEY_ENV = "SEVENTEEN_TRACK_API_KEY";
    public static final String DEFAULT_API_BASE_URL = "https://api.17track.net/track/v2.2";
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public static TrackerConfig load() {
        Properties properties = new Properties();
        try (InputStream input = TrackerConfig.class.getResourceAsStream("/config.properties")) {
            if (input == null) {
                throw new IOException("FATAL: Unable to find config.properties in resources.");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load tracker configuration.", e);
        }
        return fromProperties(properties, System.getenv());
    }

    public static TrackerConfig fromProperties(Properties properties, Map<String, String> environment) {
        String apiKey = environment.get(API_KEY_ENV);
        if (apiKey == null || apiKey.isBlank()) {
            apiKey = properties.getProperty("api.key", "");
        }

        int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        String timeoutValue = properties.getProperty("api.timeout-seconds");
        if (timeoutValue != null && !timeoutValue.isBlank()) {
            try {
                timeoutSeconds = Integer.parseInt(timeoutValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("api.timeout-seconds must be a whole number of seconds, got: " + timeoutValue, e);
            }
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("api.timeout-seconds must be positive, got: " + timeoutSeconds);
        }

        String dbUrl = properties.getProperty("db.url");
        if (dbUrl == null || dbUrl.isBlank()) {
            throw new IllegalStateException("db.url is not set in config.properties.");
        }

        return new TrackerConfig(
                dbUrl.trim(),
                properties.getProperty("db.user", ""),
                properties.getProperty("db.password", ""),
                properties.getProperty("api.base-url", DEFAULT_API_BASE_URL).trim(),
                apiKey.trim(),
                Duration.ofSeconds(timeoutSeconds));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        // never print the credential
        return "TrackerConfig[dbUrl=" + dbUrl + ", dbUser=" + dbUser + ", apiBaseUrl=" + apiBaseUrl
                + ", apiKey=" + (hasApiKey() ? "****" : "<unset>") + ", apiTimeout=" + apiTimeout + "]";
    }
}
