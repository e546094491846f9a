package packagetracker.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackerConfigTest {

    private Properties baseProperties() {
        Properties properties = new Properties();
        properties.setProperty("db.url", "jdbc:h2:mem:config-test");
        properties.setProperty("db.user", "sa");
        properties.setProperty("api.key", "from-file");
        properties.setProperty("api.timeout-seconds", "12");
        return properties;
    }

    @Test
    void environmentKeyOverridesPropertiesFile() {
        TrackerConfig config = TrackerConfig.fromProperties(baseProperties(), Map.of(TrackerConfig.API_KEY_ENV, "from-env"));

        assertThat(config.apiKey()).isEqualTo("from-env");
        assertThat(config.apiTimeout()).isEqualTo(Duration.ofSeconds(12));
        assertThat(config.apiBaseUrl()).isEqualTo(TrackerConfig.DEFAULT_API_BASE_URL);
    }

    @Test
    void fallsBackToPropertiesKey() {
        TrackerConfig config = TrackerConfig.fromProperties(baseProperties(), Map.of());

        assertThat(config.apiKey()).isEqualTo("from-file");
        assertThat(config.hasApiKey()).isTrue();
    }

    @Test
    void blankKeyMeansNoKey() {
        Properties properties = baseProperties();
        properties.setProperty("api.key", "  ");

        TrackerConfig config = TrackerConfig.fromProperties(properties, Map.of(TrackerConfig.API_KEY_ENV, ""));

        assertThat(config.hasApiKey()).isFalse();
        assertThat(config.toString()).contains("<unset>");
    }

    @Test
    void toStringNeverShowsTheKey() {
        TrackerConfig config = TrackerConfig.fromProperties(baseProperties(), Map.of());

        assertThat(config.toString()).doesNotContain("from-file").contains("****");
    }

    @Test
    void rejectsBadTimeoutAndMissingUrl() {
        Properties badTimeout = baseProperties();
        badTimeout.setProperty("api.timeout-seconds", "soon");
        assertThatThrownBy(() -> TrackerConfig.fromProperties(badTimeout, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api.timeout-seconds");

        Properties noUrl = baseProperties();
        noUrl.remove("db.url");
        assertThatThrownBy(() -> TrackerConfig.fromProperties(noUrl, Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("db.url");
    }

    @Test
    void bundledConfigurationLoads() {
        TrackerConfig config = TrackerConfig.load();

        assertThat(config.dbUrl()).startsWith("jdbc:h2:");
        assertThat(config.apiBaseUrl()).isEqualTo("https://api.17track.net/track/v2.2");
    }
}
