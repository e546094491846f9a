package packagetracker.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.config.TrackerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

    private final HikariDataSource dataSource;

    public DatabaseConnection(TrackerConfig trackerConfig) {
        HikariConfig config = new HikariConfig();
        config.setDriverClassName("org.h2.Driver");
        config.setJdbcUrl(trackerConfig.dbUrl());
        config.setUsername(trackerConfig.dbUser());
        config.setPassword(trackerConfig.dbPassword());
        config.setPoolName("tracker-pool");

        // One check cycle holds a single connection; a small pool is plenty.
        config.setMaximumPoolSize(4);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(15000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        dataSource = new HikariDataSource(config);
        logger.info("HikariCP Connection Pool Initialized successfully.");

        try {
            initializeSchema();
        } catch (SQLException | IOException e) {
            logger.error("FATAL: Failed to initialize the tracker schema.", e);
            dataSource.close();
            throw new IllegalStateException("Failed to initialize the tracker schema.", e);
        }
    }

    public Connection getTrackerConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private void initializeSchema() throws SQLException, IOException {
        String script;
        try (InputStream input = DatabaseConnection.class.getResourceAsStream("/schema.sql")) {
            if (input == null) {
                throw new IOException("FATAL: Unable to find schema.sql in resources.");
            }
            script = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }

        try (Connection conn = getTrackerConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
        }
        logger.debug("Tracker schema is up to date.");
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }
}
