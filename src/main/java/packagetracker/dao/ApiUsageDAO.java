package packagetracker.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.db.DatabaseConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

public class ApiUsageDAO {
    private static final Logger logger = LoggerFactory.getLogger(ApiUsageDAO.class);

    private final DatabaseConnection db;

    public ApiUsageDAO(DatabaseConnection db) {
        this.db = db;
    }

    /**
     * @param month calendar month as {@code YYYY-MM}
     * @return registrations recorded for that month, 0 if the month has no row yet
     */
    public int getRegistrationsUsed(String apiName, String month) throws SQLException {
        String sql = "SELECT registrations_used FROM api_usage WHERE api_name = ? AND usage_month = ?";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, apiName);
            stmt.setString(2, month);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt("registrations_used");
                }
            }
        }
        return 0;
    }

    /**
     * Adds one registration to the month's counter, creating the row on first use.
     * If another caller creates the row first, the unique key rejects our insert and we fall back to the update.
     */
    public void incrementRegistrations(String apiName, String month) throws SQLException {
        String updateSql = "UPDATE api_usage SET registrations_used = registrations_used + 1 WHERE api_name = ? AND usage_month = ?";
        String insertSql = "INSERT INTO api_usage (api_name, usage_month, registrations_used) VALUES (?, ?, 1)";

        Connection conn = null;
        try {
            conn = db.getTrackerConnection();
            conn.setAutoCommit(false);

            if (executeFor(conn, updateSql, apiName, month) == 0) {
                try {
                    executeFor(conn, insertSql, apiName, month);
                } catch (SQLIntegrityConstraintViolationException e) {
                    logger.debug("Usage row for {} {} was created concurrently, retrying as update", apiName, month);
                    executeFor(conn, updateSql, apiName, month);
                }
            }
            conn.commit();
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.rollback();
                } catch (SQLException ex) {
                    logger.error("Database error during rollback: ", ex);
                }
            }
            throw e;
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException e) {
                    logger.error("Database error closing connection: ", e);
                }
            }
        }
    }

    /**
     * Claims one registration for the month unless {@code limit} are already used. The check and the
     * increment happen in one conditional update, so concurrent callers cannot overshoot the limit.
     *
     * @return true if the registration was claimed
     */
    public boolean tryReserveRegistration(String apiName, String month, int limit) throws SQLException {
        String reserveSql = "UPDATE api_usage SET registrations_used = registrations_used + 1 "
                + "WHERE api_name = ? AND usage_month = ? AND registrations_used < ?";
        String insertSql = "INSERT INTO api_usage (api_name, usage_month, registrations_used) VALUES (?, ?, 1)";
        if (limit <= 0) {
            return false;
        }

        Connection conn = null;
        try {
            conn = db.getTrackerConnection();
            conn.setAutoCommit(false);

            boolean reserved = executeFor(conn, reserveSql, apiName, month, limit) == 1;
            if (!reserved) {
                try {
                    reserved = executeFor(conn, insertSql, apiName, month) == 1;
                } catch (SQLIntegrityConstraintViolationException e) {
                    // Row exists: either it is at the limit or another caller just created it.
                    reserved = executeFor(conn, reserveSql, apiName, month, limit) == 1;
                }
            }
            conn.commit();
            return reserved;
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.rollback();
                } catch (SQLException ex) {
                    logger.error("Database error during rollback: ", ex);
                }
            }
            throw e;
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException e) {
                    logger.error("Database error closing connection: ", e);
                }
            }
        }
    }

    /**
     * Gives back a registration claimed with {@link #tryReserveRegistration} that was not spent.
     */
    public void releaseRegistration(String apiName, String month) throws SQLException {
        String sql = "UPDATE api_usage SET registrations_used = registrations_used - 1 "
                + "WHERE api_name = ? AND usage_month = ? AND registrations_used > 0";
        try (Connection conn = db.getTrackerConnection()) {
            if (executeFor(conn, sql, apiName, month) == 0) {
                logger.warn("No {} registration to release for {}", apiName, month);
            }
        }
    }

    private int executeFor(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            return stmt.executeUpdate();
        }
    }
}
