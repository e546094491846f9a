package packagetracker.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.data.Package;
import packagetracker.db.DatabaseConnection;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class PackageDAO {
    private static final Logger logger = LoggerFactory.getLogger(PackageDAO.class);

    private final DatabaseConnection db;

    public PackageDAO(DatabaseConnection db) {
        this.db = db;
    }

    /**
     * Inserts a new package row and stores the generated id on {@code pkg}.
     *
     * @throws SQLIntegrityConstraintViolationException if the tracking number is already stored
     */
    public long addPackage(Package pkg) throws SQLException {
        String sql = """
                INSERT INTO packages (tracking_number, carrier, carrier_code, description, status, raw_response,
                                      registered, created_at, updated_at, active)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, pkg.getTrackingNumber());
            stmt.setString(2, pkg.getCarrier());
            stmt.setInt(3, pkg.getCarrierCode());
            stmt.setString(4, pkg.getDescription());
            stmt.setString(5, pkg.getStatus());
            stmt.setString(6, pkg.getRawResponse());
            stmt.setBoolean(7, pkg.isRegistered());
            stmt.setObject(8, pkg.getCreatedAt());
            stmt.setObject(9, pkg.getUpdatedAt());
            stmt.setBoolean(10, pkg.isActive());
            stmt.executeUpdate();
            try (ResultSet rs = stmt.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    pkg.setPackageId(id);
                    return id;
                }
            }
        }
        throw new SQLException("No id generated for package " + pkg.getTrackingNumber());
    }

    public Optional<Package> findPackageByTracking(String trackingNumber) throws SQLException {
        String sql = "SELECT * FROM packages WHERE tracking_number = ?";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, trackingNumber);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @param packageId restricts the result to one package when not null
     */
    public List<Package> findActivePackages(Long packageId) throws SQLException {
        QueryAndParams queryAndParams = buildActiveQuery(packageId);
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(queryAndParams.sql)) {
            for (int i = 0; i < queryAndParams.params.size(); i++) {
                stmt.setObject(i + 1, queryAndParams.params.get(i));
            }
            return mapRows(stmt);
        }
    }

    public List<Package> findUnregisteredActivePackages() throws SQLException {
        String sql = "SELECT * FROM packages WHERE active = TRUE AND registered = FALSE ORDER BY created_at, id";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            return mapRows(stmt);
        }
    }

    public List<Package> listPackages(boolean activeOnly) throws SQLException {
        String sql = activeOnly
                ? "SELECT * FROM packages WHERE active = TRUE ORDER BY created_at DESC, id DESC"
                : "SELECT * FROM packages ORDER BY active DESC, created_at DESC, id DESC";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            return mapRows(stmt);
        }
    }

    public boolean setActive(long packageId, boolean active, OffsetDateTime now) throws SQLException {
        String sql = "UPDATE packages SET active = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setBoolean(1, active);
            stmt.setObject(2, now);
            stmt.setLong(3, packageId);
            return stmt.executeUpdate() > 0;
        }
    }

    public boolean markRegistered(long packageId, int carrierCode, String rawResponse, OffsetDateTime now) throws SQLException {
        String sql = "UPDATE packages SET registered = TRUE, carrier_code = ?, raw_response = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = db.getTrackerConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, carrierCode);
            stmt.setString(2, rawResponse);
            stmt.setObject(3, now);
            stmt.setLong(4, packageId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Writes the fields a check cycle changes. Runs on the caller's connection so it joins the cycle's transaction.
     */
    public void updateCheckedPackage(Connection conn, Package pkg) throws SQLException {
        String sql = """
                UPDATE packages
                SET status = ?, last_event = ?, last_event_date = ?, last_checked = ?, delivered_date = ?,
                    raw_response = ?, updated_at = ?, active = ?
                WHERE id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, pkg.getStatus());
            stmt.setString(2, pkg.getLastEvent());
            stmt.setString(3, pkg.getLastEventDate());
            stmt.setObject(4, pkg.getLastChecked());
            stmt.setObject(5, pkg.getDeliveredDate());
            stmt.setString(6, pkg.getRawResponse());
            stmt.setObject(7, pkg.getUpdatedAt());
            stmt.setBoolean(8, pkg.isActive());
            stmt.setLong(9, pkg.getPackageId());
            if (stmt.executeUpdate() == 0) {
                throw new SQLException("Package " + pkg.getTrackingNumber() + " disappeared during the check cycle");
            }
        }
    }

    private List<Package> mapRows(PreparedStatement stmt) throws SQLException {
        List<Package> packages = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                packages.add(mapRow(rs));
            }
        }
        logger.debug("Loaded {} package(s)", packages.size());
        return packages;
    }

    private Package mapRow(ResultSet rs) throws SQLException {
        Package pkg = new Package();
        pkg.setPackageId(rs.getLong("id"));
        pkg.setTrackingNumber(rs.getString("tracking_number"));
        pkg.setCarrier(rs.getString("carrier"));
        pkg.setCarrierCode(rs.getInt("carrier_code"));
        pkg.setDescription(rs.getString("description"));
        pkg.setStatus(rs.getString("status"));
        pkg.setLastEvent(rs.getString("last_event"));
        pkg.setLastEventDate(rs.getString("last_event_date"));
        pkg.setLastChecked(rs.getObject("last_checked", OffsetDateTime.class));
        pkg.setDeliveredDate(rs.getObject("delivered_date", OffsetDateTime.class));
        pkg.setRawResponse(rs.getString("raw_response"));
        pkg.setRegistered(rs.getBoolean("registered"));
        pkg.setCreatedAt(rs.getObject("created_at", OffsetDateTime.class));
        pkg.setUpdatedAt(rs.getObject("updated_at", OffsetDateTime.class));
        pkg.setActive(rs.getBoolean("active"));
        return pkg;
    }

    private QueryAndParams buildActiveQuery(Long packageId) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM packages WHERE active = TRUE");
        if (packageId != null) {
            sql.append(" AND id = ?");
            params.add(packageId);
        }
        sql.append(" ORDER BY id");
        return new QueryAndParams(sql.toString(), params);
    }

    private record QueryAndParams(String sql, List<Object> params) {
    }
}
