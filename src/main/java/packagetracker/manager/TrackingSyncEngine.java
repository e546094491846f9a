package packagetracker.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.carrier.TrackingUrlResolver;
import packagetracker.dao.PackageDAO;
import packagetracker.dao.TrackingEventDAO;
import packagetracker.data.EventKey;
import packagetracker.data.Package;
import packagetracker.data.TrackingStatus;
import packagetracker.db.DatabaseConnection;
import packagetracker.notification.LatestEvent;
import packagetracker.notification.PackageUpdate;
import packagetracker.service.ApiConfigurationException;
import packagetracker.service.TrackingApi;
import packagetracker.service.TrackingApiException;
import packagetracker.service.dto.ProviderEvent;
import packagetracker.service.dto.TrackInfoItem;
import packagetracker.service.dto.TrackInfoResponse;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs check cycles: one batch poll of the provider for every active package, reconciled against the store.
 * <p>
 * A cycle is all or nothing. If the provider call fails nothing is written, and every package write of a
 * successful call is committed in a single transaction.
 */
public class TrackingSyncEngine {

    private static final Logger logger = LoggerFactory.getLogger(TrackingSyncEngine.class);

    private final DatabaseConnection db;
    private final PackageDAO packageDAO;
    private final TrackingEventDAO trackingEventDAO;
    private final TrackingApi trackingApi;
    private final TrackingUrlResolver urlResolver;
    private final Clock clock;

    public TrackingSyncEngine(DatabaseConnection db, PackageDAO packageDAO, TrackingEventDAO trackingEventDAO,
                              TrackingApi trackingApi, TrackingUrlResolver urlResolver, Clock clock) {
        this.db = db;
        this.packageDAO = packageDAO;
        this.trackingEventDAO = trackingEventDAO;
        this.trackingApi = trackingApi;
        this.urlResolver = urlResolver;
        this.clock = clock;
    }

    public SyncResult checkUpdates() {
        return checkUpdates(Optional.empty());
    }

    /**
     * @param packageId limits the cycle to one package; empty checks every active package
     */
    public SyncResult checkUpdates(Optional<Long> packageId) {
        List<Package> packages;
        try {
            packages = packageDAO.findActivePackages(packageId.orElse(null));
        } catch (SQLException e) {
            logger.error("Could not load active packages: ", e);
            return SyncResult.failed("Could not load active packages: " + e.getMessage());
        }

        if (packages.isEmpty()) {
            logger.info("No active packages to check");
            return SyncResult.completed(List.of());
        }

        Map<String, Package> byTrackingNumber = new LinkedHashMap<>();
        for (Package pkg : packages) {
            byTrackingNumber.put(pkg.getTrackingNumber(), pkg);
        }

        TrackInfoResponse response;
        try {
            response = trackingApi.getTrackInfo(new ArrayList<>(byTrackingNumber.keySet()));
        } catch (ApiConfigurationException e) {
            logger.error("API key error: {}", e.getMessage());
            return SyncResult.failed(e.getMessage());
        } catch (TrackingApiException e) {
            logger.error("Failed to fetch tracking info for {} package(s): {}", byTrackingNumber.size(), e.getMessage());
            return SyncResult.failed(e.getMessage());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PackageUpdate> updates = new ArrayList<>();
        Connection conn = null;
        boolean committed = false;
        try {
            conn = db.getTrackerConnection();
            conn.setAutoCommit(false);

            for (TrackInfoItem item : response.accepted()) {
                Package pkg = byTrackingNumber.get(item.number());
                if (pkg == null) {
                    logger.debug("Ignoring tracking info for unknown number {}", item.number());
                    continue;
                }
                reconcile(conn, pkg, item, now).ifPresent(updates::add);
            }

            conn.commit();
            committed = true;
        } catch (SQLException e) {
            logger.error("Check cycle rolled back: ", e);
            return SyncResult.failed("Database error during check cycle: " + e.getMessage());
        } finally {
            if (conn != null) {
                // setAutoCommit(true) commits pending work, so roll back anything not committed first
                if (!committed) {
                    try {
                        conn.rollback();
                    } catch (SQLException ex) {
                        logger.error("Database error during rollback: ", ex);
                    }
                }
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException e) {
                    logger.error("Database error closing connection: ", e);
                }
            }
        }

        if (updates.isEmpty()) {
            logger.info("No new updates found");
        } else {
            logger.info("Found {} update(s)", updates.size());
        }
        return SyncResult.completed(updates);
    }

    private Optional<PackageUpdate> reconcile(Connection conn, Package pkg, TrackInfoItem item, OffsetDateTime now) throws SQLException {
        String oldStatus = pkg.getStatus();
        String newStatus = TrackingStatus.labelFor(item.statusCode());

        Set<EventKey> storedKeys = trackingEventDAO.findEventKeys(conn, pkg.getPackageId());
        List<ProviderEvent> newEvents = EventDiff.newEvents(storedKeys, item.events());
        trackingEventDAO.addEvents(conn, pkg.getPackageId(), newEvents, String.valueOf(item.statusCode()), now);

        ProviderEvent latest = item.events().isEmpty() ? null : item.events().get(0);

        pkg.setStatus(newStatus);
        pkg.setLastChecked(now);
        pkg.setRawResponse(item.rawJson());
        pkg.setUpdatedAt(now);
        if (latest != null) {
            pkg.setLastEvent(latest.description());
            pkg.setLastEventDate(latest.date());
        }
        if (TrackingStatus.isTerminalCode(item.statusCode())) {
            if (pkg.getDeliveredDate() == null) {
                pkg.setDeliveredDate(now);
            }
            pkg.setActive(false);
            logger.info("{} delivered, no longer polling it", pkg.getTrackingNumber());
        }
        packageDAO.updateCheckedPackage(conn, pkg);

        if (newStatus.equals(oldStatus) && newEvents.isEmpty()) {
            return Optional.empty();
        }

        logger.info("{}: {} -> {} ({} new event(s))", pkg.getTrackingNumber(), oldStatus, newStatus, newEvents.size());
        LatestEvent latestEvent = latest == null ? null : new LatestEvent(latest.date(), latest.location(), latest.description());
        return Optional.of(new PackageUpdate(
                pkg.getTrackingNumber(),
                pkg.getDescription(),
                pkg.getCarrier(),
                oldStatus,
                newStatus,
                latestEvent,
                newEvents.size(),
                urlResolver.resolve(pkg.getTrackingNumber(), pkg.getCarrier())));
    }
}
