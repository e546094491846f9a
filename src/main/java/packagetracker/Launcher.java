package packagetracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.carrier.CarrierDetector;
import packagetracker.carrier.TrackingUrlResolver;
import packagetracker.config.TrackerConfig;
import packagetracker.dao.ApiUsageDAO;
import packagetracker.dao.PackageDAO;
import packagetracker.dao.TrackingEventDAO;
import packagetracker.db.DatabaseConnection;
import packagetracker.manager.PackageTrackingService;
import packagetracker.manager.RegistrationQuotaManager;
import packagetracker.manager.SyncResult;
import packagetracker.manager.TrackingSyncEngine;
import packagetracker.notification.NotificationFormatter;
import packagetracker.notification.PackageUpdate;
import packagetracker.service.SeventeenTrackClient;
import packagetracker.service.TrackingApi;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Arrays;

/**
 * Entry point for scheduled runs. Registers any packages still waiting for registration, runs one check
 * cycle and prints each notification to stdout for the messaging relay. Logs go to stderr.
 * <p>
 * Exit code 0 when the cycle completed, 1 otherwise. {@code --quiet} suppresses the summary line when
 * nothing changed.
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);
    private static final String SEPARATOR = "=".repeat(50);

    public static void main(String[] args) {
        boolean quiet = Arrays.asList(args).contains("--quiet") || Arrays.asList(args).contains("-q");
        System.exit(run(TrackerConfig.load(), quiet));
    }

    static int run(TrackerConfig config, boolean quiet) {
        Clock clock = Clock.systemUTC();
        try (DatabaseConnection db = new DatabaseConnection(config)) {
            PackageDAO packageDAO = new PackageDAO(db);
            TrackingEventDAO trackingEventDAO = new TrackingEventDAO(db);
            CarrierDetector carrierDetector = new CarrierDetector();
            TrackingUrlResolver urlResolver = new TrackingUrlResolver(carrierDetector);
            TrackingApi trackingApi = new SeventeenTrackClient(config);
            RegistrationQuotaManager quotaManager = new RegistrationQuotaManager(new ApiUsageDAO(db), clock);

            PackageTrackingService packageService = new PackageTrackingService(packageDAO, trackingEventDAO, quotaManager,
                    trackingApi, carrierDetector, urlResolver, clock);
            TrackingSyncEngine syncEngine = new TrackingSyncEngine(db, packageDAO, trackingEventDAO, trackingApi, urlResolver, clock);

            try {
                packageService.retryPendingRegistrations();
            } catch (SQLException e) {
                logger.error("Could not retry pending registrations: ", e);
            }

            SyncResult result = syncEngine.checkUpdates();
            for (PackageUpdate update : result.updates()) {
                System.out.println(SEPARATOR);
                System.out.println(NotificationFormatter.format(update));
                System.out.println(SEPARATOR);
            }

            if (!result.completed()) {
                logger.error("Check cycle failed: {}", result.error().orElse("unknown error"));
                return 1;
            }
            if (!quiet || !result.updates().isEmpty()) {
                for (PackageUpdate update : result.updates()) {
                    System.out.println("  " + NotificationFormatter.summaryLine(update));
                }
                System.out.println("Check complete. " + result.updates().size() + " update(s) found.");
            }
            return 0;
        } catch (RuntimeException e) {
            logger.error("Package check failed: ", e);
            return 1;
        }
    }
}
