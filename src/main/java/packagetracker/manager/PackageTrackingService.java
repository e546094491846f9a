package packagetracker.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.carrier.CarrierDetector;
import packagetracker.carrier.CarrierMatch;
import packagetracker.carrier.TrackingUrlResolver;
import packagetracker.dao.PackageDAO;
import packagetracker.dao.TrackingEventDAO;
import packagetracker.data.Package;
import packagetracker.service.ApiConfigurationException;
import packagetracker.service.TrackingApi;
import packagetracker.service.TrackingApiException;
import packagetracker.service.dto.AcceptedRegistration;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.RejectedRegistration;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Local package lifecycle: adding (with remote registration), removing, listing and inspecting packages.
 * <p>
 * Registration failures are handled as follows. A quota refusal or an explicit provider rejection leaves
 * nothing stored. A missing API key, a network failure or an unreadable reply still stores the package,
 * marked unregistered, and {@link #retryPendingRegistrations()} picks it up later. A pending package that the
 * provider later rejects is deactivated.
 * <p>
 * A registration is claimed from the monthly quota before the remote call and handed back unless the provider
 * accepted the number and the row was stored.
 */
public class PackageTrackingService {

    private static final Logger logger = LoggerFactory.getLogger(PackageTrackingService.class);

    private final PackageDAO packageDAO;
    private final TrackingEventDAO trackingEventDAO;
    private final RegistrationQuotaManager quotaManager;
    private final TrackingApi trackingApi;
    private final CarrierDetector carrierDetector;
    private final TrackingUrlResolver urlResolver;
    private final Clock clock;

    public PackageTrackingService(PackageDAO packageDAO, TrackingEventDAO trackingEventDAO, RegistrationQuotaManager quotaManager,
                                  TrackingApi trackingApi, CarrierDetector carrierDetector, TrackingUrlResolver urlResolver, Clock clock) {
        this.packageDAO = packageDAO;
        this.trackingEventDAO = trackingEventDAO;
        this.quotaManager = quotaManager;
        this.trackingApi = trackingApi;
        this.carrierDetector = carrierDetector;
        this.urlResolver = urlResolver;
        this.clock = clock;
    }

    /**
     * Starts tracking a number.
     *
     * @param description free-text note, may be null
     * @param carrier     carrier name overriding detection, may be null
     */
    public AddResult addPackage(String trackingNumber, String description, String carrier) {
        String tn = normalize(trackingNumber);
        if (tn.isEmpty()) {
            return AddResult.failure(FailureReason.INVALID_INPUT, "Tracking number cannot be empty");
        }

        List<String> warnings = new ArrayList<>();
        try {
            Optional<Package> existing = packageDAO.findPackageByTracking(tn);
            if (existing.isPresent()) {
                return reactivateOrReject(existing.get());
            }

            CarrierMatch detected = carrierDetector.detect(tn);
            String carrierName = carrier != null && !carrier.isBlank() ? carrier.trim() : detected.carrierName();

            QuotaCheck quota = quotaManager.check();
            if (quota.warning()) {
                String warning = String.format("Warning: %d/%d registrations used this month!", quota.used(), RegistrationQuotaManager.MONTHLY_LIMIT);
                logger.warn(warning);
                warnings.add(warning);
            }
            Optional<String> reservation = quota.allowed() ? quotaManager.tryReserve() : Optional.empty();
            if (reservation.isEmpty()) {
                int used = Math.max(quota.used(), RegistrationQuotaManager.MONTHLY_LIMIT);
                return AddResult.failure(FailureReason.QUOTA_EXCEEDED, String.format(
                        "Monthly registration limit reached (%d/%d). Wait for next month or upgrade your 17track plan.",
                        used, RegistrationQuotaManager.MONTHLY_LIMIT), warnings);
            }

            boolean charged = false;
            try {
                StoredAdd stored = registerAndStore(tn, carrierName, detected.carrierCode(), blankToNull(description), warnings);
                charged = stored.charged();
                return stored.result();
            } finally {
                if (!charged) {
                    releaseReservation(reservation.get());
                }
            }
        } catch (SQLException e) {
            logger.error("Database error adding package {}: ", tn, e);
            return AddResult.failure(FailureReason.STORAGE_ERROR, "Database error: " + e.getMessage(), warnings);
        }
    }

    /**
     * Registers the number remotely and inserts the row. The result is {@code charged} only when the provider
     * accepted a new registration and the row was stored.
     */
    private StoredAdd registerAndStore(String tn, String carrierName, int detectedCode, String description, List<String> warnings)
            throws SQLException {
        int carrierCode = detectedCode;
        boolean registered = false;
        boolean accepted = false;
        String rawResponse = null;
        try {
            RegisterResponse response = trackingApi.register(tn, carrierCode);
            rawResponse = response.rawJson();
            Registration registration = interpret(response);
            if (registration.rejection() != null) {
                RejectedRegistration rejected = registration.rejection();
                logger.warn("17track rejected {}: {} (code {})", tn, rejected.errorMessage(), rejected.errorCode());
                return new StoredAdd(AddResult.failure(FailureReason.REMOTE_REJECTED,
                        "17track rejected: " + rejected.errorMessage() + " (code " + rejected.errorCode() + ")", warnings), false);
            }
            registered = registration.registered();
            accepted = registration.accepted();
            if (!registered) {
                warnings.add("17track did not confirm the registration. Package saved locally; registration will be retried.");
            }
            if (registration.carrierCode() != 0) {
                carrierCode = registration.carrierCode();
            }
        } catch (ApiConfigurationException e) {
            logger.warn("{}", e.getMessage());
            warnings.add(e.getMessage() + " Package saved locally; it will be registered once an API key is configured.");
        } catch (TrackingApiException e) {
            logger.warn("17track registration failed for {}: {}", tn, e.getMessage());
            warnings.add("17track registration failed (" + e.getMessage() + "). Package saved locally; registration will be retried.");
        }

        Package pkg = new Package(tn, carrierName, carrierCode, description, OffsetDateTime.now(clock));
        pkg.setRegistered(registered);
        pkg.setRawResponse(rawResponse);
        try {
            packageDAO.addPackage(pkg);
        } catch (SQLIntegrityConstraintViolationException e) {
            return new StoredAdd(AddResult.failure(FailureReason.ALREADY_TRACKED, "Package " + tn + " is already being tracked", warnings), false);
        }

        if (accepted) {
            logger.info("Registered {} with 17track (quota: {}/{} this month)", tn, quotaManager.usedThisMonth(), RegistrationQuotaManager.MONTHLY_LIMIT);
        }
        AddResult result = new AddResult(true, null, "Package added successfully", pkg.getPackageId(), tn,
                carrierName == null ? "Auto-detect" : carrierName, registered, false, urlResolver.resolve(tn, carrierName), warnings);
        return new StoredAdd(result, accepted);
    }

    public OperationResult removePackage(String trackingNumber) {
        String tn = normalize(trackingNumber);
        if (tn.isEmpty()) {
            return OperationResult.failure(FailureReason.INVALID_INPUT, "Tracking number cannot be empty");
        }
        try {
            Optional<Package> existing = packageDAO.findPackageByTracking(tn);
            if (existing.isEmpty()) {
                return OperationResult.failure(FailureReason.NOT_FOUND, "Package " + tn + " not found in database");
            }
            if (!existing.get().isActive()) {
                return OperationResult.failure(FailureReason.ALREADY_INACTIVE, "Package " + tn + " is already inactive");
            }
            packageDAO.setActive(existing.get().getPackageId(), false, OffsetDateTime.now(clock));
            logger.info("Stopped tracking {}", tn);
            return OperationResult.success("Stopped tracking " + tn);
        } catch (SQLException e) {
            logger.error("Database error removing package {}: ", tn, e);
            return OperationResult.failure(FailureReason.STORAGE_ERROR, "Database error: " + e.getMessage());
        }
    }

    public List<Package> listPackages(boolean activeOnly) throws SQLException {
        return packageDAO.listPackages(activeOnly);
    }

    /**
     * @return the package with its full history, or empty if the number is not stored
     */
    public Optional<PackageDetails> getDetails(String trackingNumber) throws SQLException {
        String tn = normalize(trackingNumber);
        Optional<Package> pkg = packageDAO.findPackageByTracking(tn);
        if (pkg.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PackageDetails(
                pkg.get(),
                trackingEventDAO.findEventsForPackage(pkg.get().getPackageId()),
                urlResolver.resolve(tn, pkg.get().getCarrier())));
    }

    public QuotaReport getApiQuota() throws SQLException {
        int used = quotaManager.usedThisMonth();
        int remaining = Math.max(0, RegistrationQuotaManager.MONTHLY_LIMIT - used);
        try {
            return new QuotaReport(quotaManager.currentMonth(), used, remaining, trackingApi.getQuota(), null);
        } catch (ApiConfigurationException e) {
            return new QuotaReport(quotaManager.currentMonth(), used, remaining, null, e.getMessage());
        } catch (TrackingApiException e) {
            logger.warn("Failed to fetch 17track quota: {}", e.getMessage());
            return new QuotaReport(quotaManager.currentMonth(), used, remaining, null, "Failed to fetch quota: " + e.getMessage());
        }
    }

    /**
     * Registers active packages that were stored while the provider was unreachable or unconfigured.
     * Stops at the first quota refusal or remote failure.
     *
     * @return how many packages are now registered
     */
    public int retryPendingRegistrations() throws SQLException {
        List<Package> pending = packageDAO.findUnregisteredActivePackages();
        int registeredCount = 0;
        for (Package pkg : pending) {
            Optional<String> reservation = quotaManager.tryReserve();
            if (reservation.isEmpty()) {
                logger.warn("Monthly registration limit reached, {} package(s) left unregistered", pending.size() - registeredCount);
                break;
            }
            boolean charged = false;
            try {
                RegisterResponse response = trackingApi.register(pkg.getTrackingNumber(), pkg.getCarrierCode());
                Registration registration = interpret(response);
                if (registration.registered()) {
                    int carrierCode = registration.carrierCode() != 0 ? registration.carrierCode() : pkg.getCarrierCode();
                    packageDAO.markRegistered(pkg.getPackageId(), carrierCode, response.rawJson(), OffsetDateTime.now(clock));
                    charged = registration.accepted();
                    registeredCount++;
                } else if (registration.rejection() != null) {
                    logger.warn("17track rejected pending package {}: {} (code {}), no longer tracking it", pkg.getTrackingNumber(),
                            registration.rejection().errorMessage(), registration.rejection().errorCode());
                    packageDAO.setActive(pkg.getPackageId(), false, OffsetDateTime.now(clock));
                }
            } catch (TrackingApiException e) {
                logger.warn("Could not register pending packages: {}", e.getMessage());
                break;
            } finally {
                if (!charged) {
                    releaseReservation(reservation.get());
                }
            }
        }
        if (registeredCount > 0) {
            logger.info("Registered {} previously pending package(s)", registeredCount);
        }
        return registeredCount;
    }

    private AddResult reactivateOrReject(Package existing) throws SQLException {
        String tn = existing.getTrackingNumber();
        if (existing.isActive()) {
            return AddResult.failure(FailureReason.ALREADY_TRACKED, "Package " + tn + " is already being tracked");
        }
        packageDAO.setActive(existing.getPackageId(), true, OffsetDateTime.now(clock));
        logger.info("Reactivated {}", tn);
        return new AddResult(true, null, "Package reactivated", existing.getPackageId(), tn,
                existing.getCarrier() == null ? "Auto-detect" : existing.getCarrier(), existing.isRegistered(), true,
                urlResolver.resolve(tn, existing.getCarrier()), List.of());
    }

    /**
     * Reads a register response. "Already registered" counts as registered but was not charged by the provider.
     */
    private Registration interpret(RegisterResponse response) {
        if (!response.accepted().isEmpty()) {
            AcceptedRegistration accepted = response.accepted().get(0);
            return new Registration(true, true, accepted.carrierCode(), null);
        }
        if (!response.rejected().isEmpty()) {
            RejectedRegistration rejected = response.rejected().get(0);
            if (rejected.isAlreadyRegistered()) {
                return new Registration(true, false, 0, null);
            }
            return new Registration(false, false, 0, rejected);
        }
        logger.warn("17track register response had neither accepted nor rejected entries");
        return new Registration(false, false, 0, null);
    }

    private void releaseReservation(String month) {
        try {
            quotaManager.release(month);
        } catch (SQLException e) {
            logger.error("Could not release unused registration for {}: ", month, e);
        }
    }

    private static String normalize(String trackingNumber) {
        return trackingNumber == null ? "" : trackingNumber.trim().toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record Registration(boolean registered, boolean accepted, int carrierCode, RejectedRegistration rejection) {
    }

    private record StoredAdd(AddResult result, boolean charged) {
    }
}
