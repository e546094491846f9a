package packagetracker.manager;

import packagetracker.dao.ApiUsageDAO;

import java.sql.SQLException;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Keeps registrations inside the provider's free tier of 100 per calendar month (UTC).
 * Status polling is not metered and never goes through here.
 */
public class RegistrationQuotaManager {

    public static final String API_NAME = "17track";
    public static final int MONTHLY_LIMIT = 100;
    public static final int WARNING_THRESHOLD = 95;

    private final ApiUsageDAO apiUsageDAO;
    private final Clock clock;

    public RegistrationQuotaManager(ApiUsageDAO apiUsageDAO, Clock clock) {
        this.apiUsageDAO = apiUsageDAO;
        this.clock = clock;
    }

    public int usedThisMonth() throws SQLException {
        return apiUsageDAO.getRegistrationsUsed(API_NAME, currentMonth());
    }

    /**
     * Records one confirmed registration against the current month, opening a new counter when the month has
     * none yet. Call only after the provider accepted the number.
     */
    public void incrementIfNewMonth() throws SQLException {
        apiUsageDAO.incrementRegistrations(API_NAME, currentMonth());
    }

    /**
     * Holds one registration for an attempt that is about to be made. The hold is kept when the
     * attempt is accepted and stored, and handed back with {@link #release(String)} otherwise.
     *
     * @return the month the hold was taken in, or empty if the monthly limit is reached
     */
    public Optional<String> tryReserve() throws SQLException {
        String month = currentMonth();
        return apiUsageDAO.tryReserveRegistration(API_NAME, month, MONTHLY_LIMIT) ? Optional.of(month) : Optional.empty();
    }

    public void release(String month) throws SQLException {
        apiUsageDAO.releaseRegistration(API_NAME, month);
    }

    public QuotaCheck check() throws SQLException {
        int used = usedThisMonth();
        return new QuotaCheck(used, used < MONTHLY_LIMIT, used >= WARNING_THRESHOLD);
    }

    public int remaining() throws SQLException {
        return Math.max(0, MONTHLY_LIMIT - usedThisMonth());
    }

    public String currentMonth() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC)).toString();
    }
}
