package packagetracker.manager;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import packagetracker.dao.ApiUsageDAO;
import packagetracker.db.DatabaseConnection;
import packagetracker.db.TestDatabases;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RegistrationQuotaManagerTest {

    private static final Clock MARCH = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
    private static final Clock APRIL = Clock.fixed(Instant.parse("2026-04-01T00:00:05Z"), ZoneOffset.UTC);

    private DatabaseConnection db;
    private ApiUsageDAO apiUsageDAO;
    private RegistrationQuotaManager quotaManager;

    @BeforeEach
    void setUp() {
        db = new DatabaseConnection(TestDatabases.inMemoryConfig());
        apiUsageDAO = new ApiUsageDAO(db);
        quotaManager = new RegistrationQuotaManager(apiUsageDAO, MARCH);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void consume(int registrations) throws SQLException {
        for (int i = 0; i < registrations; i++) {
            quotaManager.incrementIfNewMonth();
        }
    }

    @Test
    void freshMonthStartsAtZero() throws SQLException {
        assertThat(quotaManager.currentMonth()).isEqualTo("2026-03");
        assertThat(quotaManager.usedThisMonth()).isZero();
        assertThat(quotaManager.remaining()).isEqualTo(RegistrationQuotaManager.MONTHLY_LIMIT);
        assertThat(quotaManager.check()).isEqualTo(new QuotaCheck(0, true, false));
    }

    @Test
    void incrementsCreateThenGrowTheMonthlyCounter() throws SQLException {
        consume(3);

        assertThat(quotaManager.usedThisMonth()).isEqualTo(3);
        assertThat(apiUsageDAO.getRegistrationsUsed(RegistrationQuotaManager.API_NAME, "2026-03")).isEqualTo(3);
    }

    @Test
    void aNewMonthHasItsOwnCounter() throws SQLException {
        consume(2);
        RegistrationQuotaManager nextMonth = new RegistrationQuotaManager(apiUsageDAO, APRIL);

        assertThat(nextMonth.currentMonth()).isEqualTo("2026-04");
        assertThat(nextMonth.usedThisMonth()).isZero();

        nextMonth.incrementIfNewMonth();
        assertThat(nextMonth.usedThisMonth()).isEqualTo(1);
        assertThat(quotaManager.usedThisMonth()).isEqualTo(2);
    }

    @Test
    void warnsFromNinetyFiveAndRefusesAtTheLimit() throws SQLException {
        consume(94);
        assertThat(quotaManager.check()).isEqualTo(new QuotaCheck(94, true, false));

        consume(1);
        assertThat(quotaManager.check()).isEqualTo(new QuotaCheck(95, true, true));

        consume(5);
        assertThat(quotaManager.check()).isEqualTo(new QuotaCheck(100, false, true));
        assertThat(quotaManager.remaining()).isZero();
    }

    @Test
    void reservationStopsExactlyAtTheLimit() throws SQLException {
        consume(98);

        assertThat(quotaManager.tryReserve()).contains("2026-03");
        assertThat(quotaManager.tryReserve()).contains("2026-03");
        assertThat(quotaManager.tryReserve()).isEmpty();
        assertThat(quotaManager.usedThisMonth()).isEqualTo(RegistrationQuotaManager.MONTHLY_LIMIT);
    }

    @Test
    void firstReservationOfTheMonthCreatesTheCounter() throws SQLException {
        assertThat(quotaManager.tryReserve()).contains("2026-03");
        assertThat(quotaManager.usedThisMonth()).isEqualTo(1);
    }

    @Test
    void releasedReservationIsGivenBackToItsOwnMonth() throws SQLException {
        consume(2);
        String month = quotaManager.tryReserve().orElseThrow();
        assertThat(quotaManager.usedThisMonth()).isEqualTo(3);

        quotaManager.release(month);
        assertThat(quotaManager.usedThisMonth()).isEqualTo(2);

        new RegistrationQuotaManager(apiUsageDAO, APRIL).release("2026-04");
        assertThat(apiUsageDAO.getRegistrationsUsed(RegistrationQuotaManager.API_NAME, "2026-04")).isZero();
    }
}
