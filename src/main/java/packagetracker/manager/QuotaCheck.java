package packagetracker.manager;

/**
 * @param used    registrations consumed so far this month
 * @param allowed whether another registration may be attempted
 * @param warning true once usage has reached the warning threshold
 */
public record QuotaCheck(int used, boolean allowed, boolean warning) {
}
