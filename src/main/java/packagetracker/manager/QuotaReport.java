package packagetracker.manager;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Local registration usage next to the provider's own view of the quota.
 *
 * @param apiQuota provider payload passed through as-is, null when it could not be fetched
 * @param apiError why the provider quota is missing, null otherwise
 */
public record QuotaReport(String month, int registrationsUsed, int registrationsRemaining, JsonNode apiQuota, String apiError) {
}
