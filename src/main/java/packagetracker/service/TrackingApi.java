package packagetracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.TrackInfoResponse;

import java.util.List;

/**
 * Remote carrier-aggregation API.
 */
public interface TrackingApi {

    /**
     * Binds a number to the provider's monitoring. Each accepted registration costs one unit of monthly quota.
     *
     * @param carrierCode provider carrier code, 0 lets the provider detect it
     */
    RegisterResponse register(String trackingNumber, int carrierCode) throws TrackingApiException;

    /**
     * Fetches current status and history for already registered numbers in a single request.
     */
    TrackInfoResponse getTrackInfo(List<String> trackingNumbers) throws TrackingApiException;

    /**
     * Returns the provider's own quota report, untouched.
     */
    JsonNode getQuota() throws TrackingApiException;
}
