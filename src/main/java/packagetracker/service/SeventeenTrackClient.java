package packagetracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import packagetracker.config.TrackerConfig;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.TrackInfoResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;

/**
 * {@link TrackingApi} backed by the 17track v2.2 REST endpoints.
 */
public class SeventeenTrackClient implements TrackingApi {

    private static final Logger logger = LoggerFactory.getLogger(SeventeenTrackClient.class);

    private final TrackerConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrackingResponseParser parser;

    public SeventeenTrackClient(TrackerConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.apiTimeout()).build(), new ObjectMapper());
    }

    public SeventeenTrackClient(TrackerConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = new TrackingResponseParser(objectMapper);
    }

    @Override
    public RegisterResponse register(String trackingNumber, int carrierCode) throws TrackingApiException {
        ArrayNode payload = objectMapper.createArrayNode();
        payload.addObject().put("number", trackingNumber).put("carrier", carrierCode);
        String body = post("/register", payload);
        return parser.parseRegister(body);
    }

    @Override
    public TrackInfoResponse getTrackInfo(List<String> trackingNumbers) throws TrackingApiException {
        ArrayNode payload = objectMapper.createArrayNode();
        for (String number : trackingNumbers) {
            payload.addObject().put("number", number);
        }
        String body = post("/gettrackinfo", payload);
        return parser.parseTrackInfo(body);
    }

    @Override
    public JsonNode getQuota() throws TrackingApiException {
        HttpRequest request = requestBuilder("/getquota").GET().build();
        return parser.readTree(send(request));
    }

    private String post(String path, JsonNode payload) throws TrackingApiException {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TrackingApiException("Could not serialize request for " + path, e);
        }
        HttpRequest request = requestBuilder(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request);
    }

    private HttpRequest.Builder requestBuilder(String path) throws ApiConfigurationException {
        if (!config.hasApiKey()) {
            throw new ApiConfigurationException(TrackerConfig.API_KEY_ENV + " is not set. "
                    + "Get a free API key at https://admin.17track.net and add it to the environment or config.properties");
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(config.apiBaseUrl() + path))
                .timeout(config.apiTimeout())
                .header("17token", config.apiKey());
    }

    private String send(HttpRequest request) throws TrackingApiException {
        logger.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ApiTransportException("Timed out calling 17track " + request.uri().getPath(), e);
        } catch (IOException e) {
            throw new ApiTransportException("Could not connect to 17track API: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiTransportException("Interrupted while calling 17track " + request.uri().getPath(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : TrackingResponseParser.abbreviate(response.body());
            throw new ApiTransportException("17track API returned HTTP " + status + ": " + body, status);
        }
        return response.body();
    }
}
