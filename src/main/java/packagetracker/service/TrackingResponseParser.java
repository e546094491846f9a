package packagetracker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import packagetracker.service.dto.AcceptedRegistration;
import packagetracker.service.dto.ProviderEvent;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.RejectedRegistration;
import packagetracker.service.dto.TrackInfoItem;
import packagetracker.service.dto.TrackInfoResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns provider JSON into typed records. Anything structurally wrong is reported as a
 * {@link MalformedResponseException} here instead of surfacing later as a missing value.
 */
public class TrackingResponseParser {

    private final ObjectMapper objectMapper;

    public TrackingResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(String body) throws MalformedResponseException {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException("Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public RegisterResponse parseRegister(String body) throws MalformedResponseException {
        JsonNode data = requireData(readTree(body));

        List<AcceptedRegistration> accepted = new ArrayList<>();
        for (JsonNode entry : arrayField(data, "accepted")) {
            accepted.add(new AcceptedRegistration(entry.path("number").asText(""), entry.path("carrier").asInt(0)));
        }

        List<RejectedRegistration> rejected = new ArrayList<>();
        for (JsonNode entry : arrayField(data, "rejected")) {
            JsonNode error = entry.path("error");
            rejected.add(new RejectedRegistration(
                    entry.path("number").asText(""),
                    error.path("code").asInt(-1),
                    error.path("message").asText("Unknown error")));
        }
        return new RegisterResponse(accepted, rejected, body);
    }

    public TrackInfoResponse parseTrackInfo(String body) throws MalformedResponseException {
        JsonNode data = requireData(readTree(body));

        List<TrackInfoItem> items = new ArrayList<>();
        for (JsonNode entry : arrayField(data, "accepted")) {
            items.add(parseTrackInfoItem(entry));
        }
        return new TrackInfoResponse(items);
    }

    private TrackInfoItem parseTrackInfoItem(JsonNode entry) throws MalformedResponseException {
        JsonNode number = entry.get("number");
        if (number == null || !number.isTextual() || number.asText().isBlank()) {
            throw new MalformedResponseException("Accepted item has no tracking number: " + entry);
        }

        JsonNode track = entry.path("track");
        int statusCode = 0;
        JsonNode statusNode = track.get("e");
        if (statusNode != null && !statusNode.isNull()) {
            if (!statusNode.canConvertToInt() || !statusNode.isIntegralNumber()) {
                throw new MalformedResponseException("Status code for " + number.asText() + " is not an integer: " + statusNode);
            }
            statusCode = statusNode.intValue();
        }

        List<ProviderEvent> events = new ArrayList<>();
        for (JsonNode event : arrayField(track.path("z0"), "z")) {
            String location = event.path("z").asText("");
            events.add(new ProviderEvent(
                    event.path("a").asText(""),
                    location.isBlank() ? null : location,
                    event.path("c").asText("")));
        }

        return new TrackInfoItem(number.asText().trim().toUpperCase(Locale.ROOT), statusCode, events, entry.toString());
    }

    private static JsonNode requireData(JsonNode root) throws MalformedResponseException {
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new MalformedResponseException("Response has no 'data' object: " + abbreviate(root.toString()));
        }
        return data;
    }

    private static Iterable<JsonNode> arrayField(JsonNode parent, String field) throws MalformedResponseException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedResponseException("Field '" + field + "' is not an array");
        }
        return node;
    }

    static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200);
    }
}
