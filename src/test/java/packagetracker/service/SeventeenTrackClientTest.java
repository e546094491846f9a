package packagetracker.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import packagetracker.config.TrackerConfig;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.TrackInfoResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeventeenTrackClientTest {

    private HttpServer server;
    private final List<String> tokens = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/gettrackinfo", exchange -> reply(exchange, 200, """
                {"code":0,"data":{"accepted":[{"number":"1Z999AA10123456784","track":{"e":10,"z0":{"z":[
                  {"a":"2026-03-14 08:00","z":"Louisville, KY","c":"Departed facility"}]}}}],"rejected":[]}}
                """));
        server.createContext("/register", exchange -> reply(exchange, 200, """
                {"code":0,"data":{"accepted":[{"number":"1Z999AA10123456784","carrier":100002}],"rejected":[]}}
                """));
        server.createContext("/getquota", exchange -> reply(exchange, 200, """
                {"code":0,"data":{"quota_total":100,"quota_used":7,"quota_remain":93}}
                """));
        server.createContext("/broken", exchange -> reply(exchange, 503, "upstream unavailable"));
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void reply(HttpExchange exchange, int status, String body) throws IOException {
        tokens.add(String.valueOf(exchange.getRequestHeaders().getFirst("17token")));
        bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private TrackerConfig config(String baseUrl, String apiKey) {
        return new TrackerConfig("jdbc:h2:mem:unused", "sa", "", baseUrl, apiKey, Duration.ofSeconds(5));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    void batchTrackInfoSendsTokenAndAllNumbers() throws Exception {
        SeventeenTrackClient client = new SeventeenTrackClient(config(baseUrl(), "secret-token"));

        TrackInfoResponse response = client.getTrackInfo(List.of("1Z999AA10123456784", "RR123456789PT"));

        assertThat(tokens).containsExactly("secret-token");
        assertThat(bodies).containsExactly("[{\"number\":\"1Z999AA10123456784\"},{\"number\":\"RR123456789PT\"}]");
        assertThat(response.accepted()).singleElement().satisfies(item -> {
            assertThat(item.statusCode()).isEqualTo(10);
            assertThat(item.events()).hasSize(1);
        });
    }

    @Test
    void registerPostsNumberWithCarrierCode() throws Exception {
        SeventeenTrackClient client = new SeventeenTrackClient(config(baseUrl(), "secret-token"));

        RegisterResponse response = client.register("1Z999AA10123456784", 100002);

        assertThat(bodies).containsExactly("[{\"number\":\"1Z999AA10123456784\",\"carrier\":100002}]");
        assertThat(response.accepted()).hasSize(1);
    }

    @Test
    void quotaIsPassedThroughUntouched() throws Exception {
        SeventeenTrackClient client = new SeventeenTrackClient(config(baseUrl(), "secret-token"));

        JsonNode quota = client.getQuota();

        assertThat(quota.path("data").path("quota_remain").asInt()).isEqualTo(93);
    }

    @Test
    void missingKeyFailsBeforeAnyRequest() {
        SeventeenTrackClient client = new SeventeenTrackClient(config(baseUrl(), ""));

        assertThatThrownBy(() -> client.getTrackInfo(List.of("1Z999AA10123456784")))
                .isInstanceOf(ApiConfigurationException.class)
                .hasMessageContaining(TrackerConfig.API_KEY_ENV);
        assertThat(tokens).isEmpty();
    }

    @Test
    void nonSuccessStatusBecomesTransportError() {
        SeventeenTrackClient client = new SeventeenTrackClient(config(baseUrl() + "/broken", "secret-token"));

        assertThatThrownBy(() -> client.getQuota())
                .isInstanceOfSatisfying(ApiTransportException.class, e -> {
                    assertThat(e.getHttpStatus()).hasValue(503);
                    assertThat(e.getMessage()).contains("503").contains("upstream unavailable");
                });
    }

    @Test
    void unreachableHostBecomesTransportError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        SeventeenTrackClient client = new SeventeenTrackClient(config("http://127.0.0.1:" + port, "secret-token"));

        assertThatThrownBy(() -> client.getTrackInfo(List.of("X")))
                .isInstanceOf(ApiTransportException.class);
    }
}
