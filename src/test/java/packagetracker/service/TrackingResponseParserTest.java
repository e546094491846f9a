package packagetracker.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import packagetracker.service.dto.RegisterResponse;
import packagetracker.service.dto.TrackInfoItem;
import packagetracker.service.dto.TrackInfoResponse;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingResponseParserTest {

    private final TrackingResponseParser parser = new TrackingResponseParser(new ObjectMapper());

    @Test
    void parsesTrackInfoWithEventsNewestFirst() throws Exception {
        String payload = """
                {"code":0,"data":{"accepted":[{"number":"1z999aa10123456784","track":{"e":10,"z0":{"z":[
                  {"a":"2026-03-14 08:00","z":"Louisville, KY","c":"Departed facility"},
                  {"a":"2026-03-13 19:00","z":"","c":"Origin scan"}
                ]}}}],"rejected":[]}}
                """;

        TrackInfoResponse response = parser.parseTrackInfo(payload);

        assertThat(response.accepted()).hasSize(1);
        TrackInfoItem item = response.accepted().get(0);
        assertThat(item.number()).isEqualTo("1Z999AA10123456784");
        assertThat(item.statusCode()).isEqualTo(10);
        assertThat(item.events()).hasSize(2);
        assertThat(item.events().get(0).description()).isEqualTo("Departed facility");
        assertThat(item.events().get(0).location()).isEqualTo("Louisville, KY");
        assertThat(item.events().get(1).location()).isNull();
        assertThat(item.rawJson()).contains("Origin scan");
    }

    @Test
    void numbersAreUppercasedIndependentOfDefaultLocale() throws Exception {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            TrackInfoResponse response = parser.parseTrackInfo("{\"data\":{\"accepted\":[{\"number\":\"li123456789cn\"}]}}");

            assertThat(response.accepted().get(0).number()).isEqualTo("LI123456789CN");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void missingTrackMeansNotFoundWithoutEvents() throws Exception {
        TrackInfoResponse response = parser.parseTrackInfo("{\"data\":{\"accepted\":[{\"number\":\"ABC\"}]}}");

        assertThat(response.accepted().get(0).statusCode()).isZero();
        assertThat(response.accepted().get(0).events()).isEmpty();
    }

    @Test
    void missingListsAreEmpty() throws Exception {
        assertThat(parser.parseTrackInfo("{\"data\":{}}").accepted()).isEmpty();

        RegisterResponse register = parser.parseRegister("{\"data\":{}}");
        assertThat(register.accepted()).isEmpty();
        assertThat(register.rejected()).isEmpty();
    }

    @Test
    void rejectsStructurallyBrokenPayloads() {
        assertThatThrownBy(() -> parser.parseTrackInfo("{\"code\":0}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("data");
        assertThatThrownBy(() -> parser.parseTrackInfo("{\"data\":{\"accepted\":{}}}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("accepted");
        assertThatThrownBy(() -> parser.parseTrackInfo("{\"data\":{\"accepted\":[{\"track\":{\"e\":10}}]}}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("tracking number");
        assertThatThrownBy(() -> parser.parseTrackInfo("{\"data\":{\"accepted\":[{\"number\":\"A\",\"track\":{\"e\":\"10\"}}]}}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("not an integer");
        assertThatThrownBy(() -> parser.parseTrackInfo("<html>Bad Gateway</html>"))
                .isInstanceOf(MalformedResponseException.class);
        assertThatThrownBy(() -> parser.parseTrackInfo(""))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void parsesRegisterOutcomes() throws Exception {
        RegisterResponse response = parser.parseRegister("""
                {"code":0,"data":{
                  "accepted":[{"number":"1Z999AA10123456784","carrier":100002}],
                  "rejected":[
                    {"number":"RR123456789PT","error":{"code":-18010012,"message":"The number is already registered."}},
                    {"number":"BROKEN"}
                  ]}}
                """);

        assertThat(response.accepted()).singleElement().satisfies(a -> {
            assertThat(a.number()).isEqualTo("1Z999AA10123456784");
            assertThat(a.carrierCode()).isEqualTo(100002);
        });
        assertThat(response.rejected()).hasSize(2);
        assertThat(response.rejected().get(0).isAlreadyRegistered()).isTrue();
        assertThat(response.rejected().get(1).errorCode()).isEqualTo(-1);
        assertThat(response.rejected().get(1).errorMessage()).isEqualTo("Unknown error");
        assertThat(response.rawJson()).contains("already registered");
    }
}
