package packagetracker.data;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingStatusTest {

    @Test
    void knownCodesMapToLabels() {
        assertThat(TrackingStatus.labelFor(0)).isEqualTo("Not Found");
        assertThat(TrackingStatus.labelFor(10)).isEqualTo("In Transit");
        assertThat(TrackingStatus.labelFor(20)).isEqualTo("Expired");
        assertThat(TrackingStatus.labelFor(30)).isEqualTo("Pick Up");
        assertThat(TrackingStatus.labelFor(35)).isEqualTo("Undelivered");
        assertThat(TrackingStatus.labelFor(40)).isEqualTo("Delivered");
        assertThat(TrackingStatus.labelFor(50)).isEqualTo("Alert");
    }

    @Test
    void unknownCodesGetASyntheticLabel() {
        assertThat(TrackingStatus.fromCode(99)).isEmpty();
        assertThat(TrackingStatus.labelFor(99)).isEqualTo("Unknown (99)");
    }

    @Test
    void onlyDeliveredIsTerminal() {
        assertThat(TrackingStatus.isTerminalCode(40)).isTrue();
        assertThat(TrackingStatus.isTerminalCode(35)).isFalse();
        assertThat(TrackingStatus.isTerminalCode(99)).isFalse();
    }
}
