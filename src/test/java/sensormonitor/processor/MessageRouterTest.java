package sensormonitor.processor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sensormonitor.domain.RoutedMessage;
import sensormonitor.domain.Sample;
import sensormonitor.domain.Samples;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class MessageRouterTest {

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should route a message to the device named by the last topic segment")
    void testRouteValidMessage() {
        RoutedMessage message = router.route("sensor/jadwiga", bytes("{\"temperature\": 21.5}"));

        assertThat(message.deviceId()).isEqualTo("jadwiga");
        assertThat(message.sample()).isEqualTo(Samples.of("temperature", 21.5));
    }

    @Test
    @DisplayName("Should resolve device ids from topics")
    void testDeviceIdOf() {
        assertThat(MessageRouter.deviceIdOf("sensor/garaz")).isEqualTo("garaz");
        assertThat(MessageRouter.deviceIdOf("plant/hall/line1/motor")).isEqualTo("motor");
        assertThat(MessageRouter.deviceIdOf("sensor/all")).isEqualTo("all");
        assertThat(MessageRouter.deviceIdOf("sensor")).isEqualTo(MessageRouter.UNKNOWN_DEVICE);
        assertThat(MessageRouter.deviceIdOf("sensor/")).isEqualTo(MessageRouter.UNKNOWN_DEVICE);
        assertThat(MessageRouter.deviceIdOf("")).isEqualTo(MessageRouter.UNKNOWN_DEVICE);
        assertThat(MessageRouter.deviceIdOf(null)).isEqualTo(MessageRouter.UNKNOWN_DEVICE);
    }

    @Test
    @DisplayName("Should route a topic without delimiter to the unknown device")
    void testRouteTopicWithoutDelimiter() {
        RoutedMessage message = router.route("sensor", bytes("{\"smoke\": 3}"));

        assertThat(message.deviceId()).isEqualTo("unknown");
        assertThat(message.sample().number("smoke")).hasValue(3.0);
    }

    @Test
    @DisplayName("Should keep numeric and boolean fields in document order")
    void testKeepsOnlyNumericAndBooleanFields() {
        String json = """
            {
                "temperature_out": 4.5,
                "label": "garage",
                "flame_status": 0,
                "armed": true,
                "tags": [1, 2],
                "meta": {"fw": 3},
                "humidity_out": 81,
                "note": null
            }
            """;

        Sample sample = router.route("sensor/garaz", bytes(json)).sample();

        assertThat(sample.fieldNames()).containsExactly("temperature_out", "flame_status", "armed", "humidity_out");
        assertThat(sample.flag("armed")).contains(true);
        assertThat(sample.number("humidity_out")).hasValue(81.0);
    }

    @Test
    @DisplayName("Should drop non-finite numbers written by failed sensor reads")
    void testDropsNonFiniteNumbers() {
        Sample sample = router.route("sensor/jadwiga",
                bytes("{\"temperature\": NaN, \"humidity_out\": Infinity, \"gas_level\": 512}")).sample();

        assertThat(sample.fieldNames()).containsExactly("gas_level");
    }

    @Test
    @DisplayName("Should accept an empty JSON object")
    void testEmptyObject() {
        Sample sample = router.route("sensor/jadwiga", bytes("{}")).sample();

        assertThat(sample.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject a payload that is not JSON")
    void testRejectGarbage() {
        byte[] payload = bytes("not-json-garbage");

        MalformedPayloadException ex = catchThrowableOfType(
                () -> router.route("sensor/jadwiga", payload), MalformedPayloadException.class);

        assertThat(ex).hasMessageContaining("not-json-garbage");
        assertThat(ex.getRawPayload()).isEqualTo(payload);
        assertThat(ex.getRawPayloadText()).isEqualTo("not-json-garbage");
        assertThat(ex.getTopic()).isEqualTo("sensor/jadwiga");
    }

    @Test
    @DisplayName("Should reject payloads that are not valid UTF-8")
    void testRejectInvalidUtf8() {
        byte[] badFieldName = {'{', '"', 't', 'e', 'm', 'p', (byte) 0xFF, '"', ':', ' ', '1', '}'};
        byte[] badStringValue = {'{', '"', 'l', 'a', 'b', 'e', 'l', '"', ':', '"', (byte) 0xC3, '"',
                ',', '"', 't', '"', ':', '1', '}'};

        MalformedPayloadException ex = catchThrowableOfType(
                () -> router.route("sensor/jadwiga", badFieldName), MalformedPayloadException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getRawPayload()).isEqualTo(badFieldName);
        assertThatThrownBy(() -> router.route("sensor/jadwiga", badStringValue))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject JSON whose root is not an object")
    void testRejectNonObjectRoot() {
        assertThatThrownBy(() -> router.route("sensor/jadwiga", bytes("42")))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> router.route("sensor/jadwiga", bytes("[{\"temperature\": 1}]")))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject empty payloads and trailing garbage")
    void testRejectEmptyAndTrailing() {
        assertThatThrownBy(() -> router.route("sensor/jadwiga", new byte[0]))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> router.route("sensor/jadwiga", bytes("{\"temperature\": 1} trailing")))
                .isInstanceOf(MalformedPayloadException.class);
        assertThatThrownBy(() -> router.route("sensor/jadwiga", bytes("{\"temperature\": 1")))
                .isInstanceOf(MalformedPayloadException.class);
    }
}
