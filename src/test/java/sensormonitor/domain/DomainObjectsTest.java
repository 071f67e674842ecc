package sensormonitor.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DomainObjectsTest {

    private static final Instant T0 = Instant.parse("2026-10-16T10:00:00Z");

    @Test
    @DisplayName("Sample should keep field insertion order")
    void testSampleOrder() {
        Sample sample = Samples.of("temperature", 21.5, "humidity_out", 40, "flame_status", 0);

        assertThat(sample.fieldNames()).containsExactly("temperature", "humidity_out", "flame_status");
    }

    @Test
    @DisplayName("Sample typed accessors should report missing fields as empty")
    void testSampleAccessors() {
        Sample sample = Samples.of("temperature", 21.5, "online", true, "flame_status", 1);

        assertThat(sample.number("temperature")).hasValue(21.5);
        assertThat(sample.number("online")).isEmpty();
        assertThat(sample.number("missing")).isEmpty();
        assertThat(sample.flag("online")).contains(true);
        assertThat(sample.flag("flame_status")).contains(true);
        assertThat(Samples.of("flame", 0).flag("flame")).contains(false);
        assertThat(sample.flag("missing")).isEmpty();
        assertThat(sample.value("temperature")).contains(21.5);
        assertThat(sample.contains("temperature")).isTrue();
        assertThat(sample.contains("gas_level")).isFalse();
    }

    @Test
    @DisplayName("Sample should be unaffected by later changes to the source map")
    void testSampleIsImmutable() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("temperature", 20);
        Sample sample = new Sample(source);

        source.put("temperature", 99);
        source.put("smoke", 5);

        assertThat(sample.values()).containsOnly(entry("temperature", 20));
        assertThatThrownBy(() -> sample.values().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Sample should reject values that are neither numbers nor booleans")
    void testSampleRejectsUnsupportedValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("label", "kitchen");

        assertThatThrownBy(() -> new Sample(values))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("label");
    }

    @Test
    @DisplayName("Snapshot delta should be rounded to two decimals")
    void testSnapshotDelta() {
        DeviceSnapshot snapshot = new DeviceSnapshot("jadwiga",
                Samples.of("temperature", 22.13, "smoke", 4),
                Samples.of("temperature", 21.1),
                List.of(), T0, T0, 2);

        assertThat(snapshot.delta("temperature")).hasValue(1.03);
        assertThat(snapshot.delta("smoke")).isEmpty();
        assertThat(snapshot.hasPrevious()).isTrue();
    }

    @Test
    @DisplayName("Snapshot without previous sample should have no delta")
    void testSnapshotDeltaWithoutPrevious() {
        DeviceSnapshot snapshot = new DeviceSnapshot("jadwiga",
                Samples.of("temperature", 21.5), null,
                List.of(Samples.of("temperature", 21.5)), T0, T0, 1);

        assertThat(snapshot.delta("temperature")).isEmpty();
        assertThat(snapshot.previousSample()).isEmpty();
        assertThat(snapshot.latestSample()).contains(Samples.of("temperature", 21.5));
    }

    @Test
    @DisplayName("Snapshot series should skip samples without the field")
    void testSnapshotSeries() {
        DeviceSnapshot snapshot = new DeviceSnapshot("garaz", null, null, List.of(
                Samples.of("temperature", 20),
                Samples.of("smoke", 3),
                Samples.of("temperature", 21.5)), T0, T0, 3);

        assertThat(snapshot.series("temperature")).containsExactly(20.0, 21.5);
        assertThat(snapshot.series("gyro_x")).isEmpty();
    }

    @Test
    @DisplayName("Connection status transitions should keep the broker address")
    void testConnectionStatus() {
        ConnectionStatus status = ConnectionStatus.disconnected("tcp://localhost:1883");

        ConnectionStatus connected = status.transition(ConnectionState.CONNECTED);

        assertThat(status.isConnected()).isFalse();
        assertThat(connected.isConnected()).isTrue();
        assertThat(connected.brokerAddress()).isEqualTo("tcp://localhost:1883");
    }

    @Test
    @DisplayName("Dashboard frame should order devices by id and serialize to JSON")
    void testDashboardFrame() throws Exception {
        DeviceSnapshot jadwiga = new DeviceSnapshot("jadwiga", Samples.of("temperature", 21.5), null,
                List.of(Samples.of("temperature", 21.5)), T0, T0, 1);
        DeviceSnapshot garaz = new DeviceSnapshot("garaz", Samples.of("gas_level", 800), null,
                List.of(Samples.of("gas_level", 800)), T0, T0, 1);
        Map<String, DeviceSnapshot> devices = new HashMap<>();
        devices.put("jadwiga", jadwiga);
        devices.put("garaz", garaz);

        DashboardFrame frame = new DashboardFrame(T0,
                new ConnectionStatus(ConnectionState.CONNECTED, "tcp://broker:1883", T0),
                "sensor/+", devices);

        assertThat(frame.devices().keySet()).containsExactly("garaz", "jadwiga");
        assertThat(frame.deviceCount()).isEqualTo(2);
        assertThat(frame.isConnected()).isTrue();

        JsonNode json = new ObjectMapper().readTree(frame.toJSON());
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-10-16T10:00:00Z");
        assertThat(json.get("topic").asText()).isEqualTo("sensor/+");
        assertThat(json.get("connection").get("state").asText()).isEqualTo("CONNECTED");
        assertThat(json.get("devices").get("jadwiga").get("latest").get("temperature").asDouble())
                .isEqualTo(21.5);
        assertThat(json.get("devices").get("garaz").get("history")).hasSize(1);
        assertThat(json.get("devices").get("garaz").get("previous").isNull()).isTrue();
    }
}
