package sensormonitor.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import sensormonitor.domain.DeviceSnapshot;
import sensormonitor.domain.Samples;
import sensormonitor.processor.MessageRouter;
import sensormonitor.store.DeviceTable;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class TelemetryIngestorTest {

    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");

    private DeviceTable table;
    private TelemetryIngestor ingestor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        table = new DeviceTable(100, clock);
        ingestor = new TelemetryIngestor(new MessageRouter(), table, clock);
    }

    private void send(String topic, String payload) {
        ingestor.onMessage(topic, payload.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("First message should create the device with a single sample")
    void testFirstMessageCreatesDevice() {
        send("sensor/jadwiga", "{\"temperature\": 21.5}");

        DeviceSnapshot snapshot = table.snapshot("jadwiga").orElseThrow();
        assertThat(snapshot.latest()).isEqualTo(Samples.of("temperature", 21.5));
        assertThat(snapshot.previous()).isNull();
        assertThat(snapshot.history()).containsExactly(Samples.of("temperature", 21.5));
        assertThat(snapshot.lastUpdate()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Next message should rotate the previous sample")
    void testSecondMessageRotates() {
        send("sensor/jadwiga", "{\"temperature\": 21.5}");
        send("sensor/jadwiga", "{\"temperature\": 22.0}");

        DeviceSnapshot snapshot = table.snapshot("jadwiga").orElseThrow();
        assertThat(snapshot.previous()).isEqualTo(Samples.of("temperature", 21.5));
        assertThat(snapshot.latest()).isEqualTo(Samples.of("temperature", 22.0));
        assertThat(snapshot.history()).hasSize(2);
    }

    @Test
    @DisplayName("Topic without delimiter should be stored under the unknown device")
    void testUnknownDevice() {
        send("sensor", "{\"temperature\": 19}");

        assertThat(table.listDeviceIds()).containsExactly("unknown");
    }

    @Test
    @DisplayName("Malformed payload for a new device should create nothing")
    void testMalformedFirstMessage() {
        send("sensor/jadwiga", "not-json-garbage");

        assertThat(table.snapshot("jadwiga")).isEmpty();
        assertThat(ingestor.getStatistics().getMessagesRejected()).isEqualTo(1);
        assertThat(ingestor.getStatistics().getUpdatesApplied()).isZero();
    }

    @Test
    @DisplayName("Malformed payload should leave an existing device unchanged")
    void testMalformedMessageLeavesDeviceUnchanged() {
        send("sensor/jadwiga", "{\"temperature\": 21.5}");
        send("sensor/jadwiga", "{\"temperature\": 22.0}");
        DeviceSnapshot before = table.snapshot("jadwiga").orElseThrow();

        send("sensor/jadwiga", "{\"temperature\": ");
        send("sensor/jadwiga", "[1, 2, 3]");

        assertThat(table.snapshot("jadwiga")).contains(before);
        assertThat(ingestor.getStatistics().getMessagesReceived()).isEqualTo(4);
        assertThat(ingestor.getStatistics().getMessagesRejected()).isEqualTo(2);
    }

    @Test
    @DisplayName("Statistics should track received and applied messages")
    void testStatistics() {
        send("sensor/jadwiga", "{\"temperature\": 21.5}");
        send("sensor/garaz", "{\"gas_level\": 720}");

        TelemetryIngestor.IngestionStatistics stats = ingestor.getStatistics();
        assertThat(stats.getMessagesReceived()).isEqualTo(2);
        assertThat(stats.getUpdatesApplied()).isEqualTo(2);
        assertThat(stats.getLastUpdateTime()).isEqualTo(NOW);
        assertThat(stats.toString()).contains("received=2", "applied=2", "rejected=0");
    }

    @Test
    @DisplayName("Two near-simultaneous first messages should produce one device holding both samples")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testSimultaneousFirstMessages() throws Exception {
        CountDownLatch startGate = new CountDownLatch(1);
        Thread first = new Thread(() -> {
            awaitQuietly(startGate);
            send("sensor/garaz", "{\"temperature\": 10}");
        });
        Thread second = new Thread(() -> {
            awaitQuietly(startGate);
            send("home/garaz", "{\"temperature\": 11}");
        });
        first.start();
        second.start();
        startGate.countDown();
        first.join();
        second.join();

        assertThat(table.deviceCount()).isEqualTo(1);
        assertThat(table.snapshot("garaz").orElseThrow().history())
                .containsExactlyInAnyOrder(Samples.of("temperature", 10), Samples.of("temperature", 11));
    }

    @Test
    @DisplayName("Should reject null collaborators")
    void testNullCollaborators() {
        assertThatThrownBy(() -> new TelemetryIngestor(null, table))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("router cannot be null");
        assertThatThrownBy(() -> new TelemetryIngestor(new MessageRouter(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("table cannot be null");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
