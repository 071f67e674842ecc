package sensormonitor.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.domain.RoutedMessage;
import sensormonitor.input.TelemetryInput;
import sensormonitor.processor.MalformedPayloadException;
import sensormonitor.processor.MessageRouter;
import sensormonitor.store.DeviceTable;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ingestion entry point: applies one inbound message to the device table.
 * <p>
 * Decoding happens before any record lock is taken; only the in-memory update
 * runs under the targeted record's lock. Safe to call from any thread.
 */
public class TelemetryIngestor implements TelemetryInput.MessageListener {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryIngestor.class);

    private final MessageRouter router;
    private final DeviceTable table;
    private final Clock clock;
    private final IngestionStatistics statistics = new IngestionStatistics();

    public TelemetryIngestor(MessageRouter router, DeviceTable table) {
        this(router, table, Clock.systemUTC());
    }

    public TelemetryIngestor(MessageRouter router, DeviceTable table, Clock clock) {
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Handle one inbound message. A malformed payload is reported and dropped
     * without touching any device state.
     *
     * @param topic the topic the message arrived on
     * @param payload the raw payload
     */
    @Override
    public void onMessage(String topic, byte[] payload) {
        statistics.recordReceived();

        RoutedMessage message;
        try {
            message = router.route(topic, payload);
        } catch (MalformedPayloadException e) {
            statistics.recordRejected();
            logger.warn("Invalid JSON received on {}: {}", topic, e.getRawPayloadText());
            logger.debug("Decode failure details", e);
            return;
        }

        Instant observedAt = clock.instant();
        table.applyUpdate(message.deviceId(), message.sample(), observedAt);
        statistics.recordApplied(observedAt);
        logger.debug("Applied update to device {}", message.deviceId());
    }

    public IngestionStatistics getStatistics() {
        return statistics;
    }

    /**
     * Counters for the ingestion path. Updated from transport threads, read from anywhere.
     */
    public static class IngestionStatistics {
        private final AtomicLong messagesReceived = new AtomicLong();
        private final AtomicLong updatesApplied = new AtomicLong();
        private final AtomicLong messagesRejected = new AtomicLong();
        private final AtomicReference<Instant> lastUpdateTime = new AtomicReference<>();

        void recordReceived() {
            messagesReceived.incrementAndGet();
        }

        void recordApplied(Instant observedAt) {
            updatesApplied.incrementAndGet();
            lastUpdateTime.set(observedAt);
        }

        void recordRejected() {
            messagesRejected.incrementAndGet();
        }

        public long getMessagesReceived() {
            return messagesReceived.get();
        }

        public long getUpdatesApplied() {
            return updatesApplied.get();
        }

        public long getMessagesRejected() {
            return messagesRejected.get();
        }

        public Instant getLastUpdateTime() {
            return lastUpdateTime.get();
        }

        @Override
        public String toString() {
            return String.format("IngestionStatistics{received=%d, applied=%d, rejected=%d, lastUpdate=%s}",
                    getMessagesReceived(), getUpdatesApplied(), getMessagesRejected(), getLastUpdateTime());
        }
    }
}
