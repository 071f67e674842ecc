package sensormonitor.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.domain.DeviceSnapshot;
import sensormonitor.domain.Sample;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrent mapping from device id to {@link DeviceRecord}.
 * <p>
 * Records are created atomically on first sight and never removed. Each update
 * and each snapshot locks only the targeted record, so traffic for one device
 * never waits on another device.
 */
public class DeviceTable implements SnapshotReader {
    private static final Logger logger = LoggerFactory.getLogger(DeviceTable.class);

    public static final int DEFAULT_CAPACITY = 100;

    private final ConcurrentMap<String, DeviceRecord> records = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;
    private volatile DeviceListener deviceListener;

    /**
     * Create a table with the default history capacity.
     */
    public DeviceTable() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    /**
     * Create a table.
     *
     * @param capacity maximum number of samples kept per device
     * @param clock clock used to stamp record creation
     */
    public DeviceTable(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Register a listener notified once per newly seen device.
     */
    public void setDeviceListener(DeviceListener listener) {
        this.deviceListener = listener;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Return the record for a device, creating an empty one on first sight.
     * Concurrent first sightings of the same id yield exactly one record.
     */
    public DeviceRecord getOrCreate(String deviceId) {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        DeviceRecord existing = records.get(deviceId);
        if (existing != null) {
            return existing;
        }

        DeviceRecord created = new DeviceRecord(deviceId, capacity, clock.instant());
        existing = records.putIfAbsent(deviceId, created);
        if (existing != null) {
            return existing;
        }

        logger.info("New device detected: {}", deviceId);
        notifyDiscovered(deviceId);
        return created;
    }

    /**
     * Apply one sample to a device as a single atomic step.
     *
     * @param deviceId the device id
     * @param sample the decoded sample
     * @param observedAt when the sample was received
     */
    public void applyUpdate(String deviceId, Sample sample, Instant observedAt) {
        Objects.requireNonNull(sample, "sample cannot be null");
        Objects.requireNonNull(observedAt, "observedAt cannot be null");
        DeviceRecord record = getOrCreate(deviceId);
        synchronized (record) {
            record.apply(sample, observedAt);
        }
    }

    @Override
    public Optional<DeviceSnapshot> snapshot(String deviceId) {
        DeviceRecord record = records.get(deviceId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            return Optional.of(record.copy());
        }
    }

    @Override
    public Set<String> listDeviceIds() {
        return Set.copyOf(records.keySet());
    }

    @Override
    public int deviceCount() {
        return records.size();
    }

    private void notifyDiscovered(String deviceId) {
        DeviceListener listener = deviceListener;
        if (listener == null) {
            return;
        }
        try {
            listener.onDeviceDiscovered(deviceId);
        } catch (Exception e) {
            logger.warn("Device listener failed for {}", deviceId, e);
        }
    }

    /**
     * Callback for newly seen devices. Best effort, not required for correctness.
     */
    @FunctionalInterface
    public interface DeviceListener {
        void onDeviceDiscovered(String deviceId);
    }
}
