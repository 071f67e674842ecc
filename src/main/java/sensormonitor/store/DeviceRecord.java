package sensormonitor.store;

import sensormonitor.domain.DeviceSnapshot;
import sensormonitor.domain.Sample;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Bounded state of one device: latest sample, previous sample and a FIFO history.
 * <p>
 * Not thread-safe on its own. All reads and writes go through {@link DeviceTable},
 * which holds the record's monitor around every call.
 */
public final class DeviceRecord {

    private final String deviceId;
    private final int capacity;
    private final Instant createdAt;
    private final Deque<Sample> history;

    private Sample latest;
    private Sample previous;
    private Instant lastUpdate;
    private long updateCount;

    DeviceRecord(String deviceId, int capacity, Instant createdAt) {
        this.deviceId = deviceId;
        this.capacity = capacity;
        this.createdAt = createdAt;
        this.lastUpdate = createdAt;
        this.history = new ArrayDeque<>(Math.min(capacity, 128));
    }

    public String deviceId() {
        return deviceId;
    }

    void apply(Sample sample, Instant observedAt) {
        if (latest != null) {
            previous = latest;
        }
        latest = sample;
        history.addLast(sample);
        while (history.size() > capacity) {
            history.removeFirst();
        }
        lastUpdate = observedAt;
        updateCount++;
    }

    DeviceSnapshot copy() {
        return new DeviceSnapshot(deviceId, latest, previous, new ArrayList<>(history),
                lastUpdate, createdAt, updateCount);
    }
}
