package sensormonitor.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable point-in-time copy of one device's state, handed to readers.
 * Later updates to the device never change an existing snapshot.
 */
public record DeviceSnapshot(
        String deviceId,
        Sample latest,      // null until the first message arrives
        Sample previous,    // null until the second message arrives
        List<Sample> history,
        Instant lastUpdate,
        Instant createdAt,
        long updateCount
) {
    public DeviceSnapshot {
        Objects.requireNonNull(deviceId, "deviceId cannot be null");
        history = List.copyOf(history);
    }

    public Optional<Sample> latestSample() {
        return Optional.ofNullable(latest);
    }

    public Optional<Sample> previousSample() {
        return Optional.ofNullable(previous);
    }

    public boolean hasPrevious() {
        return previous != null;
    }

    /**
     * Change of a numeric field between the previous and latest sample,
     * rounded to two decimals. Empty when either side lacks the field.
     */
    public OptionalDouble delta(String field) {
        if (latest == null || previous == null) {
            return OptionalDouble.empty();
        }
        OptionalDouble current = latest.number(field);
        OptionalDouble before = previous.number(field);
        if (current.isEmpty() || before.isEmpty()) {
            return OptionalDouble.empty();
        }
        BigDecimal difference = BigDecimal.valueOf(current.getAsDouble())
                .subtract(BigDecimal.valueOf(before.getAsDouble()))
                .setScale(2, RoundingMode.HALF_EVEN);
        return OptionalDouble.of(difference.doubleValue());
    }

    /**
     * Numeric values of one field across the history, oldest first.
     * Samples that do not carry the field are skipped.
     */
    public List<Double> series(String field) {
        List<Double> values = new ArrayList<>(history.size());
        for (Sample sample : history) {
            sample.number(field).ifPresent(values::add);
        }
        return values;
    }
}
