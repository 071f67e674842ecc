package sensormonitor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One decoded telemetry payload: sensor readings keyed by field name.
 * The field set is whatever the publishing node sent, so every accessor
 * reports a missing field as an empty result instead of failing.
 *
 * @param values field values in document order, each a {@link Number} or {@link Boolean}
 */
public record Sample(Map<String, Object> values) {

    public Sample {
        Objects.requireNonNull(values, "values cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (!(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported value for field '" + entry.getKey()
                        + "': " + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            copy.put(Objects.requireNonNull(entry.getKey(), "field name cannot be null"), value);
        }
        values = Collections.unmodifiableMap(copy);
    }

    /**
     * Numeric value of a field, empty when the field is missing or boolean.
     */
    public OptionalDouble number(String field) {
        Object value = values.get(field);
        if (value instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        return OptionalDouble.empty();
    }

    /**
     * Boolean value of a field. Sensor boards often report switches as 0/1,
     * so a numeric value counts as {@code true} when it is non-zero.
     */
    public Optional<Boolean> flag(String field) {
        Object value = values.get(field);
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue() != 0.0);
        }
        return Optional.empty();
    }

    /**
     * Raw value of a field as it was decoded.
     */
    public Optional<Object> value(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    @Override
    public Map<String, Object> values() {
        return values;
    }
}
