package sensormonitor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything a rendering output needs for one poll tick: connection status,
 * subscription topic and a snapshot of each known device, ordered by device id.
 */
public record DashboardFrame(
        Instant timestamp,
        ConnectionStatus connection,
        String topic,
        Map<String, DeviceSnapshot> devices
) {
    // Shared mapper, Java Time values written as ISO-8601 strings
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public DashboardFrame {
        devices = Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(devices)));
    }

    public static DashboardFrame create(Clock clock, ConnectionStatus connection, String topic,
                                        Map<String, DeviceSnapshot> devices) {
        return new DashboardFrame(clock.instant(), connection, topic, devices);
    }

    public int deviceCount() {
        return devices.size();
    }

    @JsonIgnore
    public boolean isConnected() {
        return connection != null && connection.isConnected();
    }

    /**
     * Convert this frame to its JSON representation.
     */
    public String toJSON() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize dashboard frame", e);
        }
    }
}
