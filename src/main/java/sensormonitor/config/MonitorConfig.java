package sensormonitor.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runtime settings of the monitor, read once at start-up.
 *
 * @param brokerHost MQTT broker host
 * @param brokerPort MQTT broker port
 * @param topic subscription topic pattern, e.g. {@code sensor/+}
 * @param keepAliveSeconds MQTT keep-alive interval
 * @param clientId MQTT client id
 * @param qos subscription quality of service (0-2)
 * @param historyCapacity samples kept per device
 * @param pollInterval how often outputs are refreshed
 * @param verbose verbose console output
 * @param colorized colorized console output
 * @param dashboardPort port of the optional Socket.IO dashboard server, or 0
 */
public record MonitorConfig(
        String brokerHost,
        int brokerPort,
        String topic,
        int keepAliveSeconds,
        String clientId,
        int qos,
        int historyCapacity,
        Duration pollInterval,
        boolean verbose,
        boolean colorized,
        int dashboardPort
) {
    public static final String DEFAULT_BROKER = "localhost";
    public static final int DEFAULT_PORT = 1883;
    public static final String DEFAULT_TOPIC = "sensor/+";
    public static final int DEFAULT_KEEPALIVE = 60;
    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    public static final long DEFAULT_POLL_INTERVAL_MS = 500L;

    public MonitorConfig {
        Objects.requireNonNull(brokerHost, "brokerHost cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
        Objects.requireNonNull(clientId, "clientId cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        requireRange("MQTT_PORT", brokerPort, 1, 65535);
        requireRange("MQTT_KEEPALIVE", keepAliveSeconds, 0, 65535);
        requireRange("MQTT_QOS", qos, 0, 2);
        requireRange("HISTORY_CAPACITY", historyCapacity, 1, Integer.MAX_VALUE);
        requireRange("DASHBOARD_PORT", dashboardPort, 0, 65535);
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("POLL_INTERVAL_MS must be positive");
        }
        if (topic.isBlank()) {
            throw new IllegalArgumentException("MQTT_TOPIC cannot be blank");
        }
    }

    /**
     * Configuration with every setting at its default.
     */
    public static MonitorConfig defaults() {
        return fromEnvironment(Map.of());
    }

    /**
     * Read the configuration from environment variables, falling back to defaults.
     *
     * @param env environment variables, usually {@link System#getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static MonitorConfig fromEnvironment(Map<String, String> env) {
        return new MonitorConfig(
                text(env, "MQTT_BROKER").orElse(DEFAULT_BROKER),
                integer(env, "MQTT_PORT", DEFAULT_PORT),
                text(env, "MQTT_TOPIC").orElse(DEFAULT_TOPIC),
                integer(env, "MQTT_KEEPALIVE", DEFAULT_KEEPALIVE),
                text(env, "MQTT_CLIENT_ID").orElseGet(
                        () -> "sensor-monitor-" + UUID.randomUUID().toString().substring(0, 8)),
                integer(env, "MQTT_QOS", 0),
                integer(env, "HISTORY_CAPACITY", DEFAULT_HISTORY_CAPACITY),
                Duration.ofMillis(integer(env, "POLL_INTERVAL_MS", (int) DEFAULT_POLL_INTERVAL_MS)),
                bool(env, "CONSOLE_VERBOSE", false),
                bool(env, "CONSOLE_COLORIZED", true),
                integer(env, "DASHBOARD_PORT", 0)
        );
    }

    /**
     * Broker address in the form the MQTT client expects.
     */
    public String brokerUri() {
        return "tcp://" + brokerHost + ":" + brokerPort;
    }

    public boolean dashboardEnabled() {
        return dashboardPort > 0;
    }

    private static Optional<String> text(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static int integer(Map<String, String> env, String name, int defaultValue) {
        Optional<String> value = text(env, name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value.get() + "'", e);
        }
    }

    private static boolean bool(Map<String, String> env, String name, boolean defaultValue) {
        return text(env, name).map(Boolean::parseBoolean).orElse(defaultValue);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    String.format("%s must be between %d and %d, got %d", name, min, max, value));
        }
    }
}
