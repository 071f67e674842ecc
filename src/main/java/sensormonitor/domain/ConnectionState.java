package sensormonitor.domain;

/**
 * Lifecycle of the broker connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
