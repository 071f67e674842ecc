package sensormonitor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Connection state together with the broker it refers to.
 */
public record ConnectionStatus(
        ConnectionState state,
        String brokerAddress,
        Instant changedAt
) {
    public ConnectionStatus {
        Objects.requireNonNull(state, "state cannot be null");
    }

    public static ConnectionStatus disconnected(String brokerAddress) {
        return new ConnectionStatus(ConnectionState.DISCONNECTED, brokerAddress, Instant.now());
    }

    public ConnectionStatus transition(ConnectionState newState) {
        return new ConnectionStatus(newState, brokerAddress, Instant.now());
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
