package sensormonitor.input;

import sensormonitor.domain.ConnectionStatus;

/**
 * Interface for telemetry message sources.
 * Implementations handle the transport connection and deliver each inbound message.
 */
public interface TelemetryInput {
    /**
     * Connect and start delivering messages.
     * @throws RuntimeException if the connection cannot be established
     */
    void start();

    /**
     * Stop delivering messages and release the connection.
     */
    void stop();

    /**
     * Check if the input has been started and not stopped.
     * @return true while started, regardless of the current connection state
     */
    boolean isRunning();

    /**
     * Current connection state and the broker it refers to.
     */
    ConnectionStatus connectionStatus();

    /**
     * Topic pattern this input subscribes to.
     */
    String subscriptionTopic();

    /**
     * Set the listener receiving inbound messages.
     * @param listener the message listener
     */
    void setMessageListener(MessageListener listener);

    /**
     * Callback invoked once per inbound message, possibly from a transport thread
     * and possibly concurrently with other invocations.
     */
    @FunctionalInterface
    interface MessageListener {
        void onMessage(String topic, byte[] payload);
    }
}
