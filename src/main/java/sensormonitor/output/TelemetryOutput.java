package sensormonitor.output;

import sensormonitor.domain.DashboardFrame;

/**
 * Interface for rendering destinations fed by the snapshot poller.
 * Implementations handle formatting and delivery of each frame.
 */
public interface TelemetryOutput {
    /**
     * Render or forward one frame.
     *
     * @param frame the frame built on the current poll tick
     * @throws RuntimeException if sending fails
     */
    void send(DashboardFrame frame);

    /**
     * Initialize the output if needed.
     * Called before first use.
     */
    default void initialize() {
        // Default no-op implementation
    }

    /**
     * Close and cleanup resources.
     * Should be idempotent.
     */
    void close();
}
