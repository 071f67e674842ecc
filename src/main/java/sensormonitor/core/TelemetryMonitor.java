package sensormonitor.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.domain.DashboardFrame;
import sensormonitor.input.TelemetryInput;
import sensormonitor.output.TelemetryOutput;
import sensormonitor.store.SnapshotReader;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates the monitor: wires the input to the ingestor, polls the
 * snapshot reader on a fixed interval and hands each frame to every output.
 * <p>
 * Polling runs on its own thread and only ever takes short per-device copies,
 * so it does not hold up ingestion.
 */
public class TelemetryMonitor {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryMonitor.class);

    private final TelemetryInput input;
    private final TelemetryIngestor ingestor;
    private final SnapshotReader reader;
    private final List<TelemetryOutput> outputs;
    private final Duration pollInterval;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<DashboardFrame> lastFrame = new AtomicReference<>();
    private final MonitorStatistics statistics = new MonitorStatistics();

    private volatile ScheduledExecutorService poller;

    /**
     * Create a monitor with a single output.
     */
    public TelemetryMonitor(TelemetryInput input, TelemetryIngestor ingestor, SnapshotReader reader,
                            TelemetryOutput output, Duration pollInterval) {
        this(input, ingestor, reader, List.of(output), pollInterval);
    }

    /**
     * Create a monitor stamping frames with the system UTC clock.
     */
    public TelemetryMonitor(TelemetryInput input, TelemetryIngestor ingestor, SnapshotReader reader,
                            List<TelemetryOutput> outputs, Duration pollInterval) {
        this(input, ingestor, reader, outputs, pollInterval, Clock.systemUTC());
    }

    /**
     * Create a monitor.
     *
     * @param input the message source
     * @param ingestor the ingestion entry point receiving every message
     * @param reader the read view polled for frames
     * @param outputs the rendering destinations
     * @param pollInterval delay between two frames
     * @param clock clock used to stamp frames
     */
    public TelemetryMonitor(TelemetryInput input, TelemetryIngestor ingestor, SnapshotReader reader,
                            List<TelemetryOutput> outputs, Duration pollInterval, Clock clock) {
        this.input = Objects.requireNonNull(input, "input cannot be null");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor cannot be null");
        this.reader = Objects.requireNonNull(reader, "reader cannot be null");
        this.outputs = new CopyOnWriteArrayList<>(
                Objects.requireNonNull(outputs, "outputs cannot be null"));
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");

        if (outputs.isEmpty()) {
            throw new IllegalArgumentException("At least one output is required");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }

        this.input.setMessageListener(ingestor);
    }

    /**
     * Start the monitor.
     * Initializes outputs, connects the input and starts polling.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            try {
                initializeOutputs();

                input.start();

                poller = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "snapshot-poller");
                    t.setDaemon(true);
                    return t;
                });
                poller.scheduleWithFixedDelay(this::poll, 0L, pollInterval.toMillis(), TimeUnit.MILLISECONDS);

                statistics.recordStart();
                logger.info("TelemetryMonitor started with {} output(s), polling every {} ms",
                        outputs.size(), pollInterval.toMillis());
            } catch (Exception e) {
                running.set(false);
                closeResources();
                throw new RuntimeException("Failed to start TelemetryMonitor", e);
            }
        }
    }

    /**
     * Stop the monitor.
     * Stops polling, disconnects the input and closes all outputs.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                if (poller != null) {
                    poller.shutdownNow();
                    poller = null;
                }

                input.stop();

                closeResources();

                statistics.recordStop();
                logger.info("TelemetryMonitor stopped. {} {}", statistics, ingestor.getStatistics());
            } catch (Exception e) {
                logger.error("Error during TelemetryMonitor shutdown", e);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publish a frame now instead of waiting for the next tick, e.g. when a new
     * device appears. Ignored while the monitor is stopped.
     */
    public void requestRefresh() {
        ScheduledExecutorService current = poller;
        if (!running.get() || current == null) {
            return;
        }
        try {
            current.execute(this::poll);
        } catch (RejectedExecutionException e) {
            logger.debug("Refresh skipped, poller is shutting down", e);
        }
    }

    /**
     * Get the last published frame.
     *
     * @return the last frame or null if none has been published yet
     */
    public DashboardFrame getLastFrame() {
        return lastFrame.get();
    }

    public MonitorStatistics getStatistics() {
        return statistics;
    }

    public TelemetryIngestor getIngestor() {
        return ingestor;
    }

    /**
     * Add a new output dynamically.
     *
     * @param output the output to add
     */
    public void addOutput(TelemetryOutput output) {
        Objects.requireNonNull(output, "output cannot be null");
        if (running.get()) {
            output.initialize();
        }
        outputs.add(output);
        logger.info("Added new output: {}", output.getClass().getSimpleName());
    }

    /**
     * Remove an output dynamically.
     *
     * @param output the output to remove
     * @return true if removed, false if not found
     */
    public boolean removeOutput(TelemetryOutput output) {
        boolean removed = outputs.remove(output);
        if (removed) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing removed output", e);
            }
            logger.info("Removed output: {}", output.getClass().getSimpleName());
        }
        return removed;
    }

    /**
     * Build one frame from the current state and send it to every output.
     * Called by the poller on each tick.
     *
     * @return the frame that was published
     */
    public DashboardFrame publishFrame() {
        DashboardFrame frame = DashboardFrame.create(clock,
                input.connectionStatus(), input.subscriptionTopic(), reader.snapshotAll());
        lastFrame.set(frame);
        statistics.recordFrame();

        for (TelemetryOutput output : outputs) {
            try {
                output.send(frame);
            } catch (Exception e) {
                statistics.recordOutputError();
                logger.error("Error sending to output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
        return frame;
    }

    private void poll() {
        try {
            publishFrame();
        } catch (Exception e) {
            // an exception escaping a scheduled task cancels every later tick
            logger.error("Snapshot poll failed", e);
        }
    }

    private void initializeOutputs() {
        for (TelemetryOutput output : outputs) {
            try {
                output.initialize();
                logger.debug("Initialized output: {}", output.getClass().getSimpleName());
            } catch (Exception e) {
                logger.error("Failed to initialize output: {}",
                        output.getClass().getSimpleName(), e);
                throw new RuntimeException("Failed to initialize output", e);
            }
        }
    }

    private void closeResources() {
        for (TelemetryOutput output : outputs) {
            try {
                output.close();
            } catch (Exception e) {
                logger.warn("Error closing output: {}",
                        output.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Statistics tracking for the monitor.
     */
    public static class MonitorStatistics {
        private volatile long startTime;
        private volatile long stopTime;
        private volatile long startNano;
        private final AtomicLong framesPublished = new AtomicLong();
        private final AtomicLong outputErrors = new AtomicLong();

        void recordStart() {
            startTime = System.currentTimeMillis();
            startNano = System.nanoTime();
            stopTime = 0L;
        }

        void recordStop() {
            stopTime = System.currentTimeMillis();
        }

        void recordFrame() {
            framesPublished.incrementAndGet();
        }

        void recordOutputError() {
            outputErrors.incrementAndGet();
        }

        public long getUptime() {
            if (startTime == 0) return 0;
            if (stopTime > 0) {
                return stopTime - startTime;
            }
            long elapsedMs = (System.nanoTime() - startNano) / 1_000_000L;
            return elapsedMs > 0 ? elapsedMs : 1L;
        }

        public long getFramesPublished() {
            return framesPublished.get();
        }

        public long getOutputErrors() {
            return outputErrors.get();
        }

        @Override
        public String toString() {
            return String.format("MonitorStatistics{uptime=%dms, framesPublished=%d, outputErrors=%d}",
                    getUptime(), getFramesPublished(), getOutputErrors());
        }
    }
}
