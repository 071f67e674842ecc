package sensormonitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sensormonitor.config.MonitorConfig;
import sensormonitor.core.TelemetryIngestor;
import sensormonitor.core.TelemetryMonitor;
import sensormonitor.input.MqttTelemetryInput;
import sensormonitor.output.ConsoleTelemetryOutput;
import sensormonitor.output.SocketIOSnapshotOutput;
import sensormonitor.output.TelemetryOutput;
import sensormonitor.processor.MessageRouter;
import sensormonitor.store.DeviceTable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main application class for the sensor monitor.
 * Builds the device table once and wires it into both the ingestion path and
 * the polling outputs, then runs until the process is asked to stop.
 */
public class SensorMonitorApplication {
    private static final Logger logger = LoggerFactory.getLogger(SensorMonitorApplication.class);

    private final MonitorConfig config;
    private final DeviceTable deviceTable;
    private final TelemetryMonitor monitor;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private Runnable exitHook = () -> System.exit(1);

    /**
     * Create the application with default configuration.
     */
    public SensorMonitorApplication() {
        this(MonitorConfig.defaults());
    }

    /**
     * Create the application.
     *
     * @param config monitor configuration
     */
    public SensorMonitorApplication(MonitorConfig config) {
        this.config = config;

        Clock clock = Clock.systemUTC();
        this.deviceTable = new DeviceTable(config.historyCapacity(), clock);
        TelemetryIngestor ingestor = new TelemetryIngestor(new MessageRouter(), deviceTable, clock);
        MqttTelemetryInput input = new MqttTelemetryInput(config);

        this.monitor = new TelemetryMonitor(input, ingestor, deviceTable, createOutputs(config),
                config.pollInterval(), clock);
        deviceTable.setDeviceListener(deviceId -> monitor.requestRefresh());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
    }

    protected void setExitHook(Runnable exitHook) {
        this.exitHook = exitHook;
    }

    protected void exitApplication() {
        exitHook.run();
    }

    DeviceTable getDeviceTable() {
        return deviceTable;
    }

    /**
     * Start the application and block until shutdown.
     */
    public void start() {
        try {
            logger.info("Starting Sensor Monitor...");
            logger.info("════════════════════════════════════════════════════════");
            logger.info("🏭 Sensor Monitor - MQTT telemetry listener");
            logger.info("════════════════════════════════════════════════════════");

            monitor.start();

            logger.info("✅ Application started successfully");
            logger.info("📡 Listening for devices on {} (e.g. sensor/jadwiga)", config.topic());
            logger.info("⏳ Press Ctrl+C to stop");

            try {
                shutdownLatch.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Application interrupted");
            }

        } catch (Exception e) {
            logger.error("🚨 Critical error: MQTT broker {} is unreachable", config.brokerUri(), e);
            exitApplication();
        }
    }

    /**
     * Shutdown the application gracefully.
     */
    public void shutdown() {
        if (shutdownLatch.getCount() == 0) {
            return;
        }
        logger.info("🛑 Shutting down Sensor Monitor...");

        try {
            monitor.stop();

            TelemetryIngestor.IngestionStatistics stats = monitor.getIngestor().getStatistics();
            logger.info("📊 Final Statistics:");
            logger.info("   • Messages received: {}", stats.getMessagesReceived());
            logger.info("   • Updates applied: {}", stats.getUpdatesApplied());
            logger.info("   • Messages rejected: {}", stats.getMessagesRejected());
            logger.info("   • Devices known: {}", deviceTable.deviceCount());
            logger.info("   • Uptime: {} seconds", monitor.getStatistics().getUptime() / 1000);

            logger.info("✅ Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    static List<TelemetryOutput> createOutputs(MonitorConfig config) {
        List<TelemetryOutput> outputs = new ArrayList<>();
        outputs.add(new ConsoleTelemetryOutput(config.verbose(), config.colorized()));
        if (config.dashboardEnabled()) {
            outputs.add(new SocketIOSnapshotOutput(config.dashboardPort()));
        }
        return outputs;
    }

    /**
     * Main entry point. Settings are read from environment variables.
     */
    public static void main(String[] args) {
        MonitorConfig config;
        try {
            config = MonitorConfig.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            logger.error("❌ Configuration error: {}", e.getMessage());
            System.exit(1);
            return;
        }

        logger.info("Configuration:");
        logger.info("  • Broker: {}", config.brokerUri());
        logger.info("  • Topic: {}", config.topic());
        logger.info("  • Keep-alive: {} s", config.keepAliveSeconds());
        logger.info("  • History capacity: {}", config.historyCapacity());
        logger.info("  • Poll interval: {} ms", config.pollInterval().toMillis());

        SensorMonitorApplication app = new SensorMonitorApplication(config);
        app.start();
    }
}
