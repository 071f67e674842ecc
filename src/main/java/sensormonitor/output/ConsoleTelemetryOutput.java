package sensormonitor.output;

import sensormonitor.domain.DashboardFrame;
import sensormonitor.domain.DeviceSnapshot;
import sensormonitor.domain.Sample;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Console dashboard: prints the connection status and the latest readings of
 * every device, with the change since the previous reading where known.
 */
public class ConsoleTelemetryOutput implements TelemetryOutput {

    static final double GAS_DANGER_LEVEL = 1000.0;
    static final double GAS_WARNING_LEVEL = 700.0;
    static final int TREND_MIN_SAMPLES = 3;
    static final int SPARKLINE_WIDTH = 30;

    private static final char[] SPARK_LEVELS = "▁▂▃▄▅▆▇█".toCharArray();

    private static final List<Metric> ENVIRONMENT_METRICS = List.of(
            new Metric("temperature", "Temp (In)", "°C"),
            new Metric("temperature_out", "Temp (Out)", "°C"),
            new Metric("humidity_out", "Humidity", "%"),
            new Metric("motor_adc", "Motor ADC", ""),
            new Metric("smoke", "Smoke Level", "%"),
            new Metric("sound", "Sound", "dB"),
            new Metric("vibration", "Vibration", "Hz")
    );

    private static final List<String> MOTION_FIELDS = List.of(
            "acceleration_x", "acceleration_y", "acceleration_z", "gyro_x", "gyro_y", "gyro_z");

    private static final List<Metric> ENVIRONMENT_TRENDS = List.of(
            new Metric("temperature", "Temp (In)", "°C"),
            new Metric("temperature_out", "Temp (Out)", "°C"),
            new Metric("gas_level", "Gas Sensor", ""),
            new Metric("humidity_out", "Humidity", "%")
    );

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "temperature", "temperature_out", "humidity_out", "motor_adc", "smoke", "sound", "vibration",
            "gas_level", "flame_status", "flame",
            "acceleration_x", "acceleration_y", "acceleration_z", "gyro_x", "gyro_y", "gyro_z");

    private final boolean verbose;
    private final boolean colorized;
    private final DateTimeFormatter timeFormatter;

    // ANSI color codes
    private static final class Colors {
        static final String RESET = "\u001B[0m";
        static final String BRIGHT = "\u001B[1m";
        static final String DIM = "\u001B[2m";
        static final String RED = "\u001B[31m";
        static final String GREEN = "\u001B[32m";
        static final String YELLOW = "\u001B[33m";
        static final String CYAN = "\u001B[36m";
    }

    private record Metric(String field, String label, String unit) {}

    /**
     * Create a console output with specified options.
     *
     * @param verbose if true, also list unrecognised fields and history size
     * @param colorized if true, use ANSI colors in output
     */
    public ConsoleTelemetryOutput(boolean verbose, boolean colorized) {
        this.verbose = verbose;
        this.colorized = colorized;
        this.timeFormatter = DateTimeFormatter.ofPattern("HH:mm:ss")
                .withZone(ZoneId.systemDefault());
    }

    /**
     * Create a console output with default options (compact, colorized).
     */
    public ConsoleTelemetryOutput() {
        this(false, true);
    }

    @Override
    public void send(DashboardFrame frame) {
        System.out.print(render(frame));
        // PrintStream swallows IOExceptions and only reports them through checkError()
        if (System.out.checkError()) {
            System.err.println("Console output error: write failure");
        }
    }

    @Override
    public void close() {
        // No resources to close for console output
    }

    /**
     * Render a frame to text.
     */
    String render(DashboardFrame frame) {
        StringBuilder out = new StringBuilder();
        appendHeader(out, frame);

        if (frame.devices().isEmpty()) {
            out.append("  ").append(color(Colors.DIM)).append("📡 Waiting for devices on `")
                    .append(frame.topic()).append("`...").append(color(Colors.RESET)).append('\n');
            return out.toString();
        }

        for (DeviceSnapshot device : frame.devices().values()) {
            appendDevice(out, device);
        }
        return out.toString();
    }

    private void appendHeader(StringBuilder out, DashboardFrame frame) {
        String bright = color(Colors.BRIGHT);
        String reset = color(Colors.RESET);

        out.append(color(Colors.CYAN)).append("━".repeat(60)).append(reset).append('\n');
        out.append(bright).append('[').append(timeFormatter.format(frame.timestamp())).append("] ");
        if (frame.isConnected()) {
            out.append(color(Colors.GREEN)).append("🟢 Connected: ")
                    .append(frame.connection().brokerAddress());
        } else {
            out.append(color(Colors.RED)).append("🔴 Disconnected (values may be stale)");
        }
        out.append(reset).append(" | Devices: ").append(frame.deviceCount())
                .append(" | Topic: ").append(frame.topic()).append('\n');
    }

    private void appendDevice(StringBuilder out, DeviceSnapshot device) {
        String reset = color(Colors.RESET);
        String dim = color(Colors.DIM);

        out.append(color(Colors.YELLOW)).append("📍 ").append(device.deviceId().toUpperCase(Locale.ROOT))
                .append(reset).append(' ').append(dim).append("(last update ")
                .append(timeFormatter.format(device.lastUpdate())).append(')').append(reset).append('\n');

        Sample latest = device.latest();
        if (latest == null) {
            out.append("   ").append(dim).append("no readings yet").append(reset).append('\n');
            return;
        }

        for (Metric metric : ENVIRONMENT_METRICS) {
            if (latest.contains(metric.field())) {
                appendMetric(out, device, metric.label(),
                        formatValue(latest, metric.field()) + unitSuffix(metric.unit()), metric.field());
            }
        }

        if (latest.contains("gas_level")) {
            String status = gasStatus(latest.number("gas_level"));
            appendMetric(out, device, "Gas Sensor",
                    formatValue(latest, "gas_level") + " (" + status + ")", "gas_level");
        }

        latest.value("flame_status").ifPresent(status ->
                appendMetric(out, device, "Flame", isFireSignal(status) ? "🔥 FIRE!" : "✅ Safe", null));

        // The console subscriber's boards pull the flame line low on detection
        latest.flag("flame").ifPresent(high ->
                appendMetric(out, device, "Flame", high ? "Safe" : "DETECTED", null));

        if (latest.contains("acceleration_x")) {
            StringJoiner motion = new StringJoiner("  ");
            for (String field : MOTION_FIELDS) {
                if (latest.contains(field)) {
                    motion.add(field + "=" + formatValue(latest, field) + formatDelta(device.delta(field)));
                }
            }
            out.append("   ").append(color(Colors.CYAN)).append("⚙️ Motion:").append(reset)
                    .append(' ').append(motion).append('\n');
        }

        if (device.history().size() >= TREND_MIN_SAMPLES) {
            appendTrends(out, device);
        }

        if (verbose) {
            StringJoiner other = new StringJoiner(", ");
            for (String field : latest.fieldNames()) {
                if (!KNOWN_FIELDS.contains(field)) {
                    other.add(field + "=" + formatValue(latest, field));
                }
            }
            if (other.length() > 0) {
                out.append("   ").append(dim).append("Other: ").append(other).append(reset).append('\n');
            }
            out.append("   ").append(dim).append("History: ").append(device.history().size())
                    .append(" sample(s), ").append(device.updateCount()).append(" update(s)")
                    .append(reset).append('\n');
        }
    }

    private void appendMetric(StringBuilder out, DeviceSnapshot device, String label, String value,
                              String deltaField) {
        out.append("   ").append(color(Colors.CYAN)).append(label).append(':').append(color(Colors.RESET))
                .append(' ').append(color(Colors.BRIGHT)).append(value).append(color(Colors.RESET));
        if (deltaField != null) {
            out.append(formatDelta(device.delta(deltaField)));
        }
        out.append('\n');
    }

    private void appendTrends(StringBuilder out, DeviceSnapshot device) {
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        StringBuilder environment = new StringBuilder();
        for (Metric metric : ENVIRONMENT_TRENDS) {
            appendTrend(environment, metric.label(), device.series(metric.field()), metric.unit());
        }
        StringBuilder motion = new StringBuilder();
        for (String field : MOTION_FIELDS) {
            appendTrend(motion, field, device.series(field), "");
        }

        if (environment.length() > 0) {
            out.append("   ").append(dim).append("📈 Environment trend (").append(device.history().size())
                    .append(" samples)").append(reset).append('\n').append(environment);
        }
        if (motion.length() > 0) {
            out.append("   ").append(dim).append("📈 Motion trend (").append(device.history().size())
                    .append(" samples)").append(reset).append('\n').append(motion);
        }
    }

    private void appendTrend(StringBuilder out, String label, List<Double> series, String unit) {
        if (series.isEmpty()) {
            return;
        }
        double min = series.stream().mapToDouble(Double::doubleValue).min().getAsDouble();
        double max = series.stream().mapToDouble(Double::doubleValue).max().getAsDouble();
        out.append("      ").append(label).append(' ').append(color(Colors.GREEN))
                .append(sparkline(series)).append(color(Colors.RESET))
                .append(String.format(Locale.ROOT, " min %.2f max %.2f", min, max))
                .append(unitSuffix(unit)).append('\n');
    }

    /**
     * Block-character chart of the most recent values, scaled between their min and max.
     */
    static String sparkline(List<Double> series) {
        List<Double> window = series.subList(Math.max(0, series.size() - SPARKLINE_WIDTH), series.size());
        double min = window.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = window.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;

        StringBuilder line = new StringBuilder(window.size());
        for (double value : window) {
            int level = range == 0.0
                    ? SPARK_LEVELS.length / 2
                    : (int) Math.round((value - min) / range * (SPARK_LEVELS.length - 1));
            line.append(SPARK_LEVELS[level]);
        }
        return line.toString();
    }

    // Boards report the alarm as exactly 1; other values mean no flame
    private static boolean isFireSignal(Object status) {
        if (status instanceof Boolean bool) {
            return bool;
        }
        return status instanceof Number number && number.doubleValue() == 1.0;
    }

    static String gasStatus(OptionalDouble level) {
        if (level.isEmpty()) {
            return "N/A";
        }
        double value = level.getAsDouble();
        if (value > GAS_DANGER_LEVEL) {
            return "⚠️ DANGER";
        }
        if (value > GAS_WARNING_LEVEL) {
            return "⚠️ WARNING";
        }
        return "✅ SAFE";
    }

    private static String formatValue(Sample sample, String field) {
        return sample.value(field).map(Object::toString).orElse("N/A");
    }

    private static String unitSuffix(String unit) {
        return unit.isEmpty() ? "" : " " + unit;
    }

    private static String formatDelta(OptionalDouble delta) {
        if (delta.isEmpty()) {
            return "";
        }
        return String.format(Locale.ROOT, " (%+.2f)", delta.getAsDouble());
    }

    private String color(String colorCode) {
        return colorized ? colorCode : "";
    }
}
