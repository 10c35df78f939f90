package containermigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable timing data of one migration.
 *
 * <p>Use {@link #summary()} for a human-readable line, or {@link #toMap()}
 * for JSON serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        String containerId,
        Instant startTime,
        Instant endTime,
        Map<Step, Long> stepDurations,
        long totalDurationMs,
        long packageSizeBytes
) {
    /**
     * Pipeline steps, in execution order.
     */
    public enum Step {
        PREREQUISITES,
        COMPATIBILITY,
        CHECKPOINT,
        PACKAGE,
        TRANSFER,
        RESTORE,
        VALIDATION,
        ROLLBACK
    }

    public MigrationMetrics {
        stepDurations = stepDurations.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stepDurations));
    }

    /** Returns the total duration as a Duration object. */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific step.
     *
     * @param step the step to query
     * @return duration in milliseconds, or 0 if the step did not run
     */
    public long stepDuration(Step step) {
        return stepDurations.getOrDefault(step, 0L);
    }

    /** Returns true if the step ran (successfully or not). */
    public boolean ran(Step step) {
        return stepDurations.containsKey(step);
    }

    public String summary() {
        StringBuilder steps = new StringBuilder();
        stepDurations.forEach((step, ms) -> {
            if (steps.length() > 0) steps.append(", ");
            steps.append(step.name().toLowerCase(Locale.ROOT)).append('=').append(ms).append("ms");
        });
        return String.format(Locale.ROOT, "Migration of %s in %dms | Package: %s | Steps: %s",
                containerId, totalDurationMs, formatBytes(packageSizeBytes), steps);
    }

    /**
     * Converts the metrics to a Map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("containerId", containerId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("packageSizeBytes", packageSizeBytes);
        stepDurations.forEach((step, duration) ->
                map.put(step.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    private static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + "B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.2fGB", bytes / (1024.0 * 1024 * 1024));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing {@link MigrationMetrics} instances.
     */
    public static class Builder {
        private String containerId;
        private Instant startTime;
        private Instant endTime;
        private final Map<Step, Long> stepDurations = new EnumMap<>(Step.class);
        private long totalDurationMs;
        private long packageSizeBytes;

        public Builder containerId(String id) { this.containerId = id; return this; }
        public Builder startTime(Instant t) { this.startTime = t; return this; }
        public Builder endTime(Instant t) { this.endTime = t; return this; }

        public Builder stepDurations(Map<Step, Long> durations) {
            this.stepDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder packageSizeBytes(long v) { this.packageSizeBytes = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(containerId, startTime, endTime,
                    stepDurations, totalDurationMs, packageSizeBytes);
        }
    }
}
