package containermigrator.metrics;

import containermigrator.metrics.MigrationMetrics.Step;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects step timings during one migration.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector().start(containerId);
 * CheckpointStatus status = collector.timed(Step.CHECKPOINT, () -&gt; tools.dump(config, ctx));
 * collector.packageSize(pkg.sizeBytes());
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Not thread-safe; owned by the migrating thread.
 */
public final class MigrationMetricsCollector {

    private final Map<Step, Long> stepDurations = new EnumMap<>(Step.class);
    private MigrationMetrics.Builder builder;
    private Instant startTime;

    /**
     * Starts collection for a new migration.
     *
     * @param containerId the container being migrated
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(String containerId) {
        this.startTime = Instant.now();
        this.stepDurations.clear();
        this.builder = MigrationMetrics.builder()
                .containerId(containerId)
                .startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a step and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Step step, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            stepDurations.put(step, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /**
     * Time a step and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Step step, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            stepDurations.put(step, Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    /** Returns the last recorded duration of a step, or 0. */
    public long lastDuration(Step step) {
        return stepDurations.getOrDefault(step, 0L);
    }

    /**
     * Records the size of the transferred package.
     *
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector packageSize(long bytes) {
        builder.packageSizeBytes(bytes);
        return this;
    }

    /**
     * Finishes collection and returns the final metrics.
     */
    public MigrationMetrics finish() {
        Instant endTime = Instant.now();
        return builder
                .endTime(endTime)
                .stepDurations(stepDurations)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
