package containermigrator.engine;

import containermigrator.exceptions.ErrorKind;
import containermigrator.metrics.MigrationMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a migration, updated as the pipeline runs.
 *
 * <p>Status changes are checked against {@link MigrationStatus}'s edges;
 * an illegal change throws {@link IllegalStateException}. The first fatal
 * cause wins: later failures do not overwrite {@link #errorMessage()}.
 *
 * <p>Thread-safe, since {@link MigrationOrchestrator#cancelMigration(String)}
 * may update a result while its pipeline is still running.
 */
public final class MigrationResult {

    private final String containerId;
    private final List<MigrationStatus> statusHistory = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private MigrationStatus status;
    private String sourceCheckpointPath;
    private String targetCheckpointPath;
    private String errorMessage;
    private ErrorKind errorKind;
    private Duration migrationTime;
    private MigrationMetrics metrics;
    private boolean cancelled;

    MigrationResult(String containerId) {
        this.containerId = Objects.requireNonNull(containerId, "containerId");
        this.status = MigrationStatus.PENDING;
        this.statusHistory.add(MigrationStatus.PENDING);
    }

    public String containerId() {
        return containerId;
    }

    /** Returns true only if every step succeeded. */
    public synchronized boolean success() {
        return status == MigrationStatus.COMPLETED;
    }

    public synchronized MigrationStatus status() {
        return status;
    }

    /** Returns every status this migration has been in, in order. */
    public synchronized List<MigrationStatus> statusHistory() {
        return Collections.unmodifiableList(new ArrayList<>(statusHistory));
    }

    public synchronized String sourceCheckpointPath() {
        return sourceCheckpointPath;
    }

    public synchronized String targetCheckpointPath() {
        return targetCheckpointPath;
    }

    /** Returns the first fatal cause, or null if none. */
    public synchronized String errorMessage() {
        return errorMessage;
    }

    /** Returns the classification of the first fatal cause; null on success and for cancellation. */
    public synchronized ErrorKind errorKind() {
        return errorKind;
    }

    public synchronized List<String> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    /** Returns the wall-clock duration, set when the migration returns. */
    public synchronized Duration migrationTime() {
        return migrationTime;
    }

    public synchronized MigrationMetrics metrics() {
        return metrics;
    }

    synchronized void transitionTo(MigrationStatus next) {
        move(next);
    }

    /**
     * Moves an in-progress migration to COMPLETED.
     *
     * @return false if it was failed concurrently (e.g. cancelled)
     */
    synchronized boolean complete() {
        if (status != MigrationStatus.IN_PROGRESS) {
            return false;
        }
        move(MigrationStatus.COMPLETED);
        return true;
    }

    /**
     * Fails a migration that could not start because another one holds its
     * container. It passes through IN_PROGRESS like any other failed run.
     */
    synchronized void reject(String message) {
        move(MigrationStatus.IN_PROGRESS);
        fail(ErrorKind.VALIDATION, message);
    }

    /**
     * Moves an in-progress migration to FAILED and records the cause.
     * A result that already left IN_PROGRESS keeps its status and its error.
     *
     * @return true if this call performed the transition
     */
    synchronized boolean fail(ErrorKind kind, String message) {
        return fail(kind, message, false);
    }

    /**
     * Fails an in-progress migration on behalf of the user. No error kind is recorded.
     *
     * @return false if the migration had already completed or failed
     */
    synchronized boolean cancel(String message) {
        return fail(null, message, true);
    }

    /** Returns true if the migration was failed by {@link #cancel(String)}. */
    synchronized boolean cancelled() {
        return cancelled;
    }

    private boolean fail(ErrorKind kind, String message, boolean byUser) {
        if (status != MigrationStatus.IN_PROGRESS) {
            return false;
        }
        errorMessage = message;
        errorKind = kind;
        cancelled = byUser;
        move(MigrationStatus.FAILED);
        return true;
    }

    private void move(MigrationStatus next) {
        if (next == status) {
            return;
        }
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Illegal migration status transition "
                    + status + " -> " + next + " for " + containerId);
        }
        status = next;
        statusHistory.add(next);
    }

    synchronized void addWarning(String warning) {
        if (warning != null && !warning.isEmpty()) {
            warnings.add(warning);
        }
    }

    synchronized void addWarnings(List<String> more) {
        more.forEach(this::addWarning);
    }

    synchronized void sourceCheckpointPath(String path) {
        this.sourceCheckpointPath = path;
    }

    synchronized void targetCheckpointPath(String path) {
        this.targetCheckpointPath = path;
    }

    synchronized void finish(Duration elapsed, MigrationMetrics metrics) {
        this.migrationTime = elapsed;
        this.metrics = metrics;
    }

    @Override
    public synchronized String toString() {
        return "MigrationResult{" +
                "containerId=" + containerId +
                ", status=" + status +
                ", errorKind=" + errorKind +
                ", errorMessage=" + errorMessage +
                ", warnings=" + warnings.size() +
                '}';
    }
}
