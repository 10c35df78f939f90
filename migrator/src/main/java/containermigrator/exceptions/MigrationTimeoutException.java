package containermigrator.exceptions;

import java.time.Duration;

/**
 * The migration-wide deadline ran out.
 *
 * <p>{@link containermigrator.process.ExecutionContext} throws it at a step
 * boundary, and the command layer throws it when a child process outlives the
 * remaining budget. The orchestrator reports it as a {@link ErrorKind#TRANSFER}
 * or {@link ErrorKind#CHECKPOINT} failure depending on the step, then rolls
 * back if the migration asked for it.
 *
 * <p>A tool's own timeout is not this exception: it comes back as a timed-out
 * {@link containermigrator.process.CommandResult}.
 */
public class MigrationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration deadline;

    /**
     * @param operation the tool or step that was running, e.g. {@code scp} or {@code transfer}
     * @param deadline the whole migration's budget
     */
    public MigrationTimeoutException(String operation, Duration deadline) {
        super("Operation '" + operation + "' timed out after " + deadline.toMillis() + " ms");
        this.operation = operation;
        this.deadline = deadline;
    }

    public String getOperation() {
        return operation;
    }

    /** Returns the migration's deadline, not the time the operation itself ran. */
    public Duration getDeadline() {
        return deadline;
    }
}
