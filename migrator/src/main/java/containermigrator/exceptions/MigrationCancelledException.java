package containermigrator.exceptions;

/**
 * Exception thrown when a migration is cancelled while one of its steps runs.
 *
 * <p>Raised by the command layer when the {@link containermigrator.process.ExecutionContext}
 * is cancelled before or while a child process runs. The orchestrator stops the
 * pipeline and skips rollback.
 */
public class MigrationCancelledException extends RuntimeException {

    private final String operation;

    /**
     * Creates a new cancellation exception.
     *
     * @param operation the operation that was running or about to run
     */
    public MigrationCancelledException(String operation) {
        super("Operation '" + operation + "' cancelled");
        this.operation = operation;
    }

    /** Returns the operation that was interrupted by the cancellation. */
    public String getOperation() {
        return operation;
    }
}
