package containermigrator.exceptions;

import java.util.Objects;

/**
 * Exception thrown when a migration operation fails.
 *
 * <p>Carries the {@link ErrorKind} of the failure and, optionally, the container
 * and pipeline step involved. Used internally between collaborators; the public
 * managers and the orchestrator convert it into result values at their boundary.
 *
 * @see ErrorKind
 * @see containermigrator.engine.MigrationOrchestrator
 */
public class MigrationException extends Exception {

    private final ErrorKind kind;
    private final String containerId;
    private final String step;

    /**
     * Creates a new migration exception.
     *
     * @param kind the failure classification (must not be null)
     * @param message the error message
     */
    public MigrationException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    /**
     * Creates a new migration exception with a cause.
     *
     * @param kind the failure classification (must not be null)
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrationException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    /**
     * Creates a new migration exception with full diagnostic context.
     *
     * @param kind the failure classification (must not be null)
     * @param message the error message
     * @param containerId the container being migrated (may be null)
     * @param step the pipeline step where the failure occurred (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrationException(ErrorKind kind,
                              String message,
                              String containerId,
                              String step,
                              Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.containerId = containerId;
        this.step = step;
    }

    /** Returns the failure classification. */
    public ErrorKind getKind() {
        return kind;
    }

    /** Returns the container involved, or null if not set. */
    public String getContainerId() {
        return containerId;
    }

    /** Returns the pipeline step where the failure occurred, or null if not set. */
    public String getStep() {
        return step;
    }

    /**
     * Returns the bare message without the diagnostic suffix.
     *
     * @return the message passed at construction
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));
        sb.append(" [kind=").append(kind).append("]");
        if (step != null) sb.append(" [step=").append(step).append("]");
        if (containerId != null) sb.append(" [container=").append(containerId).append("]");
        return sb.toString();
    }
}
