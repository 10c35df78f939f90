package containermigrator.rollback;

/**
 * Result of a rollback attempt. {@link #warning()} is always added to the
 * migration result.
 *
 * @param status what happened
 * @param warning human-readable outcome
 */
public record RollbackOutcome(Status status, String warning) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static final String SUCCESS_WARNING = "Migration rolled back successfully";
    public static final String SKIPPED_WARNING = "Rollback skipped: no source checkpoint available";

    public static RollbackOutcome succeeded() {
        return new RollbackOutcome(Status.SUCCEEDED, SUCCESS_WARNING);
    }

    public static RollbackOutcome failed(String reason) {
        return new RollbackOutcome(Status.FAILED, "Rollback failed: " + reason);
    }

    public static RollbackOutcome skipped() {
        return new RollbackOutcome(Status.SKIPPED, SKIPPED_WARNING);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
