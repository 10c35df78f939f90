package containermigrator.engine;

/**
 * Lifecycle of a migration.
 *
 * <pre>
 * PENDING -&gt; IN_PROGRESS -&gt; COMPLETED
 *                        \-&gt; FAILED -&gt; ROLLED_BACK
 * </pre>
 */
public enum MigrationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    /** Returns true if moving from this status to {@code next} is a legal edge. */
    boolean canMoveTo(MigrationStatus next) {
        switch (this) {
            case PENDING:
                return next == IN_PROGRESS;
            case IN_PROGRESS:
                return next == COMPLETED || next == FAILED;
            case FAILED:
                return next == ROLLED_BACK;
            default:
                return false;
        }
    }

    /** Returns true for statuses no further step can leave, apart from rollback. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }
}
