package containermigrator.rollback;

import containermigrator.criu.CheckpointStatus;
import containermigrator.criu.CheckpointToolManager;
import containermigrator.process.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resumes the source container from its source checkpoint after a failed migration.
 *
 * <p>Rollback never throws. Every path produces a {@link RollbackOutcome}
 * whose warning the orchestrator records.
 *
 * @see CheckpointToolManager#restore(Path, String, ExecutionContext)
 */
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final CheckpointToolManager tools;

    /**
     * @param tools the checkpoint tool used to restore (must not be null)
     */
    public RollbackManager(CheckpointToolManager tools) {
        this.tools = Objects.requireNonNull(tools);
    }

    /**
     * Restores the source container from {@code sourceCheckpoint}.
     *
     * <p>Runs under its own unbounded context: an expired migration deadline
     * must not prevent the source from being resumed.
     *
     * @param containerId the container to resume
     * @param sourceCheckpoint the local checkpoint directory, or null if none was made
     */
    public RollbackOutcome rollback(String containerId, Path sourceCheckpoint) {
        if (sourceCheckpoint == null) {
            log.warn("No checkpoint available to roll back {}", containerId);
            return RollbackOutcome.skipped();
        }
        try {
            CheckpointStatus status = tools.restore(sourceCheckpoint, containerId, ExecutionContext.unbounded());
            if (status.success()) {
                log.info("Rolled back {} from {}", containerId, sourceCheckpoint);
                return RollbackOutcome.succeeded();
            }
            return RollbackOutcome.failed(status.errorMessage());
        } catch (RuntimeException e) {
            log.error("Rollback of {} failed unexpectedly", containerId, e);
            return RollbackOutcome.failed(String.valueOf(e.getMessage()));
        }
    }
}
