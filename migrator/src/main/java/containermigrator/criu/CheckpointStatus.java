package containermigrator.criu;

import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;

import java.util.List;

/**
 * Outcome of a checkpoint tool operation.
 *
 * @param success whether the operation succeeded
 * @param checkpointPath the checkpoint directory involved; set on failure when a partial dump was kept
 * @param errorKind classification of the failure, null on success
 * @param errorMessage the failure description, null on success
 * @param warnings non-fatal observations
 */
public record CheckpointStatus(
        boolean success,
        String checkpointPath,
        ErrorKind errorKind,
        String errorMessage,
        List<String> warnings
) {

    public CheckpointStatus {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CheckpointStatus success(String checkpointPath, List<String> warnings) {
        return new CheckpointStatus(true, checkpointPath, null, null, warnings);
    }

    public static CheckpointStatus success(String checkpointPath) {
        return success(checkpointPath, List.of());
    }

    public static CheckpointStatus failure(ErrorKind kind, String message, String checkpointPath, List<String> warnings) {
        return new CheckpointStatus(false, checkpointPath, kind, message, warnings);
    }

    public static CheckpointStatus failure(ErrorKind kind, String message) {
        return failure(kind, message, null, List.of());
    }

    /**
     * Create a failure from a classified exception.
     *
     * @param e the failure
     * @param checkpointPath path of a partial checkpoint, or null
     * @param warnings warnings gathered before the failure
     * @return a failed status
     */
    public static CheckpointStatus failure(MigrationException e, String checkpointPath, List<String> warnings) {
        return failure(e.getKind(), e.getReason(), checkpointPath, warnings);
    }
}
