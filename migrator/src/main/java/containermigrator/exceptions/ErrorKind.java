package containermigrator.exceptions;

/**
 * Classification of fatal migration failures.
 *
 * <p>Every failed {@link containermigrator.criu.CheckpointStatus},
 * {@link containermigrator.packaging.TransferResult} and
 * {@link containermigrator.engine.MigrationResult} carries one of these kinds
 * so callers can branch on the cause without parsing messages. A migration
 * cancelled by the caller is failed without a kind.
 *
 * @see ErrorClassifier
 */
public enum ErrorKind {
    /** Checkpoint tool or another executable is missing, not executable, or fails its self-check. */
    ENVIRONMENT,

    /** Container missing or not running, or a hard-incompatible configuration. Raised before any checkpoint exists. */
    VALIDATION,

    /** Checkpoint dump or restore exited non-zero. */
    CHECKPOINT,

    /** Copy or remote-exec failure, including remote checksum mismatch. */
    TRANSFER,

    /** Package checksum does not match its sidecar record, or the sidecar is missing. */
    INTEGRITY,

    /** Unexpected failure inside the library itself. */
    INTERNAL
}
