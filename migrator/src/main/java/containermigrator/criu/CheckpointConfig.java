package containermigrator.criu;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one checkpoint dump.
 *
 * @param containerId container to checkpoint
 * @param checkpointDir base directory; the dump is written to {@code <checkpointDir>/<containerId>}
 * @param leaveRunning keep the container running after the dump
 * @param tcpEstablished checkpoint established TCP connections
 * @param shellJob allow a process attached to a terminal session
 * @param extUnixSk allow external unix sockets
 * @param fileLocks checkpoint file locks
 */
public record CheckpointConfig(
        String containerId,
        Path checkpointDir,
        boolean leaveRunning,
        boolean tcpEstablished,
        boolean shellJob,
        boolean extUnixSk,
        boolean fileLocks
) {

    public CheckpointConfig {
        Objects.requireNonNull(containerId, "containerId");
        Objects.requireNonNull(checkpointDir, "checkpointDir");
        if (containerId.isBlank() || containerId.contains("/") || containerId.equals("..")) {
            throw new IllegalArgumentException("Invalid container id: " + containerId);
        }
    }

    /**
     * Creates a config with the default preservation options: stop the
     * container and preserve TCP, shell job, unix sockets and file locks.
     */
    public static CheckpointConfig defaults(String containerId, Path checkpointDir) {
        return new CheckpointConfig(containerId, checkpointDir, false, true, true, true, true);
    }

    /** Returns the directory the dump is written to. */
    public Path dumpDir() {
        return checkpointDir.resolve(containerId);
    }

    /** Returns the preservation options as persisted flags. */
    public DumpFlags dumpFlags() {
        return new DumpFlags(tcpEstablished, shellJob, extUnixSk, fileLocks, leaveRunning);
    }
}
