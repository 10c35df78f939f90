package containermigrator.packaging;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one package transfer.
 *
 * @param sourcePath local archive
 * @param targetHost {@code adb:<device>} or a remote-shell host
 * @param targetPath destination path on the target
 * @param compress request transport-level compression
 * @param verifyChecksum verify the archive before sending and compare the remote checksum after
 * @param cleanupSource delete the local archive and sidecar after a verified transfer
 */
public record TransferConfig(
        Path sourcePath,
        String targetHost,
        String targetPath,
        boolean compress,
        boolean verifyChecksum,
        boolean cleanupSource
) {

    public TransferConfig {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(targetHost, "targetHost");
        Objects.requireNonNull(targetPath, "targetPath");
    }

    /** Creates a config with compression and verification on and no cleanup. */
    public static TransferConfig of(Path sourcePath, String targetHost, String targetPath) {
        return new TransferConfig(sourcePath, targetHost, targetPath, true, true, false);
    }
}
