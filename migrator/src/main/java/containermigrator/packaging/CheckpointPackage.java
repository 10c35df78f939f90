package containermigrator.packaging;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A packaged checkpoint.
 *
 * @param packagePath the archive
 * @param checksum SHA-256 of the archive, lowercase hex
 * @param sizeBytes archive size
 * @param containerId container the checkpoint belongs to
 * @param metadata the checkpoint's {@code metadata.json} contents
 */
public record CheckpointPackage(
        Path packagePath,
        String checksum,
        long sizeBytes,
        String containerId,
        Map<String, Object> metadata
) {

    public CheckpointPackage {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
