package containermigrator.packaging;

import containermigrator.config.MigratorConfig;
import containermigrator.criu.CheckpointMetadata;
import containermigrator.criu.CheckpointStatus;
import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;
import containermigrator.io.Checksums;
import containermigrator.io.Json;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;
import containermigrator.transport.RemoteTransport;
import containermigrator.transport.TransportFactory;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Packages checkpoints into checksummed archives and moves them to a target.
 *
 * <p>Every package {@code X.tar.gz} gets a sidecar {@code X.tar.gz.metadata.json}
 * holding its SHA-256. The checksum is re-verified before every unpack and,
 * when requested, before and after every transfer. Verification is fail-closed:
 * a package without a sidecar checksum fails unless
 * {@code migrator.integrity.require.sidecar=false}.
 */
public class CheckpointPackageManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointPackageManager.class);

    public static final String PACKAGE_SUFFIX = "_checkpoint.tar.gz";
    public static final String RESTORED_SUFFIX = "_restored";

    static final String SIDECAR_PUSH_WARNING = "Failed to transfer package metadata";
    static final String REMOTE_CHECKSUM_WARNING = "Remote checksum verification failed";
    static final String CLEANUP_SKIPPED_WARNING = "Source cleanup skipped: transfer was not checksum-verified";

    private final MigratorConfig config;
    private final TransportFactory transports;

    public CheckpointPackageManager(MigratorConfig config, TransportFactory transports) {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = Objects.requireNonNull(transports, "transports");
    }

    /** Returns the local working directory. */
    public Path workDir() {
        return config.workDir();
    }

    /** Returns the default package path for a container. */
    public Path defaultPackagePath(String containerId) {
        return config.workDir().resolve(containerId + PACKAGE_SUFFIX);
    }

    public PackageResult packageCheckpoint(Path checkpointDir) {
        return packageCheckpoint(checkpointDir, null);
    }

    /**
     * Archives a checkpoint directory and writes its sidecar.
     *
     * @param checkpointDir directory containing {@code metadata.json}
     * @param outPath archive path, or null for {@code <workDir>/<containerId>_checkpoint.tar.gz}
     */
    public PackageResult packageCheckpoint(Path checkpointDir, Path outPath) {
        if (!Files.isDirectory(checkpointDir)) {
            return PackageResult.failure(ErrorKind.CHECKPOINT, "Checkpoint directory not found: " + checkpointDir);
        }
        Path metadataFile = checkpointDir.resolve(CheckpointMetadata.FILE_NAME);
        if (!Files.exists(metadataFile)) {
            return PackageResult.failure(ErrorKind.CHECKPOINT, "Checkpoint metadata not found: " + metadataFile);
        }
        try {
            Map<String, Object> metadata = Json.MAPPER.readValue(metadataFile.toFile(), Json.MAP_TYPE);
            Object id = metadata.get("container_id");
            String containerId = id != null ? id.toString() : "unknown";
            Path target = outPath != null ? outPath : defaultPackagePath(containerId);

            log.info("Packaging checkpoint: {} -> {}", checkpointDir, target);
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writeArchive(checkpointDir, target);

            String checksum = Checksums.sha256(target);
            long size = Files.size(target);
            PackageSidecar sidecar = new PackageSidecar(
                    target.toString(), checksum, size, containerId, metadata,
                    OffsetDateTime.now().truncatedTo(ChronoUnit.SECONDS).toString());
            Json.MAPPER.writeValue(sidecarPath(target).toFile(), sidecar);

            log.info("Checkpoint packaged successfully: {} ({} bytes)", target, size);
            return PackageResult.success(new CheckpointPackage(target, checksum, size, containerId, metadata));
        } catch (IOException e) {
            log.error("Failed to package checkpoint {}: {}", checkpointDir, e.getMessage());
            return PackageResult.failure(ErrorKind.INTERNAL, "Failed to package checkpoint: " + e.getMessage());
        }
    }

    private static void writeArchive(Path sourceDir, Path target) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (OutputStream fileOut = new BufferedOutputStream(Files.newOutputStream(tmp));
             GzipCompressorOutputStream gzOut = new GzipCompressorOutputStream(fileOut);
             TarArchiveOutputStream tarOut = new TarArchiveOutputStream(gzOut);
             Stream<Path> walk = Files.walk(sourceDir)) {
            tarOut.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tarOut.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            for (Path file : (Iterable<Path>) walk.sorted()::iterator) {
                if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                String name = sourceDir.relativize(file).toString().replace('\\', '/');
                TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), name);
                tarOut.putArchiveEntry(entry);
                Files.copy(file, tarOut);
                tarOut.closeArchiveEntry();
            }
            tarOut.finish();
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }

    public CheckpointStatus unpack(Path packagePath) {
        return unpack(packagePath, null);
    }

    /**
     * Verifies and extracts a package.
     *
     * @param packagePath the archive
     * @param outDir extraction directory, or null for {@code <workDir>/<containerId>_restored}
     * @return a status whose {@code checkpointPath} is the extraction directory
     */
    public CheckpointStatus unpack(Path packagePath, Path outDir) {
        if (!Files.exists(packagePath)) {
            return CheckpointStatus.failure(ErrorKind.INTEGRITY, "Package not found: " + packagePath);
        }
        try {
            checkIntegrity(packagePath);
        } catch (MigrationException e) {
            log.error("Package integrity check failed: {}", e.getReason());
            return CheckpointStatus.failure(e, null, List.of());
        }

        Path target = outDir;
        if (target == null) {
            String containerId = readSidecar(packagePath).map(PackageSidecar::containerId).orElse("unknown");
            target = config.workDir().resolve(containerId + RESTORED_SUFFIX);
        }
        try {
            Files.createDirectories(target);
            log.info("Unpacking checkpoint: {} -> {}", packagePath, target);
            extractArchive(packagePath, target);
        } catch (MigrationException e) {
            return CheckpointStatus.failure(e, null, List.of());
        } catch (IOException e) {
            log.error("Failed to unpack {}: {}", packagePath, e.getMessage());
            return CheckpointStatus.failure(ErrorKind.INTERNAL, "Failed to unpack checkpoint: " + e.getMessage());
        }
        log.info("Checkpoint unpacked successfully: {}", target);
        return CheckpointStatus.success(target.toString());
    }

    private static void extractArchive(Path archive, Path outDir) throws IOException, MigrationException {
        Path root = outDir.toAbsolutePath().normalize();
        try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(archive));
             GzipCompressorInputStream gzIn = new GzipCompressorInputStream(fileIn);
             TarArchiveInputStream tarIn = new TarArchiveInputStream(gzIn)) {
            TarArchiveEntry entry;
            while ((entry = tarIn.getNextEntry()) != null) {
                Path dest = root.resolve(entry.getName()).normalize();
                if (!dest.startsWith(root) || dest.equals(root)) {
                    throw new MigrationException(ErrorKind.INTEGRITY,
                            "Archive entry escapes output directory: " + entry.getName());
                }
                if (entry.isSymbolicLink() || entry.isLink()) {
                    throw new MigrationException(ErrorKind.INTEGRITY,
                            "Archive entry is a link: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(dest);
                    continue;
                }
                Files.createDirectories(dest.getParent());
                Files.copy(tarIn, dest, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    public TransferResult transfer(TransferConfig transfer) {
        return transfer(transfer, ExecutionContext.unbounded());
    }

    /**
     * Sends a package and its sidecar to the target.
     *
     * <p>The sidecar push is best-effort. With {@code verifyChecksum} the remote
     * archive's SHA-256 must match the local one; only then does
     * {@code cleanupSource} delete the local files.
     */
    public TransferResult transfer(TransferConfig transfer, ExecutionContext ctx) {
        List<String> warnings = new ArrayList<>();
        Path source = transfer.sourcePath();
        if (!Files.exists(source)) {
            return TransferResult.failure(ErrorKind.TRANSFER, "Source package not found: " + source, warnings);
        }

        String localChecksum = null;
        if (transfer.verifyChecksum()) {
            try {
                localChecksum = checkIntegrity(source);
            } catch (MigrationException e) {
                log.error("Source package integrity check failed: {}", e.getReason());
                return TransferResult.failure(e.getKind(), e.getReason(), warnings);
            }
        }

        RemoteTransport transport;
        try {
            transport = transports.forTarget(transfer.targetHost());
        } catch (IllegalArgumentException e) {
            return TransferResult.failure(ErrorKind.TRANSFER, e.getMessage(), warnings);
        }

        String targetPath = transfer.targetPath();
        log.info("Transferring checkpoint: {} -> {}:{}", source, transport.target(), targetPath);
        try {
            String parent = remoteParent(targetPath);
            if (parent != null) {
                CommandResult mkdir = transport.exec("mkdir -p " + RemoteTransport.quote(parent), ctx);
                if (!mkdir.succeeded()) {
                    return TransferResult.failure(ErrorKind.TRANSFER,
                            "Failed to create remote directory " + parent + ": " + mkdir.diagnostics(), warnings);
                }
            }

            transport.push(source, targetPath, transfer.compress(), ctx);

            Path sidecar = sidecarPath(source);
            if (Files.exists(sidecar)) {
                try {
                    transport.push(sidecar, PackageSidecar.pathFor(targetPath), transfer.compress(), ctx);
                } catch (MigrationException e) {
                    log.warn("Failed to transfer metadata: {}", e.getReason());
                    warnings.add(SIDECAR_PUSH_WARNING);
                }
            }

            if (transfer.verifyChecksum()) {
                String remote = remoteChecksum(transport, targetPath, ctx);
                if (remote == null || !Checksums.matches(localChecksum, remote)) {
                    log.error("Remote checksum verification failed: expected {}, got {}", localChecksum, remote);
                    warnings.add(REMOTE_CHECKSUM_WARNING);
                    return TransferResult.failure(ErrorKind.TRANSFER, REMOTE_CHECKSUM_WARNING, warnings);
                }
            }
        } catch (MigrationException e) {
            log.error("Transfer failed: {}", e.getReason());
            return TransferResult.failure(e.getKind(), e.getReason(), warnings);
        }

        if (transfer.cleanupSource()) {
            if (transfer.verifyChecksum()) {
                if (!cleanupPackage(source)) {
                    warnings.add("Failed to cleanup source package " + source);
                }
            } else {
                warnings.add(CLEANUP_SKIPPED_WARNING);
            }
        }
        log.info("Checkpoint transfer completed successfully");
        return TransferResult.success(warnings);
    }

    private static String remoteChecksum(RemoteTransport transport, String path, ExecutionContext ctx)
            throws MigrationException {
        CommandResult result = transport.exec("sha256sum " + RemoteTransport.quote(path), ctx);
        if (!result.succeeded()) {
            return null;
        }
        String out = result.stdout().trim();
        if (out.isEmpty()) {
            return null;
        }
        return out.split("\\s+")[0];
    }

    static String remoteParent(String remotePath) {
        int slash = remotePath.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        return remotePath.substring(0, slash);
    }

    /**
     * Recomputes the package checksum and compares it with its sidecar.
     *
     * @return true if the package is intact
     */
    public boolean verifyIntegrity(Path packagePath) {
        try {
            checkIntegrity(packagePath);
            return true;
        } catch (MigrationException e) {
            log.error("Integrity verification of {} failed: {}", packagePath, e.getReason());
            return false;
        }
    }

    /**
     * @return the verified checksum
     * @throws MigrationException {@code INTEGRITY} on mismatch or missing sidecar
     */
    String checkIntegrity(Path packagePath) throws MigrationException {
        String actual;
        try {
            actual = Checksums.sha256(packagePath);
        } catch (IOException e) {
            throw new MigrationException(ErrorKind.INTEGRITY, "Cannot read package " + packagePath + ": " + e.getMessage(), e);
        }
        Optional<PackageSidecar> sidecar = readSidecar(packagePath);
        String expected = sidecar.map(PackageSidecar::checksum).orElse(null);
        if (expected == null || expected.isBlank()) {
            if (config.requireSidecar()) {
                throw new MigrationException(ErrorKind.INTEGRITY,
                        "No checksum recorded for package " + packagePath);
            }
            log.warn("No checksum recorded for {}; skipping verification", packagePath);
            return actual;
        }
        if (!Checksums.matches(expected, actual)) {
            throw new MigrationException(ErrorKind.INTEGRITY,
                    "Checksum mismatch: expected " + expected + ", got " + actual);
        }
        log.debug("Package integrity verification passed: {}", packagePath);
        return actual;
    }

    private Optional<PackageSidecar> readSidecar(Path packagePath) {
        Path sidecar = sidecarPath(packagePath);
        if (!Files.exists(sidecar)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Json.MAPPER.readValue(sidecar.toFile(), PackageSidecar.class));
        } catch (IOException e) {
            log.warn("Unreadable package metadata {}: {}", sidecar, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns size, freshly computed checksum and sidecar fields of a package.
     * Sidecar fields override the computed ones, as recorded at packaging time.
     */
    public Optional<Map<String, Object>> getPackageInfo(Path packagePath) {
        if (!Files.exists(packagePath)) {
            return Optional.empty();
        }
        try {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("package_path", packagePath.toString());
            info.put("size_bytes", Files.size(packagePath));
            info.put("checksum", Checksums.sha256(packagePath));
            Path sidecar = sidecarPath(packagePath);
            if (Files.exists(sidecar)) {
                info.putAll(Json.MAPPER.readValue(sidecar.toFile(), Json.MAP_TYPE));
            }
            return Optional.of(info);
        } catch (IOException e) {
            log.error("Failed to get package info for {}: {}", packagePath, e.getMessage());
            return Optional.empty();
        }
    }

    public List<Map<String, Object>> listPackages() {
        return listPackages(config.workDir());
    }

    /** Lists every {@code *.tar.gz} package in a directory. */
    public List<Map<String, Object>> listPackages(Path directory) {
        List<Map<String, Object>> packages = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return packages;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.tar.gz")) {
            for (Path file : files) {
                getPackageInfo(file).ifPresent(packages::add);
            }
        } catch (IOException e) {
            log.error("Failed to list packages in {}: {}", directory, e.getMessage());
        }
        return packages;
    }

    /**
     * Removes a package and its sidecar.
     *
     * @return true if neither file remains
     */
    public boolean cleanupPackage(Path packagePath) {
        try {
            for (Path file : List.of(packagePath, sidecarPath(packagePath))) {
                if (Files.deleteIfExists(file)) {
                    log.info("Removed file: {}", file);
                }
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to cleanup package {}: {}", packagePath, e.getMessage());
            return false;
        }
    }

    static Path sidecarPath(Path packagePath) {
        return packagePath.resolveSibling(packagePath.getFileName() + PackageSidecar.SUFFIX);
    }
}
