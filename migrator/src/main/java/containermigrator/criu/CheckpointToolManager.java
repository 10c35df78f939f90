package containermigrator.criu;

import com.fasterxml.jackson.databind.JsonNode;
import containermigrator.config.MigratorConfig;
import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.Tool;
import containermigrator.io.Json;
import containermigrator.process.ExecutionContext;
import containermigrator.process.ToolExecutor;
import containermigrator.runtime.ContainerInfo;
import containermigrator.runtime.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Drives the checkpoint tool binary.
 *
 * <p>Checks the environment and container eligibility, then runs dump, dump
 * validation and restore. Every public operation reports failure through a
 * {@link CheckpointStatus} or a boolean; none throws for an operational failure.
 *
 * <p>A dump writes {@code metadata.json} next to the tool's image files,
 * including the {@link DumpFlags} used, so that a later restore mirrors them.
 */
public class CheckpointToolManager {

    private static final Logger log = LoggerFactory.getLogger(CheckpointToolManager.class);

    static final int LOG_TAIL_LINES = 20;
    public static final String LEGACY_FLAGS_WARNING =
            "Checkpoint metadata has no dump flags; restoring with --shell-job --ext-unix-sk --file-locks";

    private final MigratorConfig config;
    private final ToolExecutor executor;
    private final ContainerRuntime runtime;

    public CheckpointToolManager(MigratorConfig config, ToolExecutor executor, ContainerRuntime runtime) {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    /** Returns the checkpoint tool binary this manager runs. */
    public Path binary() {
        return config.criuBinary();
    }

    public CheckpointStatus configureEnvironment() {
        return configureEnvironment(ExecutionContext.unbounded());
    }

    /**
     * Verifies the checkpoint tool is present, executable and passes its self-check.
     *
     * @return success, or an {@code ENVIRONMENT} failure
     */
    public CheckpointStatus configureEnvironment(ExecutionContext ctx) {
        Path binary = config.criuBinary();
        if (!Files.exists(binary)) {
            log.error("CRIU binary not found at {}", binary);
            return CheckpointStatus.failure(ErrorKind.ENVIRONMENT, "CRIU binary not found at " + binary);
        }
        if (!Files.isExecutable(binary) && !binary.toFile().setExecutable(true, false)) {
            log.error("CRIU binary at {} is not executable", binary);
            return CheckpointStatus.failure(ErrorKind.ENVIRONMENT, "CRIU binary is not executable: " + binary);
        }
        try {
            executor.runChecked(Tool.CRIU, "CRIU check failed",
                    CriuCommands.check(binary.toString()), ctx, config.probeTimeout());
        } catch (MigrationException e) {
            log.error("CRIU environment check failed: {}", e.getReason());
            return CheckpointStatus.failure(ErrorKind.ENVIRONMENT, e.getReason());
        }
        log.info("CRIU environment configured successfully");
        return CheckpointStatus.success(null);
    }

    public CheckpointEligibility validateForCheckpoint(String containerId) {
        return validateForCheckpoint(containerId, ExecutionContext.unbounded());
    }

    /**
     * Checks a container exists and is running, and collects configurations
     * that may not checkpoint cleanly.
     */
    public CheckpointEligibility validateForCheckpoint(String containerId, ExecutionContext ctx) {
        ContainerInfo info;
        try {
            info = runtime.inspect(containerId, ctx);
        } catch (MigrationException e) {
            return CheckpointEligibility.rejected(e.getReason());
        }
        return eligibility(containerId, info);
    }

    static CheckpointEligibility eligibility(String containerId, ContainerInfo info) {
        if (!info.isRunning()) {
            return CheckpointEligibility.rejected("Container " + containerId + " is not running");
        }
        List<String> warnings = new ArrayList<>();
        if (info.privileged()) warnings.add("Container is running in privileged mode");
        if (info.usesHostNetwork()) warnings.add("Container uses host networking");
        if (!info.binds().isEmpty()) warnings.add("Container has bind mounts");
        if (!info.exposedPorts().isEmpty()) warnings.add("Container has exposed ports");
        return CheckpointEligibility.eligible(warnings);
    }

    public CheckpointStatus dump(CheckpointConfig checkpoint) {
        return dump(checkpoint, ExecutionContext.unbounded());
    }

    /**
     * Checkpoints a running container into {@code <checkpointDir>/<containerId>}.
     *
     * <p>On a tool failure the partial directory is kept for diagnosis and its
     * path is reported in the returned status.
     */
    public CheckpointStatus dump(CheckpointConfig checkpoint, ExecutionContext ctx) {
        String containerId = checkpoint.containerId();
        CheckpointEligibility eligibility = validateForCheckpoint(containerId, ctx);
        if (!eligibility.eligible()) {
            return CheckpointStatus.failure(ErrorKind.VALIDATION,
                    "Container validation failed: " + String.join("; ", eligibility.messages()));
        }
        List<String> warnings = new ArrayList<>(eligibility.messages());

        Path dir = checkpoint.dumpDir();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            return CheckpointStatus.failure(ErrorKind.ENVIRONMENT,
                    "Cannot create checkpoint directory " + dir + ": " + e.getMessage(), null, warnings);
        }

        int pid;
        try {
            pid = runtime.pid(containerId, ctx);
        } catch (MigrationException e) {
            return CheckpointStatus.failure(e, null, warnings);
        }

        DumpFlags flags = checkpoint.dumpFlags();
        log.info("Creating checkpoint for container {} (pid {}) in {}", containerId, pid, dir);
        try {
            executor.runChecked(Tool.CRIU, "CRIU dump failed",
                    CriuCommands.dump(config.criuBinary().toString(), pid, dir.toString(), flags),
                    ctx, config.dumpTimeout());
        } catch (MigrationException e) {
            String message = e.getReason() + dumpLogTail(dir.resolve(CriuCommands.DUMP_LOG));
            log.error("Checkpoint of {} failed, partial dump kept at {}", containerId, dir);
            return CheckpointStatus.failure(e.getKind(), message, dir.toString(), warnings);
        }

        CheckpointMetadata metadata = new CheckpointMetadata(
                containerId,
                OffsetDateTime.now().truncatedTo(ChronoUnit.SECONDS).toString(),
                HostInfo.architecture(),
                HostInfo.kernelVersion(),
                runtime.version(ctx),
                warnings,
                flags);
        try {
            Json.MAPPER.writeValue(dir.resolve(CheckpointMetadata.FILE_NAME).toFile(), metadata);
        } catch (IOException e) {
            return CheckpointStatus.failure(ErrorKind.INTERNAL,
                    "Failed to write checkpoint metadata: " + e.getMessage(), dir.toString(), warnings);
        }

        log.info("Checkpoint created successfully at {}", dir);
        return CheckpointStatus.success(dir.toString(), warnings);
    }

    /**
     * Checks a checkpoint directory is complete: metadata with the required
     * keys, and a dump log. Error or warning lines in the log become warnings.
     */
    public CheckpointStatus validateDump(Path checkpointPath) {
        try {
            readMetadata(checkpointPath);
            String dumpLog = Files.readString(checkpointPath.resolve(CriuCommands.DUMP_LOG), StandardCharsets.UTF_8);
            List<String> warnings = new ArrayList<>();
            if (dumpLog.contains("Error")) warnings.add("Errors found in dump log");
            if (dumpLog.contains("Warning")) warnings.add("Warnings found in dump log");
            log.info("Checkpoint validation successful: {}", checkpointPath);
            return CheckpointStatus.success(checkpointPath.toString(), warnings);
        } catch (MigrationException e) {
            return CheckpointStatus.failure(e, null, List.of());
        } catch (IOException e) {
            return CheckpointStatus.failure(ErrorKind.CHECKPOINT,
                    "Checkpoint validation failed: " + e.getMessage());
        }
    }

    /**
     * Reads and checks a checkpoint's metadata.
     *
     * @throws MigrationException {@code CHECKPOINT} if the directory, a required
     *         file or a required key is missing, or the metadata is unreadable
     */
    public CheckpointMetadata readMetadata(Path checkpointPath) throws MigrationException {
        if (!Files.isDirectory(checkpointPath)) {
            throw new MigrationException(ErrorKind.CHECKPOINT, "Checkpoint directory not found: " + checkpointPath);
        }
        List<String> missingFiles = new ArrayList<>();
        for (String name : List.of(CheckpointMetadata.FILE_NAME, CriuCommands.DUMP_LOG)) {
            if (!Files.exists(checkpointPath.resolve(name))) {
                missingFiles.add(name);
            }
        }
        if (!missingFiles.isEmpty()) {
            throw new MigrationException(ErrorKind.CHECKPOINT, "Missing checkpoint files: " + missingFiles);
        }
        try {
            JsonNode node = Json.MAPPER.readTree(checkpointPath.resolve(CheckpointMetadata.FILE_NAME).toFile());
            List<String> missingKeys = new ArrayList<>();
            for (String key : CheckpointMetadata.REQUIRED_KEYS) {
                if (!node.hasNonNull(key)) {
                    missingKeys.add(key);
                }
            }
            if (!missingKeys.isEmpty()) {
                throw new MigrationException(ErrorKind.CHECKPOINT, "Missing metadata fields: " + missingKeys);
            }
            return Json.MAPPER.treeToValue(node, CheckpointMetadata.class);
        } catch (IOException e) {
            throw new MigrationException(ErrorKind.CHECKPOINT, "Unreadable checkpoint metadata: " + e.getMessage(), e);
        }
    }

    public CheckpointStatus restore(Path checkpointPath, String newContainerId) {
        return restore(checkpointPath, newContainerId, ExecutionContext.unbounded());
    }

    /**
     * Restores a checkpoint locally with the flags it was dumped with.
     *
     * @param checkpointPath the checkpoint directory
     * @param newContainerId name to report for the restored container, or null for the original
     * @param ctx execution scope
     */
    public CheckpointStatus restore(Path checkpointPath, String newContainerId, ExecutionContext ctx) {
        CheckpointStatus validation = validateDump(checkpointPath);
        if (!validation.success()) {
            return validation;
        }
        List<String> warnings = new ArrayList<>(validation.warnings());
        CheckpointMetadata metadata;
        try {
            metadata = readMetadata(checkpointPath);
        } catch (MigrationException e) {
            return CheckpointStatus.failure(e, null, warnings);
        }

        DumpFlags flags = metadata.dumpFlags();
        if (flags == null) {
            flags = DumpFlags.LEGACY;
            warnings.add(LEGACY_FLAGS_WARNING);
        }
        String target = newContainerId != null ? newContainerId : metadata.containerId();
        log.info("Restoring checkpoint from {} as {}", checkpointPath, target);
        try {
            executor.runChecked(Tool.CRIU, "CRIU restore failed",
                    CriuCommands.restore(config.criuBinary().toString(), checkpointPath.toString(), flags),
                    ctx, config.restoreTimeout());
        } catch (MigrationException e) {
            log.error("Restore from {} failed: {}", checkpointPath, e.getReason());
            return CheckpointStatus.failure(e, checkpointPath.toString(), warnings);
        }
        log.info("Checkpoint restored successfully");
        return CheckpointStatus.success(checkpointPath.toString(), warnings);
    }

    /**
     * Lists the checkpoints under the configured base directory.
     *
     * @return each checkpoint's metadata as a map, plus its {@code checkpoint_path}
     */
    public List<Map<String, Object>> listCheckpoints() {
        return listCheckpoints(config.checkpointDir());
    }

    public List<Map<String, Object>> listCheckpoints(Path baseDir) {
        List<Map<String, Object>> checkpoints = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) {
            return checkpoints;
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
            for (Path dir : dirs) {
                Path metadataFile = dir.resolve(CheckpointMetadata.FILE_NAME);
                if (!Files.exists(metadataFile)) {
                    continue;
                }
                try {
                    Map<String, Object> entry = Json.MAPPER.readValue(metadataFile.toFile(), Json.MAP_TYPE);
                    entry.put("checkpoint_path", dir.toString());
                    checkpoints.add(entry);
                } catch (IOException e) {
                    log.warn("Skipping checkpoint with unreadable metadata {}: {}", metadataFile, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list checkpoints in {}: {}", baseDir, e.getMessage());
        }
        return checkpoints;
    }

    /**
     * Recursively removes a checkpoint directory.
     *
     * @return true if the directory no longer exists
     */
    public boolean cleanupCheckpoint(Path checkpointPath) {
        if (!Files.exists(checkpointPath)) {
            return true;
        }
        try {
            deleteRecursively(checkpointPath);
            log.info("Cleaned up checkpoint: {}", checkpointPath);
            return true;
        } catch (IOException e) {
            log.error("Failed to cleanup checkpoint {}: {}", checkpointPath, e.getMessage());
            return false;
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                try {
                    Files.delete(p);
                } catch (NoSuchFileException e) {
                    log.debug("Already removed: {}", p);
                }
            }
        }
    }

    private static String dumpLogTail(Path dumpLog) {
        if (!Files.exists(dumpLog)) {
            return "";
        }
        try {
            List<String> lines = Files.readAllLines(dumpLog, StandardCharsets.UTF_8);
            List<String> tail = lines.subList(Math.max(0, lines.size() - LOG_TAIL_LINES), lines.size());
            return tail.isEmpty() ? "" : "\n--- " + CriuCommands.DUMP_LOG + " (tail) ---\n" + String.join("\n", tail);
        } catch (IOException e) {
            log.debug("Could not read {}: {}", dumpLog, e.getMessage());
            return "";
        }
    }
}
