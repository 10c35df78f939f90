package containermigrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import containermigrator.alert.MigrationAlertLogger;
import containermigrator.config.MigratorConfig;
import containermigrator.config.MigratorConfigLoader;
import containermigrator.criu.CheckpointConfig;
import containermigrator.criu.CheckpointMetadata;
import containermigrator.criu.CheckpointStatus;
import containermigrator.criu.CheckpointToolManager;
import containermigrator.criu.CriuCommands;
import containermigrator.criu.DumpFlags;
import containermigrator.exceptions.ErrorClassifier;
import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationCancelledException;
import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.MigrationTimeoutException;
import containermigrator.exceptions.Tool;
import containermigrator.metrics.MigrationMetrics.Step;
import containermigrator.metrics.MigrationMetricsCollector;
import containermigrator.packaging.CheckpointPackage;
import containermigrator.packaging.CheckpointPackageManager;
import containermigrator.packaging.PackageResult;
import containermigrator.packaging.TransferConfig;
import containermigrator.packaging.TransferResult;
import containermigrator.process.CommandResult;
import containermigrator.process.CommandRunner;
import containermigrator.process.ExecutionContext;
import containermigrator.process.ProcessCommandRunner;
import containermigrator.process.ToolExecutor;
import containermigrator.rollback.RollbackManager;
import containermigrator.rollback.RollbackOutcome;
import containermigrator.runtime.ContainerInfo;
import containermigrator.runtime.ContainerRuntime;
import containermigrator.runtime.DockerContainerRuntime;
import containermigrator.transport.RemoteTransport;
import containermigrator.transport.RemoteTransports;
import containermigrator.transport.TransportFactory;
import containermigrator.validation.RestoreValidator;
import containermigrator.validation.ValidationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Migrates a running container to a target host end-to-end:
 *  - prerequisites (container running, checkpoint tool usable, target reachable)
 *  - compatibility gate
 *  - checkpoint on the source
 *  - package and transfer with checksum verification
 *  - unpack and restore on the target
 *  - validation that the restored container is live
 *  - rollback from the source checkpoint if a step after the gate fails
 *
 * Notes:
 *  - {@link #migrate(MigrationConfig)} never throws; every outcome is a {@link MigrationResult}.
 *  - One active migration per container id. A concurrent call for the same id is rejected.
 *  - Cancellation is observed between steps and kills the running external command.
 */
public final class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    static final String CANCELLED_MESSAGE = "Migration cancelled by user";
    static final String SOURCE_CHECKPOINTS_DIR = "source_checkpoints";

    private static final Set<String> SUPPORTED_ARCHITECTURES = Set.of("amd64", "arm64", "unknown");

    private final MigratorConfig config;
    private final ContainerRuntime runtime;
    private final TransportFactory transports;
    private final CheckpointToolManager tools;
    private final CheckpointPackageManager packages;
    private final RestoreValidator validator;
    private final RollbackManager rollbackManager;

    private final ActiveMigrationRegistry registry = new ActiveMigrationRegistry();

    /**
     * Creates an orchestrator configured from the classpath
     * ({@code migrator.properties} or {@code migrator.yml}), or the defaults.
     */
    public MigrationOrchestrator() {
        this(MigratorConfigLoader.loadOrDefaults());
    }

    public MigrationOrchestrator(MigratorConfig config) {
        this(config, new ProcessCommandRunner());
    }

    /**
     * Creates an orchestrator whose external commands all go through {@code runner}.
     */
    public MigrationOrchestrator(MigratorConfig config, CommandRunner runner) {
        this(config, new ToolExecutor(runner));
    }

    private MigrationOrchestrator(MigratorConfig config, ToolExecutor executor) {
        this(config,
                new DockerContainerRuntime(executor, config.runtimeCommand(), config.probeTimeout()),
                new RemoteTransports(executor, config),
                executor);
    }

    private MigrationOrchestrator(MigratorConfig config,
                                  ContainerRuntime runtime,
                                  TransportFactory transports,
                                  ToolExecutor executor) {
        this(config, runtime, transports,
                new CheckpointToolManager(config, executor, runtime),
                new CheckpointPackageManager(config, transports),
                new RestoreValidator(config.runtimeCommand(), config.validationPollInterval()));
    }

    MigrationOrchestrator(MigratorConfig config,
                          ContainerRuntime runtime,
                          TransportFactory transports,
                          CheckpointToolManager tools,
                          CheckpointPackageManager packages,
                          RestoreValidator validator) {
        this.config = Objects.requireNonNull(config, "config");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.packages = Objects.requireNonNull(packages, "packages");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.rollbackManager = new RollbackManager(tools);
        MigrationAlertLogger.setAlertLevel(config.alertLevel());
    }

    public MigratorConfig config() {
        return config;
    }

    public CheckpointToolManager checkpointTools() {
        return tools;
    }

    public CheckpointPackageManager packageManager() {
        return packages;
    }

    /* ---------------- migration ---------------- */

    /**
     * Runs a migration to completion on the calling thread.
     *
     * @param migration what to migrate and where
     * @return the outcome; {@link MigrationResult#success()} is the authoritative signal
     */
    public MigrationResult migrate(MigrationConfig migration) {
        Objects.requireNonNull(migration, "migration");
        String containerId = migration.containerId();
        MigrationResult result = new MigrationResult(containerId);
        MigrationHandle handle = new MigrationHandle(migration, result,
                ExecutionContext.withDeadline(migration.deadline()));

        result.transitionTo(MigrationStatus.IN_PROGRESS);
        if (!registry.acquire(handle)) {
            String message = "Migration already in progress for container " + containerId;
            log.warn(message);
            result.reject(message);
            MigrationAlertLogger.migrationFailed(containerId, ErrorKind.VALIDATION, message, null);
            return result;
        }

        MigrationMetricsCollector collector = new MigrationMetricsCollector().start(containerId);
        long start = System.nanoTime();
        try {
            MigrationAlertLogger.migrationStarted(containerId, migration.targetHost());
            new Pipeline(handle, collector).run();
        } finally {
            registry.release(handle);
            result.finish(Duration.ofNanos(System.nanoTime() - start), collector.finish());
        }

        if (result.success()) {
            MigrationAlertLogger.migrationCompleted(containerId, result.metrics());
        } else {
            log.warn("Migration of {} ended {}: {} ({})", containerId, result.status(),
                    result.errorMessage(), result.metrics().summary());
        }
        return result;
    }

    /**
     * Cancels an active migration.
     *
     * <p>Fails its result and kills the external command it is running. The
     * pipeline stops at its next step boundary without rolling back, deletes
     * its source checkpoint and only then gives up the container id, so a
     * new migration of the same container is rejected until it has.
     *
     * @return false if no migration of {@code containerId} is active, or it
     *         has already completed or failed
     */
    public boolean cancelMigration(String containerId) {
        Optional<MigrationHandle> active = registry.get(containerId);
        if (active.isEmpty()) {
            return false;
        }
        MigrationHandle handle = active.get();
        if (!handle.result().cancel(CANCELLED_MESSAGE)) {
            log.info("Migration of {} already ended {}, not cancelled", containerId, handle.result().status());
            return false;
        }
        handle.context().cancel();
        MigrationAlertLogger.migrationCancelled(containerId);
        log.info("Migration of {} cancelled", containerId);
        return true;
    }

    /** Returns the live result of an active migration. */
    public Optional<MigrationResult> getMigrationStatus(String containerId) {
        return registry.get(containerId).map(MigrationHandle::result);
    }

    public List<MigrationResult> listActiveMigrations() {
        return registry.list().stream()
                .map(MigrationHandle::result)
                .collect(Collectors.toList());
    }

    /**
     * Checks prerequisites and compatibility without checkpointing anything.
     */
    public MigrationPreflight preflight(MigrationConfig migration) {
        ExecutionContext ctx = ExecutionContext.withDeadline(migration.deadline());
        PrerequisiteCheck prerequisites = validatePrerequisites(migration, ctx);
        CompatibilityCheck compatibility = checkCompatibility(
                migration.containerId(), migration.targetArch(), migration.preserveVolumes(), ctx);
        return new MigrationPreflight(prerequisites, compatibility);
    }

    /* ---------------- gating checks ---------------- */

    public PrerequisiteCheck validatePrerequisites(MigrationConfig migration) {
        return validatePrerequisites(migration, ExecutionContext.unbounded());
    }

    /**
     * Checks the container is running, the checkpoint tool is usable and the
     * target answers its transport's probe. Every failed prerequisite is reported.
     */
    public PrerequisiteCheck validatePrerequisites(MigrationConfig migration, ExecutionContext ctx) {
        String containerId = migration.containerId();
        List<String> errors = new ArrayList<>();
        ErrorKind firstKind = null;

        try {
            ContainerInfo info = runtime.inspect(containerId, ctx);
            if (!info.isRunning()) {
                errors.add("Container " + containerId + " is not running");
                firstKind = ErrorKind.VALIDATION;
            }
        } catch (MigrationException e) {
            errors.add(e.getReason());
            firstKind = e.getKind();
        }

        CheckpointStatus environment = tools.configureEnvironment(ctx);
        if (!environment.success()) {
            errors.add("CRIU environment configuration failed: " + environment.errorMessage());
            if (firstKind == null) firstKind = ErrorKind.ENVIRONMENT;
        }

        boolean reachable;
        try {
            reachable = transports.forTarget(migration.targetHost()).probe(ctx);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid target {}: {}", migration.targetHost(), e.getMessage());
            reachable = false;
        }
        if (!reachable) {
            errors.add("Cannot connect to target host: " + migration.targetHost());
            if (firstKind == null) firstKind = ErrorKind.TRANSFER;
        }

        if (errors.isEmpty()) {
            return PrerequisiteCheck.passed();
        }
        log.warn("Prerequisites for {} not met: {}", containerId, errors);
        return new PrerequisiteCheck(false, errors, firstKind);
    }

    public CompatibilityCheck checkCompatibility(String containerId, String targetArch) {
        return checkCompatibility(containerId, targetArch, true, ExecutionContext.unbounded());
    }

    /**
     * Assesses whether a container can run on the target.
     *
     * <p>Privileged mode, host networking and device mounts are hard
     * incompatibilities. Bind mounts (unless {@code preserveVolumes} is false),
     * added capabilities and an image built for another architecture are
     * reported as issues without clearing a flag.
     */
    public CompatibilityCheck checkCompatibility(String containerId,
                                                 String targetArch,
                                                 boolean preserveVolumes,
                                                 ExecutionContext ctx) {
        ContainerInfo info;
        try {
            info = runtime.inspect(containerId, ctx);
        } catch (MigrationException e) {
            return CompatibilityCheck.unavailable("Compatibility check failed: " + e.getReason());
        }

        List<String> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        boolean architectureCompatible = true;
        boolean kernelCompatible = true;
        boolean runtimeCompatible = true;

        String architecture = info.architecture() != null && !info.architecture().isBlank()
                ? info.architecture()
                : runtime.imageArchitecture(info.image(), ctx);
        architecture = normalizeArchitecture(architecture);
        if (!SUPPORTED_ARCHITECTURES.contains(architecture)) {
            architectureCompatible = false;
            issues.add("Unsupported image architecture: " + architecture);
            recommendations.add("Rebuild the image for amd64 or arm64");
        } else if (!"unknown".equals(architecture) && targetArch != null
                && !architecture.equals(normalizeArchitecture(targetArch))) {
            issues.add("Image architecture " + architecture + " differs from target architecture " + targetArch);
            recommendations.add("Use a multi-architecture image or rebuild it for " + targetArch);
        }

        if (info.privileged()) {
            kernelCompatible = false;
            issues.add("Privileged containers may not migrate properly");
            recommendations.add("Run the container without --privileged");
        }

        if (info.usesHostNetwork()) {
            runtimeCompatible = false;
            issues.add("Host networking mode not compatible with migration");
            recommendations.add("Use bridge networking instead of host networking");
        }
        if (!info.devices().isEmpty()) {
            runtimeCompatible = false;
            issues.add("Device mounts may not be available on target");
            recommendations.add("Remove device mappings or make the devices available on the target");
        }

        if (preserveVolumes && !info.binds().isEmpty()) {
            issues.add("Host bind mounts may not exist on target");
            recommendations.add("Use named volumes, or create the bind-mounted paths on the target");
        }
        if (!info.capAdd().isEmpty()) {
            issues.add("Additional capabilities may not be available on target");
            recommendations.add("Drop capabilities the workload does not need: " + String.join(", ", info.capAdd()));
        }

        boolean compatible = architectureCompatible && kernelCompatible && runtimeCompatible;
        log.debug("Compatibility of {} with {}: compatible={}, issues={}", containerId, targetArch, compatible, issues);
        return new CompatibilityCheck(compatible, architectureCompatible, kernelCompatible,
                runtimeCompatible, issues, recommendations);
    }

    static String normalizeArchitecture(String arch) {
        if (arch == null || arch.isBlank()) {
            return "unknown";
        }
        String lower = arch.trim().toLowerCase(Locale.ROOT);
        switch (lower) {
            case "x86_64":
            case "x64":
                return "amd64";
            case "aarch64":
            case "arm64/v8":
                return "arm64";
            default:
                return lower;
        }
    }

    /* ---------------- pipeline ---------------- */

    /**
     * One run of the migration steps. Holds what a later step or a rollback needs.
     */
    private final class Pipeline {

        private final MigrationConfig migration;
        private final MigrationResult result;
        private final ExecutionContext ctx;
        private final MigrationMetricsCollector collector;
        private final String containerId;

        private Step currentStep;
        private Path dumpDir;
        private Path sourceCheckpoint;

        Pipeline(MigrationHandle handle, MigrationMetricsCollector collector) {
            this.migration = handle.config();
            this.result = handle.result();
            this.ctx = handle.context();
            this.collector = collector;
            this.containerId = handle.containerId();
        }

        void run() {
            try {
                step(Step.PREREQUISITES, this::prerequisites);
                step(Step.COMPATIBILITY, this::compatibility);
                sourceCheckpoint = step(Step.CHECKPOINT, this::checkpoint);
                CheckpointPackage pkg = step(Step.PACKAGE, () -> packageCheckpoint(sourceCheckpoint));
                String remoteArchive = step(Step.TRANSFER, () -> transfer(pkg));
                RemoteTransport transport = transports.forTarget(migration.targetHost());
                step(Step.RESTORE, () -> restoreOnTarget(transport, remoteArchive));
                step(Step.VALIDATION, () -> validate(transport));
                checkActive(Step.VALIDATION);

                if (result.complete()) {
                    log.info("Migration of {} to {} completed", containerId, migration.targetHost());
                } else {
                    throw new MigrationCancelledException("complete");
                }
            } catch (MigrationException e) {
                if (ctx.isExpired()) {
                    MigrationAlertLogger.migrationTimeout(containerId, ctx.deadline().toMillis(), currentStep);
                }
                failed(e.getKind(), e.getReason());
            } catch (MigrationTimeoutException e) {
                MigrationAlertLogger.migrationTimeout(containerId, e.getDeadline().toMillis(), currentStep);
                failed(timeoutKind(currentStep), e.getMessage());
            } catch (MigrationCancelledException e) {
                result.cancel(CANCELLED_MESSAGE);
                log.info("Migration of {} stopped after cancellation during {}", containerId, currentStep);
            } catch (RuntimeException e) {
                log.error("Unexpected failure migrating {}", containerId, e);
                failed(ErrorKind.INTERNAL, "Unexpected error during " + currentStep + ": " + e.getMessage());
            }
            if (result.cancelled()) {
                cleanupCancelledCheckpoint();
            }
        }

        private <T> T step(Step step, MigrationMetricsCollector.ThrowingSupplier<T, MigrationException> action)
                throws MigrationException {
            checkActive(step);
            currentStep = step;
            MigrationAlertLogger.stepStarted(containerId, step);
            T value = collector.timed(step, action);
            MigrationAlertLogger.stepCompleted(containerId, step, collector.lastDuration(step));
            return value;
        }

        private void checkActive(Step step) {
            if (ctx.isCancelled()) {
                throw new MigrationCancelledException(step.name().toLowerCase(Locale.ROOT));
            }
            ctx.checkDeadline(step.name().toLowerCase(Locale.ROOT));
        }

        private Void prerequisites() throws MigrationException {
            PrerequisiteCheck check = validatePrerequisites(migration, ctx);
            if (!check.valid()) {
                throw new MigrationException(check.errorKind(),
                        "Prerequisites validation failed: " + String.join("; ", check.errors()));
            }
            return null;
        }

        private Void compatibility() throws MigrationException {
            CompatibilityCheck check = checkCompatibility(
                    containerId, migration.targetArch(), migration.preserveVolumes(), ctx);
            if (!check.compatible()) {
                throw new MigrationException(ErrorKind.VALIDATION,
                        "Container not compatible: " + String.join("; ", check.issues()));
            }
            result.addWarnings(check.issues());
            return null;
        }

        private Path checkpoint() throws MigrationException {
            Path baseDir = config.workDir().resolve(SOURCE_CHECKPOINTS_DIR);
            try {
                Files.createDirectories(baseDir);
            } catch (IOException e) {
                throw new MigrationException(ErrorKind.ENVIRONMENT,
                        "Cannot create checkpoint directory " + baseDir + ": " + e.getMessage(), e);
            }
            CheckpointConfig checkpoint = new CheckpointConfig(containerId, baseDir,
                    false, migration.preserveNetworking(), true, true, true);
            dumpDir = checkpoint.dumpDir();
            CheckpointStatus status = tools.dump(checkpoint, ctx);
            result.addWarnings(status.warnings());
            if (!status.success()) {
                throw new MigrationException(status.errorKind(), "Checkpoint creation failed: " + status.errorMessage());
            }
            result.sourceCheckpointPath(status.checkpointPath());
            return Path.of(status.checkpointPath());
        }

        private CheckpointPackage packageCheckpoint(Path checkpointDir) throws MigrationException {
            PackageResult packaged = packages.packageCheckpoint(checkpointDir);
            if (!packaged.success()) {
                throw new MigrationException(packaged.errorKind(), "Failed to package checkpoint: " + packaged.errorMessage());
            }
            CheckpointPackage pkg = packaged.checkpointPackage();
            collector.packageSize(pkg.sizeBytes());
            return pkg;
        }

        private String transfer(CheckpointPackage pkg) throws MigrationException {
            String remoteArchive = config.targetWorkDir() + "/" + containerId + CheckpointPackageManager.PACKAGE_SUFFIX;
            TransferResult transferred = packages.transfer(
                    new TransferConfig(pkg.packagePath(), migration.targetHost(), remoteArchive, true, true, false), ctx);
            result.addWarnings(transferred.warnings());
            if (!transferred.success()) {
                throw new MigrationException(transferred.errorKind(),
                        "Failed to transfer checkpoint to target: " + transferred.errorMessage());
            }
            return remoteArchive;
        }

        private Void restoreOnTarget(RemoteTransport transport, String remoteArchive) throws MigrationException {
            String restoreDir = config.targetWorkDir() + "/" + containerId + CheckpointPackageManager.RESTORED_SUFFIX;

            String extract = "mkdir -p " + RemoteTransport.quote(restoreDir)
                    + " && tar -xzf " + RemoteTransport.quote(remoteArchive)
                    + " -C " + RemoteTransport.quote(restoreDir);
            CommandResult unpacked = transport.exec(extract, ctx);
            if (!unpacked.succeeded()) {
                throw new MigrationException(
                        ErrorClassifier.classifyRemote(transport.tool(), Tool.TAR, unpacked.exitCode()),
                        "Failed to restore container on target: unpack failed: " + unpacked.diagnostics());
            }
            result.targetCheckpointPath(restoreDir);

            CommandResult restored = transport.exec(remoteRestoreCommand(transport, restoreDir), ctx);
            if (!restored.succeeded()) {
                throw new MigrationException(
                        ErrorClassifier.classifyRemote(transport.tool(), Tool.CRIU, restored.exitCode()),
                        "Failed to restore container on target: " + restored.diagnostics());
            }
            log.info("Container {} restored on {} from {}", containerId, transport.target(), restoreDir);
            return null;
        }

        private String remoteRestoreCommand(RemoteTransport transport, String restoreDir) throws MigrationException {
            CheckpointMetadata metadata = tools.readMetadata(sourceCheckpoint);
            DumpFlags flags = metadata.dumpFlags();
            if (flags == null) {
                result.addWarning(CheckpointToolManager.LEGACY_FLAGS_WARNING);
                flags = DumpFlags.LEGACY;
            }
            return transport.criuCommand() + " " + CriuCommands.restoreArgs(restoreDir, flags).stream()
                    .map(RemoteTransport::quote)
                    .collect(Collectors.joining(" "));
        }

        private Void validate(RemoteTransport transport) throws MigrationException {
            ValidationResult validation = validator.validate(
                    transport, containerId, migration.validationTimeout(), ctx);
            if (!validation.live()) {
                result.addWarning("Container validation failed - not running on target");
                throw new MigrationException(ErrorKind.CHECKPOINT,
                        "Migration validation failed: " + validation.message());
            }
            return null;
        }

        private void failed(ErrorKind kind, String message) {
            if (!result.fail(kind, message)) {
                // cancelled concurrently
                return;
            }
            MigrationAlertLogger.migrationFailed(containerId, kind, message, currentStep);
            if (migration.rollbackOnFailure() && currentStep != null
                    && currentStep.ordinal() >= Step.CHECKPOINT.ordinal()) {
                rollback(message);
            }
        }

        private void rollback(String reason) {
            if (ctx.isCancelled()) {
                return;
            }
            MigrationAlertLogger.rollbackTriggered(containerId, reason);
            RollbackOutcome outcome = collector.timed(Step.ROLLBACK,
                    () -> rollbackManager.rollback(containerId, sourceCheckpoint));
            result.addWarning(outcome.warning());
            if (outcome.isSuccess()) {
                result.transitionTo(MigrationStatus.ROLLED_BACK);
            }
            MigrationAlertLogger.rollbackCompleted(containerId, outcome.isSuccess());
        }

        private void cleanupCancelledCheckpoint() {
            Path checkpoint = sourceCheckpoint != null ? sourceCheckpoint : dumpDir;
            if (checkpoint != null && !tools.cleanupCheckpoint(checkpoint)) {
                log.warn("Failed to clean up checkpoint {} of cancelled migration {}", checkpoint, containerId);
            }
        }
    }

    /** Kind of a deadline expiry, by the tool the step runs. */
    static ErrorKind timeoutKind(Step step) {
        if (step == null) {
            return ErrorKind.CHECKPOINT;
        }
        switch (step) {
            case TRANSFER:
            case RESTORE:
            case VALIDATION:
                return ErrorKind.TRANSFER;
            default:
                return ErrorKind.CHECKPOINT;
        }
    }
}
