package containermigrator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Library-wide settings for the migrator.
 *
 * <p>Covers executable locations, local and remote working directories,
 * per-tool timeouts, validation polling, integrity policy and alert level.
 * Per-migration settings live in {@link containermigrator.engine.MigrationConfig}.
 *
 * <p>Loaded from {@code migrator.properties} or {@code migrator.yml} with
 * {@link MigratorConfigLoader}. A zero timeout means no per-call limit.
 *
 * @see MigratorConfigLoader
 */
public final class MigratorConfig {

    public static final String DEFAULT_CRIU_BINARY = "/data/local/tmp/criu";
    public static final String DEFAULT_CHECKPOINT_DIR = "/data/local/tmp/checkpoints";
    public static final String DEFAULT_WORK_DIR = "/data/local/tmp/migration";
    public static final String DEFAULT_ADB_CRIU = "LD_LIBRARY_PATH=/data/local/tmp/lib /data/local/tmp/criu";

    public static final MigratorConfig DEFAULTS = builder().build();

    private final Path criuBinary;
    private final Path checkpointDir;
    private final Path workDir;
    private final String targetWorkDir;
    private final String targetCriuSsh;
    private final String targetCriuAdb;
    private final String runtimeCommand;
    private final String sshCommand;
    private final String scpCommand;
    private final String adbCommand;
    private final Duration probeTimeout;
    private final Duration dumpTimeout;
    private final Duration restoreTimeout;
    private final Duration transferTimeout;
    private final Duration remoteExecTimeout;
    private final Duration validationPollInterval;
    private final boolean requireSidecar;
    private final AlertLevel alertLevel;

    private MigratorConfig(Builder b) {
        this.criuBinary = b.criuBinary;
        this.checkpointDir = b.checkpointDir;
        this.workDir = b.workDir;
        this.targetWorkDir = b.targetWorkDir;
        this.targetCriuSsh = b.targetCriuSsh;
        this.targetCriuAdb = b.targetCriuAdb;
        this.runtimeCommand = b.runtimeCommand;
        this.sshCommand = b.sshCommand;
        this.scpCommand = b.scpCommand;
        this.adbCommand = b.adbCommand;
        this.probeTimeout = b.probeTimeout;
        this.dumpTimeout = b.dumpTimeout;
        this.restoreTimeout = b.restoreTimeout;
        this.transferTimeout = b.transferTimeout;
        this.remoteExecTimeout = b.remoteExecTimeout;
        this.validationPollInterval = b.validationPollInterval;
        this.requireSidecar = b.requireSidecar;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this configuration's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.criuBinary = criuBinary;
        b.checkpointDir = checkpointDir;
        b.workDir = workDir;
        b.targetWorkDir = targetWorkDir;
        b.targetCriuSsh = targetCriuSsh;
        b.targetCriuAdb = targetCriuAdb;
        b.runtimeCommand = runtimeCommand;
        b.sshCommand = sshCommand;
        b.scpCommand = scpCommand;
        b.adbCommand = adbCommand;
        b.probeTimeout = probeTimeout;
        b.dumpTimeout = dumpTimeout;
        b.restoreTimeout = restoreTimeout;
        b.transferTimeout = transferTimeout;
        b.remoteExecTimeout = remoteExecTimeout;
        b.validationPollInterval = validationPollInterval;
        b.requireSidecar = requireSidecar;
        b.alertLevel = alertLevel;
        return b;
    }

    /** Returns the local checkpoint tool binary. */
    public Path criuBinary() { return criuBinary; }

    /** Returns the base directory for standalone checkpoints. */
    public Path checkpointDir() { return checkpointDir; }

    /** Returns the local working directory for packages and orchestrated checkpoints. */
    public Path workDir() { return workDir; }

    /** Returns the working directory on the target host. */
    public String targetWorkDir() { return targetWorkDir; }

    /** Returns the checkpoint tool invocation on remote-shell targets. */
    public String targetCriuSsh() { return targetCriuSsh; }

    /** Returns the checkpoint tool invocation on device-bridge targets. */
    public String targetCriuAdb() { return targetCriuAdb; }

    /** Returns the container runtime executable. */
    public String runtimeCommand() { return runtimeCommand; }

    public String sshCommand() { return sshCommand; }

    public String scpCommand() { return scpCommand; }

    public String adbCommand() { return adbCommand; }

    /** Returns the timeout for target reachability probes. */
    public Duration probeTimeout() { return probeTimeout; }

    public Duration dumpTimeout() { return dumpTimeout; }

    public Duration restoreTimeout() { return restoreTimeout; }

    /** Returns the timeout for a single archive or sidecar push. */
    public Duration transferTimeout() { return transferTimeout; }

    /** Returns the timeout for a single remote command. */
    public Duration remoteExecTimeout() { return remoteExecTimeout; }

    /** Returns the delay between checks while waiting for a restored container. */
    public Duration validationPollInterval() { return validationPollInterval; }

    /** Returns true if a package without a sidecar checksum fails verification. */
    public boolean requireSidecar() { return requireSidecar; }

    /** Returns the alert level for event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "criuBinary=" + criuBinary +
                ", workDir=" + workDir +
                ", targetWorkDir=" + targetWorkDir +
                ", runtimeCommand=" + runtimeCommand +
                ", dumpTimeout=" + dumpTimeout.toSeconds() + "s" +
                ", transferTimeout=" + transferTimeout.toSeconds() + "s" +
                ", requireSidecar=" + requireSidecar +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigratorConfig} instances.
     */
    public static final class Builder {
        private Path criuBinary = Path.of(DEFAULT_CRIU_BINARY);
        private Path checkpointDir = Path.of(DEFAULT_CHECKPOINT_DIR);
        private Path workDir = Path.of(DEFAULT_WORK_DIR);
        private String targetWorkDir = DEFAULT_WORK_DIR;
        private String targetCriuSsh = "criu";
        private String targetCriuAdb = DEFAULT_ADB_CRIU;
        private String runtimeCommand = "docker";
        private String sshCommand = "ssh";
        private String scpCommand = "scp";
        private String adbCommand = "adb";
        private Duration probeTimeout = Duration.ofSeconds(10);
        private Duration dumpTimeout = Duration.ZERO;
        private Duration restoreTimeout = Duration.ZERO;
        private Duration transferTimeout = Duration.ZERO;
        private Duration remoteExecTimeout = Duration.ZERO;
        private Duration validationPollInterval = Duration.ofMillis(2000);
        private boolean requireSidecar = true;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder criuBinary(Path path) {
            this.criuBinary = Objects.requireNonNull(path, "criuBinary");
            return this;
        }

        public Builder checkpointDir(Path dir) {
            this.checkpointDir = Objects.requireNonNull(dir, "checkpointDir");
            return this;
        }

        public Builder workDir(Path dir) {
            this.workDir = Objects.requireNonNull(dir, "workDir");
            return this;
        }

        public Builder targetWorkDir(String dir) {
            this.targetWorkDir = requireText(dir, "targetWorkDir");
            return this;
        }

        public Builder targetCriuSsh(String command) {
            this.targetCriuSsh = requireText(command, "targetCriuSsh");
            return this;
        }

        public Builder targetCriuAdb(String command) {
            this.targetCriuAdb = requireText(command, "targetCriuAdb");
            return this;
        }

        public Builder runtimeCommand(String command) {
            this.runtimeCommand = requireText(command, "runtimeCommand");
            return this;
        }

        public Builder sshCommand(String command) {
            this.sshCommand = requireText(command, "sshCommand");
            return this;
        }

        public Builder scpCommand(String command) {
            this.scpCommand = requireText(command, "scpCommand");
            return this;
        }

        public Builder adbCommand(String command) {
            this.adbCommand = requireText(command, "adbCommand");
            return this;
        }

        public Builder probeTimeoutSeconds(long seconds) {
            this.probeTimeout = seconds(seconds);
            return this;
        }

        public Builder dumpTimeout(Duration timeout) {
            this.dumpTimeout = nonNegative(timeout, "dumpTimeout");
            return this;
        }

        public Builder dumpTimeoutSeconds(long seconds) {
            return dumpTimeout(seconds(seconds));
        }

        public Builder restoreTimeout(Duration timeout) {
            this.restoreTimeout = nonNegative(timeout, "restoreTimeout");
            return this;
        }

        public Builder restoreTimeoutSeconds(long seconds) {
            return restoreTimeout(seconds(seconds));
        }

        public Builder transferTimeout(Duration timeout) {
            this.transferTimeout = nonNegative(timeout, "transferTimeout");
            return this;
        }

        public Builder transferTimeoutSeconds(long seconds) {
            return transferTimeout(seconds(seconds));
        }

        public Builder remoteExecTimeout(Duration timeout) {
            this.remoteExecTimeout = nonNegative(timeout, "remoteExecTimeout");
            return this;
        }

        public Builder remoteExecTimeoutSeconds(long seconds) {
            return remoteExecTimeout(seconds(seconds));
        }

        public Builder validationPollInterval(Duration interval) {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new MigratorConfigException("validationPollInterval must be positive");
            }
            this.validationPollInterval = interval;
            return this;
        }

        public Builder validationPollIntervalMillis(long millis) {
            return validationPollInterval(Duration.ofMillis(millis));
        }

        public Builder requireSidecar(boolean require) {
            this.requireSidecar = require;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }

        private static Duration seconds(long seconds) {
            return seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO;
        }

        private static Duration nonNegative(Duration d, String name) {
            if (d == null || d.isNegative()) {
                throw new MigratorConfigException(name + " must not be negative");
            }
            return d;
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new MigratorConfigException(name + " must not be blank");
            }
            return value;
        }
    }
}
