package containermigrator.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of one migration.
 *
 * @param containerId container to migrate
 * @param sourceHost host the container runs on (informational; the source is always local)
 * @param targetHost {@code adb:<device>} or a remote-shell host
 * @param sourceArch source architecture, default {@code x86_64}
 * @param targetArch target architecture, default {@code aarch64}
 * @param preserveNetworking checkpoint established TCP connections
 * @param preserveVolumes treat bind mounts as a compatibility issue to report
 * @param rollbackOnFailure resume the source from its checkpoint if a later step fails
 * @param validationTimeout how long to wait for the restored container to appear
 * @param deadline bound on the whole migration, or null for none
 */
public record MigrationConfig(
        String containerId,
        String sourceHost,
        String targetHost,
        String sourceArch,
        String targetArch,
        boolean preserveNetworking,
        boolean preserveVolumes,
        boolean rollbackOnFailure,
        Duration validationTimeout,
        Duration deadline
) {

    public static final Duration DEFAULT_VALIDATION_TIMEOUT = Duration.ofSeconds(300);

    public MigrationConfig {
        Objects.requireNonNull(containerId, "containerId");
        Objects.requireNonNull(targetHost, "targetHost");
        if (containerId.isBlank() || containerId.contains("/")) {
            throw new IllegalArgumentException("Invalid container id: " + containerId);
        }
        if (targetHost.isBlank()) {
            throw new IllegalArgumentException("targetHost must not be blank");
        }
        if (validationTimeout == null || validationTimeout.isNegative()) {
            throw new IllegalArgumentException("validationTimeout must not be negative");
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive");
        }
    }

    /**
     * Creates a builder with the default options.
     */
    public static Builder builder(String containerId, String sourceHost, String targetHost) {
        return new Builder(containerId, sourceHost, targetHost);
    }

    /** Creates a config with every option at its default. */
    public static MigrationConfig of(String containerId, String sourceHost, String targetHost) {
        return builder(containerId, sourceHost, targetHost).build();
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private final String containerId;
        private final String sourceHost;
        private final String targetHost;
        private String sourceArch = "x86_64";
        private String targetArch = "aarch64";
        private boolean preserveNetworking = true;
        private boolean preserveVolumes = true;
        private boolean rollbackOnFailure = true;
        private Duration validationTimeout = DEFAULT_VALIDATION_TIMEOUT;
        private Duration deadline;

        private Builder(String containerId, String sourceHost, String targetHost) {
            this.containerId = containerId;
            this.sourceHost = sourceHost;
            this.targetHost = targetHost;
        }

        public Builder sourceArch(String arch) {
            this.sourceArch = arch;
            return this;
        }

        public Builder targetArch(String arch) {
            this.targetArch = arch;
            return this;
        }

        public Builder preserveNetworking(boolean preserve) {
            this.preserveNetworking = preserve;
            return this;
        }

        public Builder preserveVolumes(boolean preserve) {
            this.preserveVolumes = preserve;
            return this;
        }

        public Builder rollbackOnFailure(boolean rollback) {
            this.rollbackOnFailure = rollback;
            return this;
        }

        public Builder validationTimeout(Duration timeout) {
            this.validationTimeout = timeout;
            return this;
        }

        public Builder validationTimeoutSeconds(long seconds) {
            return validationTimeout(Duration.ofSeconds(seconds));
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(containerId, sourceHost, targetHost, sourceArch, targetArch,
                    preserveNetworking, preserveVolumes, rollbackOnFailure, validationTimeout, deadline);
        }
    }
}
