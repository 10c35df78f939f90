package containermigrator.transport;

import containermigrator.config.MigratorConfig;
import containermigrator.process.ToolExecutor;

import java.util.Objects;

/**
 * Default {@link TransportFactory}: {@code adb:} targets get an
 * {@link AdbTransport}, everything else an {@link SshTransport}.
 */
public final class RemoteTransports implements TransportFactory {

    private final ToolExecutor executor;
    private final MigratorConfig config;

    public RemoteTransports(ToolExecutor executor, MigratorConfig config) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** Returns true if {@code targetHost} names a device-bridge target. */
    public static boolean isAdbTarget(String targetHost) {
        return targetHost != null && targetHost.startsWith(AdbTransport.PREFIX);
    }

    @Override
    public RemoteTransport forTarget(String targetHost) {
        if (targetHost == null || targetHost.isBlank()) {
            throw new IllegalArgumentException("targetHost must not be blank");
        }
        if (isAdbTarget(targetHost)) {
            return new AdbTransport(executor,
                    config.adbCommand(),
                    targetHost.substring(AdbTransport.PREFIX.length()),
                    config.targetCriuAdb(),
                    config.transferTimeout(),
                    config.remoteExecTimeout(),
                    config.probeTimeout());
        }
        return new SshTransport(executor,
                targetHost,
                config.sshCommand(),
                config.scpCommand(),
                config.targetCriuSsh(),
                config.transferTimeout(),
                config.remoteExecTimeout(),
                config.probeTimeout());
    }
}
