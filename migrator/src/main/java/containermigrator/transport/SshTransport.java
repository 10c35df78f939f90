package containermigrator.transport;

import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.Tool;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;
import containermigrator.process.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transport to a remote host over {@code ssh} and {@code scp}.
 *
 * <p>Every ssh call carries {@code -o ConnectTimeout=<probe timeout>} when a
 * probe timeout is configured, so an unreachable host fails quickly.
 */
public class SshTransport implements RemoteTransport {

    private static final Logger log = LoggerFactory.getLogger(SshTransport.class);

    private final ToolExecutor executor;
    private final String host;
    private final String sshCommand;
    private final String scpCommand;
    private final String criuCommand;
    private final Duration transferTimeout;
    private final Duration execTimeout;
    private final Duration connectTimeout;

    public SshTransport(ToolExecutor executor,
                        String host,
                        String sshCommand,
                        String scpCommand,
                        String criuCommand,
                        Duration transferTimeout,
                        Duration execTimeout,
                        Duration connectTimeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.host = Objects.requireNonNull(host, "host");
        this.sshCommand = Objects.requireNonNull(sshCommand, "sshCommand");
        this.scpCommand = Objects.requireNonNull(scpCommand, "scpCommand");
        this.criuCommand = Objects.requireNonNull(criuCommand, "criuCommand");
        this.transferTimeout = transferTimeout;
        this.execTimeout = execTimeout;
        this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ZERO;
    }

    @Override
    public String target() {
        return host;
    }

    @Override
    public Tool tool() {
        return Tool.SSH;
    }

    @Override
    public void push(Path local, String remotePath, boolean compress, ExecutionContext ctx) throws MigrationException {
        List<String> cmd = new ArrayList<>();
        cmd.add(scpCommand);
        if (compress) {
            cmd.add("-C");
        }
        cmd.add(local.toString());
        cmd.add(host + ":" + remotePath);
        executor.runChecked(Tool.SCP, "Transfer failed", cmd, ctx, transferTimeout);
        log.debug("Copied {} to {}:{}", local, host, remotePath);
    }

    @Override
    public CommandResult exec(String shellCommand, ExecutionContext ctx) throws MigrationException {
        List<String> cmd = base();
        cmd.add(shellCommand);
        return executor.run(Tool.SSH, cmd, ctx, execTimeout);
    }

    @Override
    public boolean probe(ExecutionContext ctx) {
        List<String> cmd = base();
        cmd.add("echo");
        cmd.add("test");
        try {
            return executor.run(Tool.SSH, cmd, ctx, connectTimeout).succeeded();
        } catch (MigrationException e) {
            log.debug("Probe of {} failed: {}", host, e.getReason());
            return false;
        }
    }

    @Override
    public String criuCommand() {
        return criuCommand;
    }

    private List<String> base() {
        List<String> cmd = new ArrayList<>();
        cmd.add(sshCommand);
        if (!connectTimeout.isZero()) {
            cmd.add("-o");
            cmd.add("ConnectTimeout=" + connectTimeout.toSeconds());
        }
        cmd.add(host);
        return cmd;
    }
}
