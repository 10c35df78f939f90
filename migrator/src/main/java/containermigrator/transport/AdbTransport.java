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
 * Transport to an Android device over {@code adb}.
 *
 * <p>The device id {@code default} or an empty id omits {@code -s}, so adb
 * picks its only attached device. {@code adb push} has no compression switch;
 * the compress flag is ignored.
 */
public class AdbTransport implements RemoteTransport {

    private static final Logger log = LoggerFactory.getLogger(AdbTransport.class);

    public static final String PREFIX = "adb:";
    static final String DEFAULT_DEVICE = "default";

    private final ToolExecutor executor;
    private final String adbCommand;
    private final String device;
    private final String criuCommand;
    private final Duration transferTimeout;
    private final Duration execTimeout;
    private final Duration probeTimeout;

    public AdbTransport(ToolExecutor executor,
                        String adbCommand,
                        String device,
                        String criuCommand,
                        Duration transferTimeout,
                        Duration execTimeout,
                        Duration probeTimeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.adbCommand = Objects.requireNonNull(adbCommand, "adbCommand");
        this.device = device != null ? device.trim() : "";
        this.criuCommand = Objects.requireNonNull(criuCommand, "criuCommand");
        this.transferTimeout = transferTimeout;
        this.execTimeout = execTimeout;
        this.probeTimeout = probeTimeout;
    }

    /** Returns the device id, possibly empty or {@code default}. */
    public String device() {
        return device;
    }

    @Override
    public String target() {
        return PREFIX + device;
    }

    @Override
    public Tool tool() {
        return Tool.ADB;
    }

    @Override
    public void push(Path local, String remotePath, boolean compress, ExecutionContext ctx) throws MigrationException {
        List<String> cmd = base();
        cmd.add("push");
        cmd.add(local.toString());
        cmd.add(remotePath);
        executor.runChecked(Tool.ADB, "Transfer failed", cmd, ctx, transferTimeout);
        log.debug("Pushed {} to {}:{}", local, target(), remotePath);
    }

    @Override
    public CommandResult exec(String shellCommand, ExecutionContext ctx) throws MigrationException {
        List<String> cmd = base();
        cmd.add("shell");
        cmd.add(shellCommand);
        return executor.run(Tool.ADB, cmd, ctx, execTimeout);
    }

    @Override
    public boolean probe(ExecutionContext ctx) {
        List<String> cmd = base();
        cmd.add("shell");
        cmd.add("echo");
        cmd.add("test");
        try {
            return executor.run(Tool.ADB, cmd, ctx, probeTimeout).succeeded();
        } catch (MigrationException e) {
            log.debug("Probe of {} failed: {}", target(), e.getReason());
            return false;
        }
    }

    @Override
    public String criuCommand() {
        return criuCommand;
    }

    private List<String> base() {
        List<String> cmd = new ArrayList<>();
        cmd.add(adbCommand);
        if (!device.isEmpty() && !DEFAULT_DEVICE.equals(device)) {
            cmd.add("-s");
            cmd.add(device);
        }
        return cmd;
    }
}
