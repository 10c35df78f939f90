package containermigrator.criu;

import java.util.ArrayList;
import java.util.List;

/**
 * Command lines for the checkpoint tool.
 */
public final class CriuCommands {

    public static final String DUMP_LOG = "dump.log";
    public static final String RESTORE_LOG = "restore.log";

    private CriuCommands() {}

    public static List<String> check(String binary) {
        return List.of(binary, "check");
    }

    public static List<String> dump(String binary, int pid, String dir, DumpFlags flags) {
        List<String> cmd = new ArrayList<>(List.of(
                binary, "dump",
                "-t", Integer.toString(pid),
                "-D", dir,
                "-v4",
                "--log-file", dir + "/" + DUMP_LOG));
        cmd.addAll(flags.dumpArgs());
        return cmd;
    }

    /**
     * Returns the restore arguments without the binary, so callers can prefix
     * a local path or a remote invocation.
     */
    public static List<String> restoreArgs(String dir, DumpFlags flags) {
        List<String> args = new ArrayList<>(List.of(
                "restore",
                "-D", dir,
                "-v4",
                "--log-file", dir + "/" + RESTORE_LOG));
        args.addAll(flags.restoreArgs());
        return args;
    }

    public static List<String> restore(String binary, String dir, DumpFlags flags) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.addAll(restoreArgs(dir, flags));
        return cmd;
    }
}
