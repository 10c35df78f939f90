package containermigrator.criu;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-state preservation options of a dump, persisted in
 * {@code metadata.json} so a restore can mirror them.
 *
 * @param tcpEstablished checkpoint established TCP connections
 * @param shellJob allow a process attached to a terminal session
 * @param extUnixSk allow external unix sockets
 * @param fileLocks checkpoint file locks
 * @param leaveRunning keep the source running after the dump
 */
public record DumpFlags(
        @JsonProperty("tcp_established") boolean tcpEstablished,
        @JsonProperty("shell_job") boolean shellJob,
        @JsonProperty("ext_unix_sk") boolean extUnixSk,
        @JsonProperty("file_locks") boolean fileLocks,
        @JsonProperty("leave_running") boolean leaveRunning
) {

    /** Restore flags assumed for checkpoints written without persisted flags. */
    public static final DumpFlags LEGACY = new DumpFlags(false, true, true, true, false);

    /** Returns the command-line switches for {@code criu dump}. */
    public List<String> dumpArgs() {
        List<String> args = new ArrayList<>();
        if (leaveRunning) args.add("--leave-running");
        args.addAll(restoreArgs());
        return args;
    }

    /** Returns the command-line switches for {@code criu restore}. */
    public List<String> restoreArgs() {
        List<String> args = new ArrayList<>();
        if (tcpEstablished) args.add("--tcp-established");
        if (shellJob) args.add("--shell-job");
        if (extUnixSk) args.add("--ext-unix-sk");
        if (fileLocks) args.add("--file-locks");
        return args;
    }
}
