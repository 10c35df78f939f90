package containermigrator.process;

import java.util.List;

/**
 * Outcome of one external command.
 *
 * @param command the command line that was run
 * @param exitCode the exit status, or -1 if the process was killed on timeout
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param timedOut whether the process was killed because it ran past its timeout
 */
public record CommandResult(
        List<String> command,
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut
) {

    public CommandResult {
        command = List.copyOf(command);
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    /**
     * Create a result for a process that exited on its own.
     *
     * @param command the command line
     * @param exitCode the exit status
     * @param stdout captured standard output
     * @param stderr captured standard error
     * @return the result
     */
    public static CommandResult exited(List<String> command, int exitCode, String stdout, String stderr) {
        return new CommandResult(command, exitCode, stdout, stderr, false);
    }

    /**
     * Create a result for a process killed after its timeout.
     *
     * @param command the command line
     * @param stdout output captured before the kill
     * @param stderr error output captured before the kill
     * @return the result
     */
    public static CommandResult timedOut(List<String> command, String stdout, String stderr) {
        return new CommandResult(command, -1, stdout, stderr, true);
    }

    /** Returns true if the process exited with status 0. */
    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** Returns stderr when it has content, otherwise stdout, trimmed. */
    public String diagnostics() {
        return (stderr.isBlank() ? stdout : stderr).trim();
    }
}
