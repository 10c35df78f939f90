package containermigrator.transport;

import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.Tool;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;

import java.nio.file.Path;

/**
 * Moves files to, and runs commands on, a migration target.
 *
 * <p>There are exactly two implementations: {@link AdbTransport} for
 * {@code adb:<device>} targets and {@link SshTransport} for remote-shell hosts.
 * {@link RemoteTransports#forTarget(String)} picks one from the target string.
 */
public interface RemoteTransport {

    /** Returns the target string this transport was created for. */
    String target();

    /** Returns the tool whose failures this transport reports. */
    Tool tool();

    /**
     * Copies a local file to the target.
     *
     * @param local the file to send
     * @param remotePath destination path on the target
     * @param compress request transport-level compression where supported
     * @param ctx execution scope
     * @throws MigrationException {@code TRANSFER} (or {@code ENVIRONMENT}) on failure
     */
    void push(Path local, String remotePath, boolean compress, ExecutionContext ctx) throws MigrationException;

    /**
     * Runs a shell command on the target.
     *
     * @param shellCommand the command line, interpreted by the target's shell
     * @param ctx execution scope
     * @return the result; a non-zero exit is not an exception
     * @throws MigrationException if the command could not be started or timed out
     */
    CommandResult exec(String shellCommand, ExecutionContext ctx) throws MigrationException;

    /**
     * Checks the target is reachable by running {@code echo test} on it.
     *
     * @return true if the target answered
     */
    boolean probe(ExecutionContext ctx);

    /** Returns the checkpoint tool invocation to use on this target. */
    String criuCommand();

    /**
     * Quotes a value for safe use as one word of a POSIX shell command.
     */
    static String quote(String value) {
        if (!value.isEmpty() && value.chars().allMatch(c ->
                Character.isLetterOrDigit(c) || "/._-+=:,@%".indexOf(c) >= 0)) {
            return value;
        }
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
