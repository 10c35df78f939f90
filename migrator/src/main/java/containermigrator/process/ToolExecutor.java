package containermigrator.process;

import containermigrator.exceptions.ErrorClassifier;
import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.MigrationTimeoutException;
import containermigrator.exceptions.Tool;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link Tool} through a {@link CommandRunner} and turns its failures
 * into classified {@link MigrationException}s.
 *
 * <p>A start failure is {@link ErrorKind#ENVIRONMENT}. A per-call timeout or a
 * deadline expiry takes the tool's default kind. Non-zero exits are classified
 * by {@link ErrorClassifier} only in {@link #runChecked}.
 */
public final class ToolExecutor {

    private final CommandRunner runner;

    public ToolExecutor(CommandRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /** Returns the underlying runner. */
    public CommandRunner runner() {
        return runner;
    }

    /**
     * Runs the command and returns its result whatever the exit status.
     *
     * @throws MigrationException if the tool could not be started or timed out
     */
    public CommandResult run(Tool tool, List<String> command, ExecutionContext ctx, Duration timeout)
            throws MigrationException {
        CommandResult result;
        try {
            result = runner.run(command, ctx, timeout);
        } catch (IOException e) {
            throw new MigrationException(ErrorKind.ENVIRONMENT,
                    "Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (MigrationTimeoutException e) {
            throw new MigrationException(ErrorClassifier.classifyTimeout(tool), e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new MigrationException(ErrorClassifier.classifyTimeout(tool),
                    String.format("Operation '%s' timed out after %d ms",
                            command.get(0), timeout != null ? timeout.toMillis() : 0L));
        }
        return result;
    }

    /**
     * Runs the command and requires exit status 0.
     *
     * @param what short description used as the message prefix (e.g. "Checkpoint dump failed")
     * @throws MigrationException classified by tool and exit code on any failure
     */
    public CommandResult runChecked(Tool tool, String what, List<String> command, ExecutionContext ctx,
                                    Duration timeout) throws MigrationException {
        CommandResult result = run(tool, command, ctx, timeout);
        if (!result.succeeded()) {
            String detail = result.diagnostics();
            throw new MigrationException(ErrorClassifier.classify(tool, result.exitCode()),
                    detail.isEmpty() ? what + " (exit " + result.exitCode() + ")" : what + ": " + detail);
        }
        return result;
    }
}
