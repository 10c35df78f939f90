package containermigrator.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs external processes.
 *
 * <p>Every process the migrator starts goes through this interface, so tests
 * replace it with a scripted fake and no real {@code criu}, {@code docker},
 * {@code ssh} or {@code adb} is ever needed.
 *
 * @see ProcessCommandRunner
 */
public interface CommandRunner {

    /**
     * Runs {@code command} to completion.
     *
     * <p>Implementations must register the live process with {@code ctx} so
     * that {@link ExecutionContext#cancel()} can terminate it.
     *
     * @param command the executable and its arguments
     * @param ctx deadline and cancellation scope of the calling migration
     * @param timeout per-call limit, {@link Duration#ZERO} for none; the
     *                effective limit is additionally bounded by the deadline
     * @return the structured outcome; a non-zero exit is not an exception
     * @throws IOException if the process cannot be started
     * @throws containermigrator.exceptions.MigrationTimeoutException if the deadline expires
     * @throws containermigrator.exceptions.MigrationCancelledException if {@code ctx} is cancelled
     */
    CommandResult run(List<String> command, ExecutionContext ctx, Duration timeout) throws IOException;
}
