package containermigrator.process;

import containermigrator.exceptions.MigrationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Deadline and cancellation scope shared by every external call of one migration.
 *
 * <p>The context remembers the child process currently running on its behalf.
 * {@link #cancel()} marks the context cancelled and kills that process, so a
 * blocked pipeline returns promptly.
 *
 * <p>Thread-safe. The pipeline thread registers processes while another thread
 * may cancel.
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final Duration deadline;
    private final long deadlineNanos;
    private final Object lock = new Object();

    private volatile boolean cancelled;
    private Process live;

    private ExecutionContext(Duration deadline) {
        this.deadline = deadline;
        this.deadlineNanos = deadline != null ? System.nanoTime() + deadline.toNanos() : 0L;
    }

    /** Creates a context with no deadline. */
    public static ExecutionContext unbounded() {
        return new ExecutionContext(null);
    }

    /**
     * Creates a context whose deadline is {@code deadline} from now.
     *
     * @param deadline the overall bound, or null/zero for none
     * @return the context
     */
    public static ExecutionContext withDeadline(Duration deadline) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            return unbounded();
        }
        return new ExecutionContext(deadline);
    }

    /** Returns true if this context has a deadline. */
    public boolean hasDeadline() {
        return deadline != null;
    }

    /** Returns the configured deadline, or null if unbounded. */
    public Duration deadline() {
        return deadline;
    }

    /** Returns the time left before the deadline, or null if unbounded. */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        return Duration.ofNanos(deadlineNanos - System.nanoTime());
    }

    /** Returns true if the deadline has passed. */
    public boolean isExpired() {
        return deadline != null && deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * Fails fast if the deadline has passed.
     *
     * @param operation name used in the exception message
     * @throws MigrationTimeoutException if the deadline has expired
     */
    public void checkDeadline(String operation) {
        if (isExpired()) {
            throw new MigrationTimeoutException(operation, deadline);
        }
    }

    /**
     * Computes the effective timeout of one call.
     *
     * @param operation name used if the deadline has already expired
     * @param perCall the per-call limit, {@link Duration#ZERO} for none
     * @return min(perCall, remaining deadline), or {@link Duration#ZERO} when neither applies
     * @throws MigrationTimeoutException if the deadline has expired
     */
    public Duration timeoutFor(String operation, Duration perCall) {
        checkDeadline(operation);
        Duration remaining = remaining();
        boolean hasPerCall = perCall != null && !perCall.isZero() && !perCall.isNegative();
        if (remaining == null) {
            return hasPerCall ? perCall : Duration.ZERO;
        }
        if (!hasPerCall) {
            return remaining;
        }
        return perCall.compareTo(remaining) <= 0 ? perCall : remaining;
    }

    /** Returns true once {@link #cancel()} has been called. */
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels the context and forcibly terminates the live child process, if any.
     */
    public void cancel() {
        Process toKill;
        synchronized (lock) {
            cancelled = true;
            toKill = live;
        }
        if (toKill != null && toKill.isAlive()) {
            log.info("Terminating live process pid={} on cancellation", toKill.pid());
            toKill.descendants().forEach(ProcessHandle::destroyForcibly);
            toKill.destroyForcibly();
        }
    }

    /**
     * Registers the process now running on behalf of this context.
     * A process started after cancellation is killed immediately.
     */
    public void processStarted(Process process) {
        boolean killNow;
        synchronized (lock) {
            live = process;
            killNow = cancelled;
        }
        if (killNow) {
            process.destroyForcibly();
        }
    }

    /** Clears the registration made by {@link #processStarted(Process)}. */
    public void processFinished(Process process) {
        synchronized (lock) {
            if (live == process) {
                live = null;
            }
        }
    }

    /** Returns true if a child process is currently registered. */
    public boolean hasLiveProcess() {
        synchronized (lock) {
            return live != null;
        }
    }
}
