package containermigrator.validation;

import containermigrator.exceptions.MigrationCancelledException;
import containermigrator.exceptions.MigrationException;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;
import containermigrator.transport.RemoteTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Waits for a restored container to appear on the target.
 *
 * <p>Queries {@code <runtime> ps --filter name=^/?<id>$ --format {{.Names}}}
 * through the target's transport every poll interval until the container's
 * exact name is listed or the validation timeout elapses. A query that fails
 * to run counts as "not yet".
 */
public class RestoreValidator {

    private static final Logger log = LoggerFactory.getLogger(RestoreValidator.class);

    private static final String REGEX_META = "\\.+*?()|[]{}^$";

    private final String runtimeCommand;
    private final Duration pollInterval;

    public RestoreValidator(String runtimeCommand, Duration pollInterval) {
        this.runtimeCommand = Objects.requireNonNull(runtimeCommand, "runtimeCommand");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /**
     * Polls until the container is live or {@code timeout} elapses.
     *
     * @param transport the target
     * @param containerId the restored container's name
     * @param timeout how long to wait
     * @param ctx execution scope; its deadline also bounds the wait
     * @return whether the container was seen running
     * @throws MigrationCancelledException if {@code ctx} is cancelled while waiting
     */
    public ValidationResult validate(RemoteTransport transport,
                                     String containerId,
                                     Duration timeout,
                                     ExecutionContext ctx) {
        String query = query(containerId);
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        String lastError = null;

        while (true) {
            if (ctx.isCancelled()) {
                throw new MigrationCancelledException("validation");
            }
            ctx.checkDeadline("validation");
            attempts++;
            try {
                CommandResult result = transport.exec(query, ctx);
                if (result.succeeded() && listsName(result.stdout(), containerId)) {
                    log.info("Container {} is running on {} after {} check(s)", containerId, transport.target(), attempts);
                    return ValidationResult.live(attempts);
                }
                lastError = result.succeeded() ? null : result.diagnostics();
            } catch (MigrationException e) {
                lastError = e.getReason();
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(pollInterval.toMillis(), Duration.ofNanos(remaining).toMillis() + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MigrationCancelledException("validation");
            }
        }

        String message = "Container " + containerId + " is not running on target after "
                + timeout.toSeconds() + "s";
        if (lastError != null && !lastError.isEmpty()) {
            message += ": " + lastError;
        }
        log.warn(message);
        return ValidationResult.notLive(attempts, message);
    }

    /** Builds the listing query. The runtime's name filter is a regex search, so it is anchored. */
    String query(String containerId) {
        return runtimeCommand + " ps --filter " + RemoteTransport.quote("name=^/?" + escapeRegex(containerId) + "$")
                + " --format " + RemoteTransport.quote("{{.Names}}");
    }

    /** Returns true if {@code listing} has {@code name} as one of its names. */
    static boolean listsName(String listing, String name) {
        return listing.lines()
                .flatMap(line -> Arrays.stream(line.split(",")))
                .map(String::trim)
                .map(n -> n.startsWith("/") ? n.substring(1) : n)
                .anyMatch(name::equals);
    }

    static String escapeRegex(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (REGEX_META.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
