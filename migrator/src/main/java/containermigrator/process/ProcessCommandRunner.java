package containermigrator.process;

import containermigrator.exceptions.MigrationCancelledException;
import containermigrator.exceptions.MigrationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Standard output and error are drained on background threads so a chatty
 * process cannot block on a full pipe. When the effective timeout elapses the
 * process tree is killed; if the migration deadline was the binding limit a
 * {@link MigrationTimeoutException} is thrown, otherwise a timed-out
 * {@link CommandResult} is returned.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    // Daemon threads so stream readers never keep the JVM alive
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "migrator-process-reader");
        t.setDaemon(true);
        return t;
    });

    @Override
    public CommandResult run(List<String> command, ExecutionContext ctx, Duration timeout) throws IOException {
        String operation = operationName(command);
        if (ctx.isCancelled()) {
            throw new MigrationCancelledException(operation);
        }
        Duration effective = ctx.timeoutFor(operation, timeout);

        log.debug("Running {} (timeout={} ms)", command, effective.toMillis());
        Process process = new ProcessBuilder(command).start();
        ctx.processStarted(process);
        try {
            process.getOutputStream().close();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            boolean finished;
            if (effective.isZero()) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(effective.toMillis(), TimeUnit.MILLISECONDS);
            }

            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly().waitFor();
                if (ctx.isCancelled()) {
                    throw new MigrationCancelledException(operation);
                }
                if (ctx.isExpired()) {
                    log.warn("Operation '{}' exceeded the migration deadline", operation);
                    throw new MigrationTimeoutException(operation, ctx.deadline());
                }
                log.warn("Operation '{}' timed out after {} ms", operation, effective.toMillis());
                return CommandResult.timedOut(command, await(stdout), await(stderr));
            }

            if (ctx.isCancelled()) {
                throw new MigrationCancelledException(operation);
            }
            CommandResult result = CommandResult.exited(command, process.exitValue(), await(stdout), await(stderr));
            log.debug("{} exited with {}", operation, result.exitCode());
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + operation);
        } finally {
            ctx.processFinished(process);
        }
    }

    private static String operationName(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        String exe = command.get(0);
        int slash = exe.lastIndexOf('/');
        return slash >= 0 ? exe.substring(slash + 1) : exe;
    }

    private static CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, READERS);
    }

    private static String await(CompletableFuture<String> output) throws InterruptedException, IOException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException) {
                throw ((UncheckedIOException) e.getCause()).getCause();
            }
            throw new IOException("Failed to read process output", e.getCause());
        } catch (TimeoutException e) {
            // A grandchild still holds the pipe open; report what we have rather than hang.
            output.cancel(true);
            return "";
        }
    }
}
