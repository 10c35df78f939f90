package containermigrator.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;
import containermigrator.exceptions.Tool;
import containermigrator.io.Json;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;
import containermigrator.process.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link ContainerRuntime} backed by the {@code docker} CLI.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    static final String UNKNOWN = "unknown";

    private final ToolExecutor executor;
    private final String command;
    private final Duration timeout;

    /**
     * @param executor command execution
     * @param command runtime executable (e.g. {@code docker})
     * @param timeout per-call limit, {@link Duration#ZERO} for none
     */
    public DockerContainerRuntime(ToolExecutor executor, String command, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.command = Objects.requireNonNull(command, "command");
        this.timeout = timeout != null ? timeout : Duration.ZERO;
    }

    @Override
    public ContainerInfo inspect(String containerId, ExecutionContext ctx) throws MigrationException {
        CommandResult result = executor.run(Tool.RUNTIME, List.of(command, "inspect", containerId), ctx, timeout);
        if (!result.succeeded()) {
            if (result.exitCode() == 126 || result.exitCode() == 127) {
                throw new MigrationException(ErrorKind.ENVIRONMENT,
                        "Container runtime unavailable: " + result.diagnostics());
            }
            throw new MigrationException(ErrorKind.VALIDATION, "Container " + containerId + " not found");
        }
        try {
            JsonNode root = Json.MAPPER.readTree(result.stdout());
            JsonNode first = root.isArray() ? root.path(0) : root;
            if (first.isMissingNode() || first.isNull()) {
                throw new MigrationException(ErrorKind.VALIDATION, "Container " + containerId + " not found");
            }
            return ContainerInfo.fromInspect(first);
        } catch (JsonProcessingException e) {
            throw new MigrationException(ErrorKind.INTERNAL,
                    "Unreadable inspect output for " + containerId + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public int pid(String containerId, ExecutionContext ctx) throws MigrationException {
        CommandResult result = executor.runChecked(Tool.RUNTIME, "Failed to get container PID",
                List.of(command, "inspect", "-f", "{{.State.Pid}}", containerId), ctx, timeout);
        String out = result.stdout().trim();
        try {
            int pid = Integer.parseInt(out);
            if (pid <= 0) {
                throw new MigrationException(ErrorKind.VALIDATION,
                        "Container " + containerId + " has no running process");
            }
            return pid;
        } catch (NumberFormatException e) {
            throw new MigrationException(ErrorKind.VALIDATION,
                    "Failed to get container PID: unexpected output '" + out + "'", e);
        }
    }

    @Override
    public String version(ExecutionContext ctx) {
        try {
            CommandResult result = executor.run(Tool.RUNTIME, List.of(command, "--version"), ctx, timeout);
            return result.succeeded() ? result.stdout().trim() : UNKNOWN;
        } catch (MigrationException e) {
            log.debug("Could not determine runtime version: {}", e.getReason());
            return UNKNOWN;
        }
    }

    @Override
    public String imageArchitecture(String image, ExecutionContext ctx) {
        if (image == null || image.isEmpty()) {
            return UNKNOWN;
        }
        try {
            CommandResult result = executor.run(Tool.RUNTIME,
                    List.of(command, "image", "inspect", "-f", "{{.Architecture}}", image), ctx, timeout);
            String arch = result.stdout().trim();
            return result.succeeded() && !arch.isEmpty() ? arch : UNKNOWN;
        } catch (MigrationException e) {
            log.debug("Could not determine architecture of {}: {}", image, e.getReason());
            return UNKNOWN;
        }
    }
}
