package containermigrator.criu;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contents of a checkpoint's {@code metadata.json}.
 *
 * <p>{@code dumpFlags} is null for checkpoints written before the flags were
 * persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointMetadata(
        @JsonProperty("container_id") String containerId,
        @JsonProperty("checkpoint_time") String checkpointTime,
        @JsonProperty("architecture") String architecture,
        @JsonProperty("kernel_version") String kernelVersion,
        @JsonProperty("runtime_version") @JsonAlias("docker_version") String runtimeVersion,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("dump_flags") DumpFlags dumpFlags
) {

    /** File name inside a checkpoint directory. */
    public static final String FILE_NAME = "metadata.json";

    /** Keys every readable metadata document must contain. */
    public static final List<String> REQUIRED_KEYS = List.of("container_id", "checkpoint_time", "architecture");

    public CheckpointMetadata {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
