package containermigrator.packaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Contents of {@code <package>.metadata.json}, written next to every package.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageSidecar(
        @JsonProperty("package_path") String packagePath,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("container_id") String containerId,
        @JsonProperty("original_metadata") Map<String, Object> originalMetadata,
        @JsonProperty("package_time") String packageTime
) {

    public static final String SUFFIX = ".metadata.json";

    /** Returns the sidecar path of a package path. */
    public static String pathFor(String packagePath) {
        return packagePath + SUFFIX;
    }
}
