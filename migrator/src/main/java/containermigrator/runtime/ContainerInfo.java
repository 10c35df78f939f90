package containermigrator.runtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The parts of a runtime {@code inspect} document the migrator acts on.
 *
 * @param id full container id
 * @param name container name without the leading slash
 * @param status runtime state (e.g. {@code running}, {@code exited})
 * @param pid init process id, 0 when not running
 * @param image image reference from the container config
 * @param architecture architecture recorded in the container config, or null
 * @param privileged whether the container runs privileged
 * @param networkMode network mode (e.g. {@code bridge}, {@code host})
 * @param binds host bind mounts
 * @param devices device mappings
 * @param capAdd added capabilities
 * @param exposedPorts exposed port specs (e.g. {@code 80/tcp})
 */
public record ContainerInfo(
        String id,
        String name,
        String status,
        int pid,
        String image,
        String architecture,
        boolean privileged,
        String networkMode,
        List<String> binds,
        List<String> devices,
        List<String> capAdd,
        List<String> exposedPorts
) {

    public ContainerInfo {
        binds = List.copyOf(binds);
        devices = List.copyOf(devices);
        capAdd = List.copyOf(capAdd);
        exposedPorts = List.copyOf(exposedPorts);
    }

    /** Returns true if the runtime reports the container as running. */
    public boolean isRunning() {
        return "running".equals(status);
    }

    /** Returns true if the container shares the host network namespace. */
    public boolean usesHostNetwork() {
        return "host".equals(networkMode);
    }

    /**
     * Builds an instance from one element of {@code docker inspect} output.
     *
     * @param node the container object
     * @return the parsed info
     */
    public static ContainerInfo fromInspect(JsonNode node) {
        JsonNode state = node.path("State");
        JsonNode config = node.path("Config");
        JsonNode host = node.path("HostConfig");

        String name = node.path("Name").asText("");
        if (name.startsWith("/")) {
            name = name.substring(1);
        }

        List<String> devices = new ArrayList<>();
        for (JsonNode device : host.path("Devices")) {
            devices.add(device.isTextual() ? device.asText() : device.path("PathOnHost").asText(device.toString()));
        }

        List<String> ports = new ArrayList<>();
        config.path("ExposedPorts").fieldNames().forEachRemaining(ports::add);

        String arch = config.path("Architecture").asText(null);

        return new ContainerInfo(
                node.path("Id").asText(""),
                name,
                state.path("Status").asText("unknown"),
                state.path("Pid").asInt(0),
                config.path("Image").asText(""),
                arch == null || arch.isEmpty() ? null : arch,
                host.path("Privileged").asBoolean(false),
                host.path("NetworkMode").asText(""),
                texts(host.path("Binds")),
                devices,
                texts(host.path("CapAdd")),
                ports);
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : array) {
            out.add(item.asText());
        }
        return out;
    }
}
