package containermigrator.runtime;

import containermigrator.exceptions.MigrationException;
import containermigrator.process.ExecutionContext;

/**
 * Typed access to the local container runtime.
 *
 * @see DockerContainerRuntime
 */
public interface ContainerRuntime {

    /**
     * Inspects a container.
     *
     * @param containerId id or name
     * @param ctx execution scope
     * @return the container's configuration and state
     * @throws MigrationException {@code VALIDATION} if the container does not exist,
     *         {@code ENVIRONMENT} if the runtime cannot be run
     */
    ContainerInfo inspect(String containerId, ExecutionContext ctx) throws MigrationException;

    /**
     * Returns the init process id of a running container.
     *
     * @throws MigrationException {@code VALIDATION} if no pid is available
     */
    int pid(String containerId, ExecutionContext ctx) throws MigrationException;

    /** Returns the runtime's version string, or {@code "unknown"} if it cannot be determined. */
    String version(ExecutionContext ctx);

    /** Returns an image's architecture, or {@code "unknown"} if it cannot be determined. */
    String imageArchitecture(String image, ExecutionContext ctx);
}
