package containermigrator.transport;

/**
 * Creates the {@link RemoteTransport} for a target string.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * @param targetHost {@code adb:<device>} or a remote-shell host
     * @return the matching transport
     * @throws IllegalArgumentException if the target string is blank
     */
    RemoteTransport forTarget(String targetHost);
}
