package containermigrator.criu;

import java.util.Locale;

/**
 * Facts about the local host recorded in checkpoint metadata.
 */
final class HostInfo {

    private HostInfo() {}

    /** Returns the host architecture in container-image naming ({@code amd64}, {@code arm64}, ...). */
    static String architecture() {
        String arch = System.getProperty("os.arch", "unknown").toLowerCase(Locale.ROOT);
        switch (arch) {
            case "x86_64":
            case "amd64":
                return "amd64";
            case "aarch64":
            case "arm64":
                return "arm64";
            default:
                return arch;
        }
    }

    /** Returns the running kernel release. */
    static String kernelVersion() {
        return System.getProperty("os.version", "unknown");
    }
}
