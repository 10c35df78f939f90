package containermigrator.exceptions;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps a failed external command to an {@link ErrorKind}.
 *
 * <p>Rules are looked up in this order:
 * <ol>
 *   <li>tool-specific exit code (e.g. {@code ssh} exits with 255 on connection failure)</li>
 *   <li>exit codes shared by every tool: 126 (not executable) and 127 (not found)</li>
 *   <li>the tool's {@link Tool#defaultKind() default kind}</li>
 * </ol>
 *
 * <p>A timed-out command always maps to the tool's default kind.
 */
public final class ErrorClassifier {

    static final int EXIT_NOT_EXECUTABLE = 126;
    static final int EXIT_NOT_FOUND = 127;
    static final int EXIT_SSH_CONNECTION = 255;

    private static final Map<Integer, ErrorKind> COMMON = Map.of(
            EXIT_NOT_EXECUTABLE, ErrorKind.ENVIRONMENT,
            EXIT_NOT_FOUND, ErrorKind.ENVIRONMENT);

    private static final Map<Tool, Map<Integer, ErrorKind>> BY_TOOL = new EnumMap<>(Tool.class);

    static {
        Map<Integer, ErrorKind> ssh = new HashMap<>();
        ssh.put(EXIT_SSH_CONNECTION, ErrorKind.TRANSFER);
        BY_TOOL.put(Tool.SSH, ssh);
        BY_TOOL.put(Tool.SCP, ssh);
    }

    private ErrorClassifier() {}

    /**
     * Classifies a non-zero exit of {@code tool}.
     *
     * @param tool the executable that failed
     * @param exitCode its exit status
     * @return the error kind
     */
    public static ErrorKind classify(Tool tool, int exitCode) {
        ErrorKind specific = BY_TOOL.getOrDefault(tool, Map.of()).get(exitCode);
        if (specific != null) {
            return specific;
        }
        ErrorKind common = COMMON.get(exitCode);
        if (common != null) {
            return common;
        }
        return tool.defaultKind();
    }

    /**
     * Classifies a non-zero exit of a command run on the target through a transport.
     *
     * <p>Transport-level exit codes (e.g. {@code ssh} 255) win; any other code is
     * attributed to {@code remoteTool}.
     *
     * @param transport the transport tool ({@link Tool#SSH} or {@link Tool#ADB})
     * @param remoteTool the tool the remote command ran
     * @param exitCode the exit status reported by the transport
     * @return the error kind
     */
    public static ErrorKind classifyRemote(Tool transport, Tool remoteTool, int exitCode) {
        ErrorKind specific = BY_TOOL.getOrDefault(transport, Map.of()).get(exitCode);
        if (specific != null) {
            return specific;
        }
        return classify(remoteTool, exitCode);
    }

    /** Classifies a command of {@code tool} that ran past its timeout. */
    public static ErrorKind classifyTimeout(Tool tool) {
        return tool.defaultKind();
    }
}
