package containermigrator.testing;

import containermigrator.io.Checksums;
import containermigrator.process.CommandResult;
import containermigrator.process.ExecutionContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static containermigrator.testing.ScriptedCommandRunner.startsWith;

/**
 * Scripts an {@code ssh}/{@code scp} target whose filesystem lives under a
 * local directory. Copies really land there, so the remote checksum is real.
 */
public final class FakeRemoteHost {

    private static final Pattern NAME_FILTER = Pattern.compile("--filter '?name=([^' ]+)'?");
    private static final Pattern RESTORED_DIR = Pattern.compile("/([^/' ]+)_restored");

    private final String host;
    private final Path root;
    private final List<String> shellCommands = new CopyOnWriteArrayList<>();
    private final Set<String> running = new CopyOnWriteArraySet<>();

    private volatile boolean reachable = true;
    private volatile boolean corruptUploads;
    private volatile boolean containerLive = true;
    private volatile int restoreExit;
    private volatile String restoreError = "";
    private volatile int unpackExit;

    public FakeRemoteHost(String host, Path root) {
        this.host = host;
        this.root = root;
    }

    public FakeRemoteHost unreachable() {
        this.reachable = false;
        return this;
    }

    /** Flips a byte of every archive copied to the host. */
    public FakeRemoteHost corruptUploads() {
        this.corruptUploads = true;
        return this;
    }

    public FakeRemoteHost containerNeverLive() {
        this.containerLive = false;
        return this;
    }

    /** Adds a container that is already running on the host. */
    public FakeRemoteHost running(String name) {
        running.add(name);
        return this;
    }

    public FakeRemoteHost failRestore(int exitCode, String stderr) {
        this.restoreExit = exitCode;
        this.restoreError = stderr;
        return this;
    }

    public FakeRemoteHost failUnpack(int exitCode) {
        this.unpackExit = exitCode;
        return this;
    }

    public ScriptedCommandRunner install(ScriptedCommandRunner runner) {
        return runner
                .on(startsWith("ssh"), this::ssh)
                .on(startsWith("scp"), this::scp);
    }

    /** Shell commands the host received over ssh, in order. */
    public List<String> shellCommands() {
        return List.copyOf(shellCommands);
    }

    public boolean received(String fragment) {
        return shellCommands.stream().anyMatch(c -> c.contains(fragment));
    }

    /** Maps a remote absolute path into the local root. */
    public Path local(String remotePath) {
        return root.resolve(remotePath.startsWith("/") ? remotePath.substring(1) : remotePath);
    }

    private CommandResult ssh(List<String> cmd, ExecutionContext ctx) throws IOException {
        int i = 1;
        while (i < cmd.size() && cmd.get(i).equals("-o")) {
            i += 2;
        }
        if (!reachable || i >= cmd.size() || !cmd.get(i).equals(host)) {
            return CommandResult.exited(cmd, 255, "", "ssh: connect to host " + cmd.get(Math.min(i, cmd.size() - 1))
                    + " port 22: Connection refused");
        }
        List<String> rest = cmd.subList(i + 1, cmd.size());
        if (rest.equals(List.of("echo", "test"))) {
            return CommandResult.exited(cmd, 0, "test\n", "");
        }
        String shell = String.join(" ", rest);
        shellCommands.add(shell);

        if (shell.contains("tar -xzf")) {
            return unpackExit == 0
                    ? CommandResult.exited(cmd, 0, "", "")
                    : CommandResult.exited(cmd, unpackExit, "", "tar: Error is not recoverable: exiting now");
        }
        if (shell.startsWith("mkdir -p ")) {
            Files.createDirectories(local(unquote(shell.substring("mkdir -p ".length()))));
            return CommandResult.exited(cmd, 0, "", "");
        }
        if (shell.startsWith("sha256sum ")) {
            String path = unquote(shell.substring("sha256sum ".length()));
            Path file = local(path);
            if (!Files.exists(file)) {
                return CommandResult.exited(cmd, 1, "", "sha256sum: " + path + ": No such file or directory");
            }
            return CommandResult.exited(cmd, 0, Checksums.sha256(file) + "  " + path + "\n", "");
        }
        if (shell.contains(" restore ")) {
            Matcher restored = RESTORED_DIR.matcher(shell);
            if (restoreExit == 0 && containerLive && restored.find()) {
                running.add(restored.group(1));
            }
            return CommandResult.exited(cmd, restoreExit, "", restoreError);
        }
        if (shell.contains(" ps ")) {
            Matcher filter = NAME_FILTER.matcher(shell);
            Pattern names = filter.find() ? Pattern.compile(filter.group(1)) : null;
            String listing = running.stream()
                    .filter(name -> names == null || names.matcher("/" + name).find())
                    .map(name -> name + "\n")
                    .collect(Collectors.joining());
            return CommandResult.exited(cmd, 0, listing, "");
        }
        return CommandResult.exited(cmd, 0, "", "");
    }

    private CommandResult scp(List<String> cmd, ExecutionContext ctx) throws IOException {
        String destination = cmd.get(cmd.size() - 1);
        Path source = Path.of(cmd.get(cmd.size() - 2));
        if (!reachable || !destination.startsWith(host + ":")) {
            return CommandResult.exited(cmd, 1, "", "ssh: connect to host port 22: Connection refused\nlost connection");
        }
        Path target = local(destination.substring(host.length() + 1));
        Files.createDirectories(target.getParent());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        if (corruptUploads && target.getFileName().toString().endsWith(".tar.gz")) {
            byte[] bytes = Files.readAllBytes(target);
            bytes[bytes.length / 2] ^= 0x5A;
            Files.write(target, bytes);
        }
        return CommandResult.exited(cmd, 0, "", "");
    }

    static String unquote(String word) {
        String w = word.trim();
        if (w.length() >= 2 && w.startsWith("'") && w.endsWith("'")) {
            return w.substring(1, w.length() - 1).replace("'\\''", "'");
        }
        return w;
    }
}
