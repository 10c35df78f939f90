package containermigrator.testing;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import containermigrator.io.Json;
import containermigrator.process.CommandResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static containermigrator.testing.ScriptedCommandRunner.ok;
import static containermigrator.testing.ScriptedCommandRunner.startsWith;

/**
 * Scripts the source host: the container runtime and the checkpoint tool.
 *
 * <p>A dump writes a page image and a dump log into its {@code -D} directory,
 * so later packaging sees a realistic checkpoint.
 */
public final class FakeSourceHost {

    private final Container container;
    private volatile String dumpLog = "(00.01) Dumping finished successfully\n";

    public FakeSourceHost(Container container) {
        this.container = container;
    }

    public Container container() {
        return container;
    }

    public FakeSourceHost dumpLog(String text) {
        this.dumpLog = text;
        return this;
    }

    /** Installs the host's rules, tool binary at {@code criuBinary}. */
    public ScriptedCommandRunner install(ScriptedCommandRunner runner, Path criuBinary) {
        String criu = criuBinary.toString();
        return runner
                .on(startsWith("docker", "inspect"), ScriptedCommandRunner.exit(1, "Error: No such object"))
                .on(startsWith("docker", "inspect", container.id), (cmd, ctx) ->
                        CommandResult.exited(cmd, 0, container.inspectJson(), ""))
                .on(startsWith("docker", "inspect", "-f", "{{.State.Pid}}", container.id), ok("4242\n"))
                .on(startsWith("docker", "--version"), ok("Docker version 24.0.7, build afdd53b\n"))
                .on(startsWith("docker", "image", "inspect"), (cmd, ctx) ->
                        CommandResult.exited(cmd, 0, container.architecture != null ? container.architecture + "\n" : "", ""))
                .on(startsWith(criu, "check"), ok("Looks good.\n"))
                .on(startsWith(criu, "dump"), (cmd, ctx) -> {
                    Path dir = Path.of(cmd.get(cmd.indexOf("-D") + 1));
                    Files.createDirectories(dir);
                    Files.write(dir.resolve("pages-1.img"), new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
                    Files.writeString(dir.resolve("core-4242.img"), "core", StandardCharsets.UTF_8);
                    Files.writeString(dir.resolve("dump.log"), dumpLog, StandardCharsets.UTF_8);
                    return CommandResult.exited(cmd, 0, "", "");
                })
                .on(startsWith(criu, "restore"), ok());
    }

    /** Creates an executable stand-in for the checkpoint tool binary. */
    public static Path criuBinary(Path dir) throws IOException {
        Path binary = dir.resolve("criu");
        Files.writeString(binary, "#!/bin/sh\nexit 0\n");
        binary.toFile().setExecutable(true, false);
        return binary;
    }

    /**
     * A container as {@code docker inspect} reports it.
     */
    public static final class Container {
        final String id;
        String status = "running";
        String architecture = "amd64";
        boolean privileged;
        String networkMode = "bridge";
        final List<String> binds = new ArrayList<>();
        final List<String> devices = new ArrayList<>();
        final List<String> capAdd = new ArrayList<>();
        final List<String> exposedPorts = new ArrayList<>();

        public Container(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        public Container status(String status) {
            this.status = status;
            return this;
        }

        public Container architecture(String architecture) {
            this.architecture = architecture;
            return this;
        }

        public Container privileged() {
            this.privileged = true;
            return this;
        }

        public Container networkMode(String mode) {
            this.networkMode = mode;
            return this;
        }

        public Container bind(String bind) {
            binds.add(bind);
            return this;
        }

        public Container device(String device) {
            devices.add(device);
            return this;
        }

        public Container capAdd(String cap) {
            capAdd.add(cap);
            return this;
        }

        public Container exposedPort(String port) {
            exposedPorts.add(port);
            return this;
        }

        public String inspectJson() {
            ArrayNode root = Json.MAPPER.createArrayNode();
            ObjectNode node = root.addObject();
            node.put("Id", id + "0123456789abcdef");
            node.put("Name", "/" + id);

            ObjectNode state = node.putObject("State");
            state.put("Status", status);
            state.put("Running", "running".equals(status));
            state.put("Pid", "running".equals(status) ? 4242 : 0);

            ObjectNode config = node.putObject("Config");
            config.put("Image", "registry.local/" + id + ":latest");
            if (architecture != null) {
                config.put("Architecture", architecture);
            }
            ObjectNode ports = config.putObject("ExposedPorts");
            exposedPorts.forEach(p -> ports.putObject(p));

            ObjectNode host = node.putObject("HostConfig");
            host.put("Privileged", privileged);
            host.put("NetworkMode", networkMode);
            ArrayNode bindArray = host.putArray("Binds");
            binds.forEach(bindArray::add);
            ArrayNode deviceArray = host.putArray("Devices");
            devices.forEach(d -> deviceArray.addObject()
                    .put("PathOnHost", d)
                    .put("PathInContainer", d)
                    .put("CgroupPermissions", "rwm"));
            ArrayNode capArray = host.putArray("CapAdd");
            capAdd.forEach(capArray::add);

            try {
                return Json.MAPPER.writeValueAsString(root);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
