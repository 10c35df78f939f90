package containermigrator.runtime;

import containermigrator.exceptions.ErrorKind;
import containermigrator.exceptions.MigrationException;
import containermigrator.process.ExecutionContext;
import containermigrator.process.ToolExecutor;
import containermigrator.testing.FakeSourceHost;
import containermigrator.testing.FakeSourceHost.Container;
import containermigrator.testing.ScriptedCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static containermigrator.testing.ScriptedCommandRunner.exit;
import static containermigrator.testing.ScriptedCommandRunner.ok;
import static containermigrator.testing.ScriptedCommandRunner.startsWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DockerContainerRuntime")
class DockerContainerRuntimeTest {

    private final ExecutionContext ctx = ExecutionContext.unbounded();
    private ScriptedCommandRunner runner;
    private Container container;
    private DockerContainerRuntime runtime;

    @BeforeEach
    void setUp() {
        runner = new ScriptedCommandRunner();
        container = new Container("web");
        new FakeSourceHost(container).install(runner, Path.of("/usr/sbin/criu"));
        runtime = new DockerContainerRuntime(new ToolExecutor(runner), "docker", Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("inspect")
    class Inspect {

        @Test
        @DisplayName("should read the fields the migrator acts on")
        void shouldReadTheFieldsTheMigratorActsOn() throws MigrationException {
            container.privileged()
                    .networkMode("host")
                    .bind("/srv/data:/data")
                    .device("/dev/fuse")
                    .capAdd("NET_ADMIN")
                    .exposedPort("80/tcp");

            ContainerInfo info = runtime.inspect("web", ctx);

            assertThat(info.name()).isEqualTo("web");
            assertThat(info.isRunning()).isTrue();
            assertThat(info.pid()).isEqualTo(4242);
            assertThat(info.image()).isEqualTo("registry.local/web:latest");
            assertThat(info.architecture()).isEqualTo("amd64");
            assertThat(info.privileged()).isTrue();
            assertThat(info.usesHostNetwork()).isTrue();
            assertThat(info.binds()).containsExactly("/srv/data:/data");
            assertThat(info.devices()).containsExactly("/dev/fuse");
            assertThat(info.capAdd()).containsExactly("NET_ADMIN");
            assertThat(info.exposedPorts()).containsExactly("80/tcp");
        }

        @Test
        @DisplayName("should leave a missing architecture null")
        void shouldLeaveAMissingArchitectureNull() throws MigrationException {
            container.architecture(null).status("exited");

            ContainerInfo info = runtime.inspect("web", ctx);

            assertThat(info.architecture()).isNull();
            assertThat(info.isRunning()).isFalse();
            assertThat(info.pid()).isZero();
        }

        @Test
        @DisplayName("should report an unknown container as a validation error")
        void shouldReportAnUnknownContainerAsAValidationError() {
            assertThatThrownBy(() -> runtime.inspect("ghost", ctx))
                    .isInstanceOf(MigrationException.class)
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.VALIDATION)
                    .hasFieldOrPropertyWithValue("reason", "Container ghost not found");
        }

        @Test
        @DisplayName("should report an empty inspect document as not found")
        void shouldReportAnEmptyInspectDocumentAsNotFound() {
            runner.on(startsWith("docker", "inspect", "web"), ok("[]"));

            assertThatThrownBy(() -> runtime.inspect("web", ctx))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.VALIDATION);
        }

        @Test
        @DisplayName("should report a missing runtime as an environment error")
        void shouldReportAMissingRuntimeAsAnEnvironmentError() {
            runner.on(startsWith("docker"), exit(127, "docker: command not found"));

            assertThatThrownBy(() -> runtime.inspect("web", ctx))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.ENVIRONMENT);
        }

        @Test
        @DisplayName("should report garbage output as an internal error")
        void shouldReportGarbageOutputAsAnInternalError() {
            runner.on(startsWith("docker", "inspect", "web"), ok("not json {"));

            assertThatThrownBy(() -> runtime.inspect("web", ctx))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.INTERNAL);
        }
    }

    @Nested
    @DisplayName("pid")
    class Pid {

        @Test
        @DisplayName("should parse the init pid")
        void shouldParseTheInitPid() throws MigrationException {
            assertThat(runtime.pid("web", ctx)).isEqualTo(4242);
        }

        @Test
        @DisplayName("should reject a stopped container's zero pid")
        void shouldRejectAStoppedContainersZeroPid() {
            runner.on(startsWith("docker", "inspect", "-f"), ok("0\n"));

            assertThatThrownBy(() -> runtime.pid("web", ctx))
                    .hasFieldOrPropertyWithValue("kind", ErrorKind.VALIDATION)
                    .hasFieldOrPropertyWithValue("reason", "Container web has no running process");
        }

        @Test
        @DisplayName("should reject output that is not a number")
        void shouldRejectOutputThatIsNotANumber() {
            runner.on(startsWith("docker", "inspect", "-f"), ok("<no value>\n"));

            assertThatThrownBy(() -> runtime.pid("web", ctx))
                    .hasFieldOrPropertyWithValue("reason", "Failed to get container PID: unexpected output '<no value>'");
        }
    }

    @Nested
    @DisplayName("version and imageArchitecture")
    class Descriptive {

        @Test
        @DisplayName("should return the version line")
        void shouldReturnTheVersionLine() {
            assertThat(runtime.version(ctx)).isEqualTo("Docker version 24.0.7, build afdd53b");
        }

        @Test
        @DisplayName("should fall back to unknown")
        void shouldFallBackToUnknown() {
            runner.on(startsWith("docker"), exit(1, "Cannot connect to the Docker daemon"));

            assertThat(runtime.version(ctx)).isEqualTo("unknown");
            assertThat(runtime.imageArchitecture("registry.local/web:latest", ctx)).isEqualTo("unknown");
            assertThat(runtime.imageArchitecture("", ctx)).isEqualTo("unknown");
        }

        @Test
        @DisplayName("should read the image architecture")
        void shouldReadTheImageArchitecture() {
            container.architecture("arm64");

            assertThat(runtime.imageArchitecture("registry.local/web:latest", ctx)).isEqualTo("arm64");
            assertThat(runner.invocations(startsWith("docker", "image", "inspect")).get(0))
                    .containsExactly("docker", "image", "inspect", "-f", "{{.Architecture}}", "registry.local/web:latest");
        }
    }
}
