package containermigrator.criu;

import com.fasterxml.jackson.databind.JsonNode;
import containermigrator.config.MigratorConfig;
import containermigrator.exceptions.ErrorKind;
import containermigrator.io.Json;
import containermigrator.process.CommandResult;
import containermigrator.process.ToolExecutor;
import containermigrator.runtime.DockerContainerRuntime;
import containermigrator.testing.FakeSourceHost;
import containermigrator.testing.FakeSourceHost.Container;
import containermigrator.testing.ScriptedCommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static containermigrator.testing.ScriptedCommandRunner.exit;
import static containermigrator.testing.ScriptedCommandRunner.startsWith;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CheckpointToolManager")
class CheckpointToolManagerTest {

    @TempDir
    Path tempDir;

    private Path criu;
    private Path checkpoints;
    private ScriptedCommandRunner runner;
    private Container container;
    private CheckpointToolManager tools;

    @BeforeEach
    void setUp() throws IOException {
        criu = FakeSourceHost.criuBinary(tempDir);
        checkpoints = tempDir.resolve("checkpoints");
        runner = new ScriptedCommandRunner();
        container = new Container("web");
        new FakeSourceHost(container).install(runner, criu);
        tools = manager(MigratorConfig.builder().criuBinary(criu).checkpointDir(checkpoints).build());
    }

    private CheckpointToolManager manager(MigratorConfig config) {
        ToolExecutor executor = new ToolExecutor(runner);
        return new CheckpointToolManager(config, executor,
                new DockerContainerRuntime(executor, config.runtimeCommand(), Duration.ofSeconds(10)));
    }

    private List<String> lastCommand(String subcommand) {
        List<List<String>> calls = runner.invocations(startsWith(criu.toString(), subcommand));
        assertThat(calls).isNotEmpty();
        return calls.get(calls.size() - 1);
    }

    /** Writes a checkpoint directory the way an older release did: no dump flags. */
    private Path legacyCheckpoint(String id) throws IOException {
        Path dir = checkpoints.resolve(id);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(CheckpointMetadata.FILE_NAME),
                "{\"container_id\":\"" + id + "\",\"checkpoint_time\":\"2024-01-01T00:00:00Z\","
                        + "\"architecture\":\"amd64\",\"docker_version\":\"Docker version 20.10\"}",
                StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(CriuCommands.DUMP_LOG), "Dumping finished successfully\n", StandardCharsets.UTF_8);
        return dir;
    }

    @Nested
    @DisplayName("configureEnvironment")
    class ConfigureEnvironment {

        @Test
        @DisplayName("should succeed when the binary passes its self-check")
        void shouldSucceedWhenTheBinaryPassesItsSelfCheck() {
            CheckpointStatus status = tools.configureEnvironment();

            assertThat(status.success()).isTrue();
            assertThat(runner.invoked(startsWith(criu.toString(), "check"))).isTrue();
        }

        @Test
        @DisplayName("should report a missing binary as an environment error")
        void shouldReportAMissingBinaryAsAnEnvironmentError() {
            CheckpointToolManager missing = manager(MigratorConfig.builder()
                    .criuBinary(tempDir.resolve("nowhere/criu"))
                    .checkpointDir(checkpoints)
                    .build());

            CheckpointStatus status = missing.configureEnvironment();

            assertThat(status.success()).isFalse();
            assertThat(status.errorKind()).isEqualTo(ErrorKind.ENVIRONMENT);
            assertThat(status.errorMessage()).startsWith("CRIU binary not found at");
            assertThat(runner.invocations()).isEmpty();
        }

        @Test
        @DisplayName("should report a failing self-check as an environment error")
        void shouldReportAFailingSelfCheckAsAnEnvironmentError() {
            runner.on(startsWith(criu.toString(), "check"), exit(1, "Error (criu/cr-check.c:1234): Kernel is too old"));

            CheckpointStatus status = tools.configureEnvironment();

            assertThat(status.errorKind()).isEqualTo(ErrorKind.ENVIRONMENT);
            assertThat(status.errorMessage()).isEqualTo("CRIU check failed: Error (criu/cr-check.c:1234): Kernel is too old");
        }
    }

    @Nested
    @DisplayName("validateForCheckpoint")
    class ValidateForCheckpoint {

        @Test
        @DisplayName("should accept a running container and list risky settings")
        void shouldAcceptARunningContainerAndListRiskySettings() {
            container.privileged().bind("/srv/data:/data").exposedPort("8080/tcp");

            CheckpointEligibility eligibility = tools.validateForCheckpoint("web");

            assertThat(eligibility.eligible()).isTrue();
            assertThat(eligibility.messages()).containsExactly(
                    "Container is running in privileged mode",
                    "Container has bind mounts",
                    "Container has exposed ports");
        }

        @Test
        @DisplayName("should reject a stopped container")
        void shouldRejectAStoppedContainer() {
            container.status("exited");

            CheckpointEligibility eligibility = tools.validateForCheckpoint("web");

            assertThat(eligibility.eligible()).isFalse();
            assertThat(eligibility.messages()).containsExactly("Container web is not running");
        }

        @Test
        @DisplayName("should reject an unknown container")
        void shouldRejectAnUnknownContainer() {
            CheckpointEligibility eligibility = tools.validateForCheckpoint("ghost");

            assertThat(eligibility.eligible()).isFalse();
            assertThat(eligibility.messages()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("dump")
    class Dump {

        @Test
        @DisplayName("should dump the container's pid into its own directory")
        void shouldDumpTheContainersPidIntoItsOwnDirectory() {
            CheckpointStatus status = tools.dump(CheckpointConfig.defaults("web", checkpoints));

            assertThat(status.success()).isTrue();
            assertThat(status.checkpointPath()).isEqualTo(checkpoints.resolve("web").toString());
            List<String> cmd = lastCommand("dump");
            assertThat(cmd).containsSubsequence("-t", "4242", "-D", checkpoints.resolve("web").toString());
            assertThat(cmd).contains("--tcp-established", "--shell-job", "--ext-unix-sk", "--file-locks");
            assertThat(cmd).doesNotContain("--leave-running");
        }

        @Test
        @DisplayName("should persist the dump flags in the metadata")
        void shouldPersistTheDumpFlagsInTheMetadata() throws Exception {
            CheckpointConfig config = new CheckpointConfig("web", checkpoints, true, false, true, false, true);

            tools.dump(config);

            CheckpointMetadata metadata = tools.readMetadata(checkpoints.resolve("web"));
            assertThat(metadata.containerId()).isEqualTo("web");
            assertThat(metadata.runtimeVersion()).startsWith("Docker version 24.0.7");
            assertThat(metadata.dumpFlags()).isEqualTo(new DumpFlags(false, true, false, true, true));
            assertThat(lastCommand("dump")).contains("--leave-running", "--shell-job", "--file-locks")
                    .doesNotContain("--tcp-established", "--ext-unix-sk");

            JsonNode raw = Json.MAPPER.readTree(checkpoints.resolve("web").resolve(CheckpointMetadata.FILE_NAME).toFile());
            assertThat(raw.path("dump_flags").path("leave_running").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should carry eligibility warnings into the result and metadata")
        void shouldCarryEligibilityWarningsIntoTheResultAndMetadata() throws Exception {
            container.networkMode("host");

            CheckpointStatus status = tools.dump(CheckpointConfig.defaults("web", checkpoints));

            assertThat(status.warnings()).containsExactly("Container uses host networking");
            assertThat(tools.readMetadata(checkpoints.resolve("web")).warnings())
                    .containsExactly("Container uses host networking");
        }

        @Test
        @DisplayName("should refuse a stopped container without running the tool")
        void shouldRefuseAStoppedContainerWithoutRunningTheTool() {
            container.status("exited");

            CheckpointStatus status = tools.dump(CheckpointConfig.defaults("web", checkpoints));

            assertThat(status.errorKind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(status.errorMessage()).isEqualTo("Container validation failed: Container web is not running");
            assertThat(runner.invoked(startsWith(criu.toString(), "dump"))).isFalse();
        }

        @Test
        @DisplayName("should keep a failed dump and quote the end of its log")
        void shouldKeepAFailedDumpAndQuoteTheEndOfItsLog() {
            runner.on(startsWith(criu.toString(), "dump"), (cmd, ctx) -> {
                Path dir = Path.of(cmd.get(cmd.indexOf("-D") + 1));
                Files.writeString(dir.resolve(CriuCommands.DUMP_LOG),
                        "(00.01) Dumping task\n(00.02) Error (criu/sk-inet.c:199): inet: Connected TCP socket\n",
                        StandardCharsets.UTF_8);
                return CommandResult.exited(cmd, 1, "", "Dumping FAILED.");
            });

            CheckpointStatus status = tools.dump(CheckpointConfig.defaults("web", checkpoints));

            assertThat(status.success()).isFalse();
            assertThat(status.errorKind()).isEqualTo(ErrorKind.CHECKPOINT);
            assertThat(status.errorMessage())
                    .startsWith("CRIU dump failed: Dumping FAILED.")
                    .contains("--- dump.log (tail) ---")
                    .contains("Connected TCP socket");
            assertThat(status.checkpointPath()).isEqualTo(checkpoints.resolve("web").toString());
            assertThat(checkpoints.resolve("web")).isDirectory();
            assertThat(checkpoints.resolve("web").resolve(CheckpointMetadata.FILE_NAME)).doesNotExist();
        }
    }

    @Nested
    @DisplayName("validateDump")
    class ValidateDump {

        @Test
        @DisplayName("should turn error and warning lines of the log into warnings")
        void shouldTurnErrorAndWarningLinesOfTheLogIntoWarnings() {
            new FakeSourceHost(container)
                    .dumpLog("Warning: skipping vdso\nError (criu/files.c:10): ignored\nDumping finished successfully\n")
                    .install(runner, criu);
            tools.dump(CheckpointConfig.defaults("web", checkpoints));

            CheckpointStatus status = tools.validateDump(checkpoints.resolve("web"));

            assertThat(status.success()).isTrue();
            assertThat(status.warnings()).containsExactly("Errors found in dump log", "Warnings found in dump log");
        }

        @Test
        @DisplayName("should fail when the dump log is missing")
        void shouldFailWhenTheDumpLogIsMissing() throws IOException {
            Path dir = legacyCheckpoint("web");
            Files.delete(dir.resolve(CriuCommands.DUMP_LOG));

            CheckpointStatus status = tools.validateDump(dir);

            assertThat(status.errorKind()).isEqualTo(ErrorKind.CHECKPOINT);
            assertThat(status.errorMessage()).isEqualTo("Missing checkpoint files: [dump.log]");
        }

        @Test
        @DisplayName("should fail when a required metadata field is missing")
        void shouldFailWhenARequiredMetadataFieldIsMissing() throws IOException {
            Path dir = legacyCheckpoint("web");
            Files.writeString(dir.resolve(CheckpointMetadata.FILE_NAME), "{\"container_id\":\"web\"}", StandardCharsets.UTF_8);

            CheckpointStatus status = tools.validateDump(dir);

            assertThat(status.errorMessage()).isEqualTo("Missing metadata fields: [checkpoint_time, architecture]");
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        @DisplayName("should restore with the flags the dump used")
        void shouldRestoreWithTheFlagsTheDumpUsed() {
            tools.dump(new CheckpointConfig("web", checkpoints, false, false, true, true, false));

            CheckpointStatus status = tools.restore(checkpoints.resolve("web"), null);

            assertThat(status.success()).isTrue();
            assertThat(status.warnings()).isEmpty();
            assertThat(lastCommand("restore"))
                    .contains("--shell-job", "--ext-unix-sk")
                    .doesNotContain("--tcp-established", "--file-locks");
        }

        @Test
        @DisplayName("should fall back to legacy flags and say so")
        void shouldFallBackToLegacyFlagsAndSaySo() throws IOException {
            Path dir = legacyCheckpoint("web");

            CheckpointStatus status = tools.restore(dir, "web-restored");

            assertThat(status.success()).isTrue();
            assertThat(status.warnings()).containsExactly(CheckpointToolManager.LEGACY_FLAGS_WARNING);
            assertThat(lastCommand("restore"))
                    .contains("--shell-job", "--ext-unix-sk", "--file-locks")
                    .doesNotContain("--tcp-established");
        }

        @Test
        @DisplayName("should report a failing restore with the checkpoint path")
        void shouldReportAFailingRestoreWithTheCheckpointPath() throws IOException {
            Path dir = legacyCheckpoint("web");
            runner.on(startsWith(criu.toString(), "restore"), exit(1, "Error (criu/cr-restore.c:1): pid 4242 busy"));

            CheckpointStatus status = tools.restore(dir, null);

            assertThat(status.errorKind()).isEqualTo(ErrorKind.CHECKPOINT);
            assertThat(status.errorMessage()).startsWith("CRIU restore failed:");
            assertThat(status.checkpointPath()).isEqualTo(dir.toString());
        }

        @Test
        @DisplayName("should not run the tool for an incomplete checkpoint")
        void shouldNotRunTheToolForAnIncompleteCheckpoint() {
            CheckpointStatus status = tools.restore(checkpoints.resolve("missing"), null);

            assertThat(status.success()).isFalse();
            assertThat(status.errorMessage()).startsWith("Checkpoint directory not found");
            assertThat(runner.invoked(startsWith(criu.toString(), "restore"))).isFalse();
        }
    }

    @Nested
    @DisplayName("listCheckpoints and cleanupCheckpoint")
    class Housekeeping {

        @Test
        @DisplayName("should list only directories with metadata")
        void shouldListOnlyDirectoriesWithMetadata() throws IOException {
            legacyCheckpoint("api");
            tools.dump(CheckpointConfig.defaults("web", checkpoints));
            Files.createDirectories(checkpoints.resolve("partial"));

            List<Map<String, Object>> listed = tools.listCheckpoints();

            assertThat(listed).extracting(m -> m.get("container_id")).containsExactlyInAnyOrder("api", "web");
            assertThat(listed).extracting(m -> m.get("checkpoint_path"))
                    .contains(checkpoints.resolve("web").toString());
            assertThat(listed).filteredOn(m -> "web".equals(m.get("container_id")))
                    .singleElement()
                    .satisfies(web -> assertThat(web.get("dump_flags")).isInstanceOf(Map.class));
        }

        @Test
        @DisplayName("should skip checkpoints whose metadata is not a JSON object")
        void shouldSkipCheckpointsWithUnreadableMetadata() throws IOException {
            tools.dump(CheckpointConfig.defaults("web", checkpoints));
            Path broken = Files.createDirectories(checkpoints.resolve("broken"));
            Files.writeString(broken.resolve("metadata.json"), "[\"not\", \"an object\"]");

            assertThat(tools.listCheckpoints()).extracting(m -> m.get("container_id")).containsExactly("web");
        }

        @Test
        @DisplayName("should return an empty list for a missing base directory")
        void shouldReturnAnEmptyListForAMissingBaseDirectory() {
            assertThat(tools.listCheckpoints(tempDir.resolve("absent"))).isEmpty();
        }

        @Test
        @DisplayName("should remove a checkpoint tree and accept one already gone")
        void shouldRemoveACheckpointTreeAndAcceptOneAlreadyGone() {
            tools.dump(CheckpointConfig.defaults("web", checkpoints));
            Path dir = checkpoints.resolve("web");

            assertThat(tools.cleanupCheckpoint(dir)).isTrue();
            assertThat(dir).doesNotExist();
            assertThat(tools.cleanupCheckpoint(dir)).isTrue();
        }
    }
}
