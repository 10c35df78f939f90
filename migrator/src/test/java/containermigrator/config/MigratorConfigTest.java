package containermigrator.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MigratorConfigTest {

    @Test
    void defaults() {
        MigratorConfig c = MigratorConfig.DEFAULTS;

        assertEquals(Path.of("/data/local/tmp/criu"), c.criuBinary());
        assertEquals(Path.of("/data/local/tmp/checkpoints"), c.checkpointDir());
        assertEquals(Path.of("/data/local/tmp/migration"), c.workDir());
        assertEquals("/data/local/tmp/migration", c.targetWorkDir());
        assertEquals("criu", c.targetCriuSsh());
        assertEquals(MigratorConfig.DEFAULT_ADB_CRIU, c.targetCriuAdb());
        assertEquals("docker", c.runtimeCommand());
        assertEquals(Duration.ofSeconds(10), c.probeTimeout());
        assertEquals(Duration.ZERO, c.dumpTimeout());
        assertEquals(Duration.ZERO, c.transferTimeout());
        assertEquals(Duration.ofMillis(2000), c.validationPollInterval());
        assertTrue(c.requireSidecar());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void builderSetsValues() {
        MigratorConfig c = MigratorConfig.builder()
                .criuBinary(Path.of("/usr/sbin/criu"))
                .workDir(Path.of("/tmp/work"))
                .targetWorkDir("/tmp/target")
                .adbCommand("/opt/platform-tools/adb")
                .dumpTimeoutSeconds(60)
                .restoreTimeout(Duration.ofSeconds(45))
                .remoteExecTimeoutSeconds(20)
                .validationPollIntervalMillis(250)
                .requireSidecar(false)
                .alertLevel(AlertLevel.DEBUG)
                .build();

        assertEquals(Path.of("/usr/sbin/criu"), c.criuBinary());
        assertEquals(Path.of("/tmp/work"), c.workDir());
        assertEquals("/tmp/target", c.targetWorkDir());
        assertEquals("/opt/platform-tools/adb", c.adbCommand());
        assertEquals(Duration.ofSeconds(60), c.dumpTimeout());
        assertEquals(Duration.ofSeconds(45), c.restoreTimeout());
        assertEquals(Duration.ofSeconds(20), c.remoteExecTimeout());
        assertEquals(Duration.ofMillis(250), c.validationPollInterval());
        assertFalse(c.requireSidecar());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
    }

    @Test
    void toBuilderCopiesEveryValue() {
        MigratorConfig original = MigratorConfig.builder()
                .sshCommand("autossh")
                .transferTimeoutSeconds(300)
                .requireSidecar(false)
                .build();

        MigratorConfig copy = original.toBuilder().build();

        assertEquals(original.toString(), copy.toString());
        assertEquals("autossh", copy.sshCommand());
    }

    @Test
    void rejectsInvalidValues() {
        MigratorConfig.Builder b = MigratorConfig.builder();

        assertThrows(MigratorConfigException.class, () -> b.targetWorkDir(" "));
        assertThrows(MigratorConfigException.class, () -> b.runtimeCommand(null));
        assertThrows(MigratorConfigException.class, () -> b.dumpTimeout(Duration.ofSeconds(-1)));
        assertThrows(MigratorConfigException.class, () -> b.validationPollInterval(Duration.ZERO));
        assertThrows(NullPointerException.class, () -> b.workDir(null));
    }

    @Test
    void nonPositiveSecondsMeanNoLimit() {
        MigratorConfig c = MigratorConfig.builder()
                .dumpTimeoutSeconds(0)
                .transferTimeoutSeconds(-10)
                .build();

        assertEquals(Duration.ZERO, c.dumpTimeout());
        assertEquals(Duration.ZERO, c.transferTimeout());
    }
}
