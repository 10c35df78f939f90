package containermigrator.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigTest {

    @Test
    void defaults() {
        MigrationConfig c = MigrationConfig.of("web", "localhost", "edge-1");

        assertEquals("x86_64", c.sourceArch());
        assertEquals("aarch64", c.targetArch());
        assertTrue(c.preserveNetworking());
        assertTrue(c.preserveVolumes());
        assertTrue(c.rollbackOnFailure());
        assertEquals(Duration.ofSeconds(300), c.validationTimeout());
        assertNull(c.deadline());
    }

    @Test
    void builderSetsValues() {
        MigrationConfig c = MigrationConfig.builder("web", "localhost", "adb:emulator-5554")
                .sourceArch("aarch64")
                .targetArch("x86_64")
                .preserveNetworking(false)
                .preserveVolumes(false)
                .rollbackOnFailure(false)
                .validationTimeoutSeconds(30)
                .deadline(Duration.ofMinutes(5))
                .build();

        assertEquals("adb:emulator-5554", c.targetHost());
        assertEquals("aarch64", c.sourceArch());
        assertEquals("x86_64", c.targetArch());
        assertFalse(c.preserveNetworking());
        assertFalse(c.preserveVolumes());
        assertFalse(c.rollbackOnFailure());
        assertEquals(Duration.ofSeconds(30), c.validationTimeout());
        assertEquals(Duration.ofMinutes(5), c.deadline());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(NullPointerException.class, () -> MigrationConfig.of(null, "localhost", "edge-1"));
        assertThrows(IllegalArgumentException.class, () -> MigrationConfig.of(" ", "localhost", "edge-1"));
        assertThrows(IllegalArgumentException.class, () -> MigrationConfig.of("../etc", "localhost", "edge-1"));
        assertThrows(IllegalArgumentException.class, () -> MigrationConfig.of("web", "localhost", ""));
        assertThrows(IllegalArgumentException.class,
                () -> MigrationConfig.builder("web", "localhost", "edge-1").validationTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> MigrationConfig.builder("web", "localhost", "edge-1").deadline(Duration.ZERO).build());
    }
}
