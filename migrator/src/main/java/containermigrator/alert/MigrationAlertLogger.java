package containermigrator.alert;

import containermigrator.config.AlertLevel;
import containermigrator.exceptions.ErrorKind;
import containermigrator.metrics.MigrationMetrics;
import containermigrator.metrics.MigrationMetrics.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Entries go to the {@code migration} logger as an event marker followed by
 * key=value pairs, so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: every event</li>
 *   <li>WARNING: rollback and cancellation events plus errors</li>
 *   <li>ERROR: errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * INFO  migration - MIGRATION_STARTED container=web target=adb:default
 * INFO  migration - STEP_STARTED container=web step=CHECKPOINT
 * INFO  migration - STEP_COMPLETED container=web step=CHECKPOINT duration_ms=840
 * INFO  migration - MIGRATION_COMPLETED container=web duration_ms=5120 package_bytes=18233344
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void migrationStarted(String containerId, String targetHost) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED container={} target={}", containerId, targetHost);
        }
    }

    public static void stepStarted(String containerId, Step step) {
        if (shouldLogInfo()) {
            log.info("STEP_STARTED container={} step={}", containerId, step.name());
        }
    }

    public static void stepCompleted(String containerId, Step step, long durationMs) {
        if (shouldLogInfo()) {
            log.info("STEP_COMPLETED container={} step={} duration_ms={}", containerId, step.name(), durationMs);
        }
    }

    public static void migrationCompleted(String containerId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED container={} duration_ms={} package_bytes={}",
                    containerId, metrics.totalDurationMs(), metrics.packageSizeBytes());
        }
    }

    /**
     * Log when a migration fails. Always logged.
     *
     * @param containerId the container being migrated
     * @param kind the failure classification (may be null)
     * @param error the first fatal cause
     * @param step the step during which failure occurred (may be null)
     */
    public static void migrationFailed(String containerId, ErrorKind kind, String error, Step step) {
        log.error("MIGRATION_FAILED container={} step={} kind={} error=\"{}\"",
                containerId,
                step != null ? step.name() : "UNKNOWN",
                kind != null ? kind.name() : "UNKNOWN",
                error != null ? error : "Unknown error");
    }

    public static void rollbackTriggered(String containerId, String reason) {
        if (shouldLogWarn()) {
            log.warn("ROLLBACK_TRIGGERED container={} reason=\"{}\"", containerId, reason);
        }
    }

    public static void rollbackCompleted(String containerId, boolean success) {
        if (success) {
            if (shouldLogWarn()) {
                log.warn("ROLLBACK_COMPLETED container={} status=SUCCESS", containerId);
            }
        } else {
            log.error("ROLLBACK_COMPLETED container={} status=FAILED", containerId);
        }
    }

    public static void migrationTimeout(String containerId, long timeoutMs, Step step) {
        log.error("MIGRATION_TIMEOUT container={} timeout_ms={} step={}",
                containerId, timeoutMs, step != null ? step.name() : "UNKNOWN");
    }

    public static void migrationCancelled(String containerId) {
        if (shouldLogWarn()) {
            log.warn("MIGRATION_CANCELLED container={}", containerId);
        }
    }
}
