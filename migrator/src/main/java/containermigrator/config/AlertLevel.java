package containermigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events written by
 * {@link containermigrator.alert.MigrationAlertLogger}. Configured with the
 * {@code migrator.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - every event, including step transitions</li>
 *   <li>{@link #WARNING} - rollback and cancellation events plus errors</li>
 *   <li>{@link #ERROR} - failures only</li>
 * </ul>
 *
 * @see MigratorConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors only. This is the default. */
    WARNING,

    /** Log failures only. */
    ERROR
}
