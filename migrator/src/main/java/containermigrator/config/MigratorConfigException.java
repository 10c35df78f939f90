package containermigrator.config;

/**
 * Exception thrown when migrator configuration cannot be loaded or is invalid.
 *
 * <p>Thrown when no configuration file is found on the classpath, when a file
 * cannot be parsed, or when a builder receives an out-of-range value.
 *
 * <p>This is an unchecked exception so that configuration loading can be part
 * of initialization code without forced exception handling.
 *
 * @see MigratorConfigLoader
 */
public class MigratorConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public MigratorConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public MigratorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
