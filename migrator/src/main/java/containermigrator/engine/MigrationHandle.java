package containermigrator.engine;

import containermigrator.process.ExecutionContext;

import java.util.Objects;

/**
 * An active migration: its config, live result and execution context.
 * One handle exists per {@code migrate} call.
 */
final class MigrationHandle {

    private final MigrationConfig config;
    private final MigrationResult result;
    private final ExecutionContext context;

    MigrationHandle(MigrationConfig config, MigrationResult result, ExecutionContext context) {
        this.config = Objects.requireNonNull(config);
        this.result = Objects.requireNonNull(result);
        this.context = Objects.requireNonNull(context);
    }

    String containerId() {
        return config.containerId();
    }

    MigrationConfig config() {
        return config;
    }

    MigrationResult result() {
        return result;
    }

    ExecutionContext context() {
        return context;
    }
}
