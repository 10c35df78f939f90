package containermigrator.engine;

/**
 * Dry-run assessment of a migration: prerequisites and compatibility,
 * without checkpointing anything.
 *
 * @param prerequisites prerequisite validation
 * @param compatibility compatibility check, null if the container could not be inspected
 */
public record MigrationPreflight(PrerequisiteCheck prerequisites, CompatibilityCheck compatibility) {

    /** Returns true if a migration with the same config would pass its gating steps. */
    public boolean ready() {
        return prerequisites.valid() && compatibility != null && compatibility.compatible();
    }
}
