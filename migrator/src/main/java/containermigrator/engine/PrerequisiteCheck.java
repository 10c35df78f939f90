package containermigrator.engine;

import containermigrator.exceptions.ErrorKind;

import java.util.List;

/**
 * Outcome of {@link MigrationOrchestrator#validatePrerequisites}.
 *
 * @param valid true if every prerequisite holds
 * @param errors every failed prerequisite
 * @param errorKind classification of the first failure, null when valid
 */
public record PrerequisiteCheck(boolean valid, List<String> errors, ErrorKind errorKind) {

    public PrerequisiteCheck {
        errors = List.copyOf(errors);
    }

    public static PrerequisiteCheck passed() {
        return new PrerequisiteCheck(true, List.of(), null);
    }
}
