package containermigrator.validation;

/**
 * Outcome of waiting for a restored container.
 *
 * @param live whether the container was seen running on the target
 * @param attempts how many times the target was queried
 * @param message failure description, null when live
 */
public record ValidationResult(boolean live, int attempts, String message) {

    public static ValidationResult live(int attempts) {
        return new ValidationResult(true, attempts, null);
    }

    public static ValidationResult notLive(int attempts, String message) {
        return new ValidationResult(false, attempts, message);
    }
}
