package containermigrator.engine;

import java.util.List;

/**
 * Whether a container can be migrated to the target.
 *
 * <p>{@code compatible} is the conjunction of the three category flags.
 * {@code issues} holds both hard and soft findings; soft ones do not clear a flag.
 */
public record CompatibilityCheck(
        boolean compatible,
        boolean architectureCompatible,
        boolean kernelCompatible,
        boolean runtimeCompatible,
        List<String> issues,
        List<String> recommendations
) {

    public CompatibilityCheck {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    /** A check that could not inspect the container at all. */
    public static CompatibilityCheck unavailable(String reason) {
        return new CompatibilityCheck(false, false, false, false, List.of(reason), List.of());
    }
}
