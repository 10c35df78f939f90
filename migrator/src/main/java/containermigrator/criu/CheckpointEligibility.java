package containermigrator.criu;

import java.util.List;

/**
 * Whether a container can be checkpointed.
 *
 * @param eligible true if the container exists and is running
 * @param messages the reason when not eligible, otherwise non-fatal warnings
 */
public record CheckpointEligibility(boolean eligible, List<String> messages) {

    public CheckpointEligibility {
        messages = List.copyOf(messages);
    }

    public static CheckpointEligibility eligible(List<String> warnings) {
        return new CheckpointEligibility(true, warnings);
    }

    public static CheckpointEligibility rejected(String reason) {
        return new CheckpointEligibility(false, List.of(reason));
    }
}
