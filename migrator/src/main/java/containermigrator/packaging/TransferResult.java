package containermigrator.packaging;

import containermigrator.exceptions.ErrorKind;

import java.util.List;

/**
 * Outcome of {@link CheckpointPackageManager#transfer}.
 */
public record TransferResult(
        boolean success,
        ErrorKind errorKind,
        String errorMessage,
        List<String> warnings
) {

    public TransferResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static TransferResult success(List<String> warnings) {
        return new TransferResult(true, null, null, warnings);
    }

    public static TransferResult failure(ErrorKind kind, String message, List<String> warnings) {
        return new TransferResult(false, kind, message, warnings);
    }
}
