package containermigrator.packaging;

import containermigrator.exceptions.ErrorKind;

/**
 * Outcome of {@link CheckpointPackageManager#packageCheckpoint}.
 */
public record PackageResult(
        boolean success,
        CheckpointPackage checkpointPackage,
        ErrorKind errorKind,
        String errorMessage
) {

    public static PackageResult success(CheckpointPackage pkg) {
        return new PackageResult(true, pkg, null, null);
    }

    public static PackageResult failure(ErrorKind kind, String message) {
        return new PackageResult(false, null, kind, message);
    }
}
