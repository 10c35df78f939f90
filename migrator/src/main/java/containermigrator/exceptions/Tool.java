package containermigrator.exceptions;

/**
 * External executables the migrator drives.
 *
 * <p>Each tool has a default {@link ErrorKind} used when it fails or times out
 * and no more specific exit-code rule applies.
 *
 * @see ErrorClassifier
 */
public enum Tool {
    CRIU(ErrorKind.CHECKPOINT),
    RUNTIME(ErrorKind.VALIDATION),
    SSH(ErrorKind.TRANSFER),
    SCP(ErrorKind.TRANSFER),
    ADB(ErrorKind.TRANSFER),
    TAR(ErrorKind.TRANSFER);

    private final ErrorKind defaultKind;

    Tool(ErrorKind defaultKind) {
        this.defaultKind = defaultKind;
    }

    /** Returns the kind reported when this tool fails without a more specific rule. */
    public ErrorKind defaultKind() {
        return defaultKind;
    }
}
