package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.FailureKind;
import info.isaksson.erland.svinst.model.SourceLocation;

/** Preprocessing of one file failed. */
public final class PreprocessException extends Exception {
    private static final long serialVersionUID = 1L;

    private final FailureKind kind;
    private final SourceLocation location;

    public PreprocessException(FailureKind kind, String message, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.location = location;
    }

    public PreprocessException(FailureKind kind, String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.location = location;
    }

    public FailureKind getKind() {
        return kind;
    }

    /** Where the failing directive or macro use is, may be null. */
    public SourceLocation getLocation() {
        return location;
    }
}
