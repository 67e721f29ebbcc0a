package info.isaksson.erland.svinst.model;

import java.util.Objects;

/** A recorded per-file failure. {@link #location} is null when no position is available. */
public final class FileFailure {
    public final FailureKind kind;
    public final String message;
    public final SourceLocation location;

    public FileFailure(FailureKind kind, String message, SourceLocation location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message == null ? "" : message;
        this.location = location;
    }

    @Override public String toString() {
        return kind.displayName() + ": " + message + (location == null ? "" : " (" + location + ")");
    }
}
