package info.isaksson.erland.svinst.extract;

import info.isaksson.erland.svinst.model.SourceLocation;

/**
 * The structural parser rejected the preprocessed text.
 *
 * <p>Unchecked so it can leave ANTLR error callbacks. {@link #getLine()} and
 * {@link #getColumn()} refer to the preprocessed text; {@link #getLocation()} is the original
 * position once the parser adapter has mapped it.</p>
 */
public final class SvSyntaxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final transient SourceLocation location;

    public SvSyntaxException(String message, int line, int column) {
        this(message, line, column, null, null);
    }

    private SvSyntaxException(String message, int line, int column, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
        this.location = location;
    }

    /** Copy of this exception carrying the original source position. */
    public SvSyntaxException at(SourceLocation origin) {
        return new SvSyntaxException(getMessage(), line, column, origin, this);
    }

    public int getLine() {
        return line;
    }

    /** 0-based column in the preprocessed line. */
    public int getColumn() {
        return column;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
