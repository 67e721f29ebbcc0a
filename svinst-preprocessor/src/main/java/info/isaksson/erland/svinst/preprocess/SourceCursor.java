package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.SourceLocation;

import java.nio.file.Path;

/**
 * Read position in a file or in a macro expansion.
 *
 * <p>Expansion cursors report the invocation site as their location, so diagnostics
 * for macro text point at the line that used the macro.</p>
 */
final class SourceCursor {
    final String file;
    /** File the text belongs to; relative includes resolve against its directory. */
    final Path path;
    private final String text;
    private final SourceLocation origin;

    private int pos;
    private int line = 1;
    private int col = 1;

    private SourceCursor(String file, Path path, String text, SourceLocation origin) {
        this.file = file;
        this.path = path;
        this.text = text;
        this.origin = origin;
    }

    static SourceCursor forFile(Path path, String text) {
        return new SourceCursor(path.toString(), path, text, null);
    }

    static SourceCursor forExpansion(SourceCursor parent, String text, SourceLocation origin) {
        return new SourceCursor(parent.file, parent.path, text, origin);
    }

    boolean isExpansion() {
        return origin != null;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    char peek() {
        return peek(0);
    }

    /** Character {@code ahead} positions away, or {@code '\0'} past the end. */
    char peek(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    char next() {
        char ch = text.charAt(pos++);
        if (ch == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return ch;
    }

    /** Raw line counter of this cursor's own text. */
    int rawLine() {
        return line;
    }

    /** Current line as reported to users. */
    int line() {
        return origin != null ? origin.line : line;
    }

    SourceLocation location() {
        return origin != null ? origin : new SourceLocation(file, line, col);
    }
}
