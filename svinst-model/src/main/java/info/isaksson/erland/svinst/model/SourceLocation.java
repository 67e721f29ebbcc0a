package info.isaksson.erland.svinst.model;

import java.util.Objects;

/**
 * A position in an original (not preprocessed) source file.
 *
 * <p>Lines and columns are 1-based. A column of {@code 0} means the column is unknown.</p>
 */
public final class SourceLocation {
    public final String file;
    public final int line;
    public final int column;

    public SourceLocation(String file, int line, int column) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        this.file = file;
        this.line = line;
        this.column = Math.max(0, column);
    }

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(file, line, 0);
    }

    public boolean hasColumn() {
        return column > 0;
    }

    public SourceLocation withColumn(int column) {
        return new SourceLocation(file, line, column);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override public String toString() {
        return hasColumn() ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
