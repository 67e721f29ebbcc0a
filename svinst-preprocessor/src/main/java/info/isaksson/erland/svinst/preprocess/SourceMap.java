package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.SourceLocation;

import java.util.List;

/** Maps each line of preprocessed text back to the file and line it came from. */
public final class SourceMap {

    private final List<SourceLocation> lines;

    SourceMap(List<SourceLocation> lines) {
        if (lines == null || lines.isEmpty()) throw new IllegalArgumentException("source map needs at least one line");
        this.lines = List.copyOf(lines);
    }

    public int lineCount() {
        return lines.size();
    }

    /** Origin of 1-based expanded line {@code expandedLine}; out-of-range lines clamp to the nearest end. */
    public SourceLocation origin(int expandedLine) {
        int idx = Math.max(0, Math.min(lines.size() - 1, expandedLine - 1));
        return lines.get(idx);
    }

    /** Origin of a position in the expanded text, with a 1-based column. */
    public SourceLocation locate(int expandedLine, int column) {
        return origin(expandedLine).withColumn(column);
    }
}
