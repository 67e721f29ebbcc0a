package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/** Output buffer of the preprocessor; records the origin of every line it starts. */
final class ExpandedText {

    private final StringBuilder text = new StringBuilder();
    private final List<SourceLocation> origins = new ArrayList<>();
    private int lineStart;

    ExpandedText(SourceLocation firstLine) {
        origins.add(firstLine);
    }

    void append(char ch) {
        text.append(ch == '\n' ? ' ' : ch);
    }

    void append(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            append(s.charAt(i));
        }
    }

    /** End the current line; the next line originates from {@code next}. */
    void newline(SourceLocation next) {
        text.append('\n');
        origins.add(next);
        lineStart = text.length();
    }

    /** Make sure subsequent text starts on a line attributed to {@code origin}. */
    void startLine(SourceLocation origin) {
        if (text.length() > lineStart) {
            newline(origin);
        } else {
            origins.set(origins.size() - 1, origin);
        }
    }

    PreprocessedSource build(String fileName) {
        return new PreprocessedSource(fileName, text.toString(), new SourceMap(origins));
    }
}
