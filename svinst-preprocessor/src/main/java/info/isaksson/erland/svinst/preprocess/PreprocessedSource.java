package info.isaksson.erland.svinst.preprocess;

import java.util.Objects;

/** Fully expanded text of one input file together with its line provenance. */
public final class PreprocessedSource {
    public final String fileName;
    public final String text;
    public final SourceMap sourceMap;

    public PreprocessedSource(String fileName, String text, SourceMap sourceMap) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.text = Objects.requireNonNull(text, "text");
        this.sourceMap = Objects.requireNonNull(sourceMap, "sourceMap");
    }
}
