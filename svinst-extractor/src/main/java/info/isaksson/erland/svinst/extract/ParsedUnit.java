package info.isaksson.erland.svinst.extract;

import info.isaksson.erland.svinst.parser.SystemVerilogParser;
import info.isaksson.erland.svinst.preprocess.PreprocessedSource;

/** A successfully parsed file: the preprocessed source and its syntax tree. */
public final class ParsedUnit {
    public final PreprocessedSource source;
    final SystemVerilogParser.Source_textContext tree;
    private final String[] ruleNames;

    ParsedUnit(PreprocessedSource source, SystemVerilogParser.Source_textContext tree, String[] ruleNames) {
        this.source = source;
        this.tree = tree;
        this.ruleNames = ruleNames;
    }

    public SyntaxNode root() {
        return new AntlrSyntaxNode(tree, ruleNames);
    }
}
