package info.isaksson.erland.svinst.extract;

import java.util.List;

/**
 * Parser-independent view of a syntax tree node.
 *
 * <p>Interior nodes have a grammar category as {@link #kind()} (for example
 * {@code module_declaration}); leaves are tokens with their text and expanded line.</p>
 */
public interface SyntaxNode {

    String kind();

    List<SyntaxNode> children();

    boolean isLeaf();

    /** Token text for leaves, concatenated token text for interior nodes. */
    String text();

    /** 1-based line in the preprocessed text; for interior nodes the line of the first token. */
    int line();

    /** 0-based column in the preprocessed text. */
    int column();
}
