package info.isaksson.erland.svinst.extract;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/** {@link SyntaxNode} over an ANTLR parse tree. The end-of-input token is hidden. */
final class AntlrSyntaxNode implements SyntaxNode {

    private final ParseTree tree;
    private final String[] ruleNames;

    AntlrSyntaxNode(ParseTree tree, String[] ruleNames) {
        this.tree = tree;
        this.ruleNames = ruleNames;
    }

    @Override public String kind() {
        if (tree instanceof ParserRuleContext) {
            return ruleNames[((ParserRuleContext) tree).getRuleIndex()];
        }
        return "token";
    }

    @Override public List<SyntaxNode> children() {
        int n = tree.getChildCount();
        List<SyntaxNode> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ParseTree child = tree.getChild(i);
            if (child instanceof TerminalNode && ((TerminalNode) child).getSymbol().getType() == Token.EOF) continue;
            out.add(new AntlrSyntaxNode(child, ruleNames));
        }
        return out;
    }

    @Override public boolean isLeaf() {
        return tree instanceof TerminalNode;
    }

    @Override public String text() {
        return tree.getText();
    }

    @Override public int line() {
        Token t = firstToken();
        return t == null ? 0 : t.getLine();
    }

    @Override public int column() {
        Token t = firstToken();
        return t == null ? 0 : t.getCharPositionInLine();
    }

    private Token firstToken() {
        if (tree instanceof TerminalNode) return ((TerminalNode) tree).getSymbol();
        return ((ParserRuleContext) tree).getStart();
    }

    @Override public String toString() {
        return kind() + "@" + line();
    }
}
