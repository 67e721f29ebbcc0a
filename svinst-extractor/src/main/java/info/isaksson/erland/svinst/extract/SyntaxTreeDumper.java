package info.isaksson.erland.svinst.extract;

import info.isaksson.erland.svinst.model.SourceLocation;
import info.isaksson.erland.svinst.model.TreeNode;
import info.isaksson.erland.svinst.preprocess.SourceMap;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Converts a parse tree into a {@link TreeNode} snapshot for full-tree output.
 *
 * <p>Kinds are grammar categories in UpperCamelCase ({@code module_declaration} becomes
 * {@code ModuleDeclaration}). Token lines are mapped back to the original source; tokens that
 * came from an included file also carry that file.</p>
 */
public final class SyntaxTreeDumper {

    public TreeNode dump(ParsedUnit unit) {
        SourceMap map = unit.source.sourceMap;
        String topFile = unit.source.fileName;
        Deque<TreeNode> open = new ArrayDeque<>();
        TreeNode[] root = new TreeNode[1];

        SyntaxWalker.walk(unit.root(), new SyntaxWalker.Listener() {
            @Override public void enter(SyntaxNode node) {
                if (node.isLeaf()) {
                    SourceLocation origin = map.origin(node.line());
                    String file = origin.file.equals(topFile) ? null : origin.file;
                    open.peek().addChild(TreeNode.leaf(node.text(), origin.line, file));
                    return;
                }
                TreeNode n = TreeNode.interior(upperCamel(node.kind()));
                if (open.isEmpty()) {
                    root[0] = n;
                } else {
                    open.peek().addChild(n);
                }
                open.push(n);
            }

            @Override public void leave(SyntaxNode node) {
                if (!node.isLeaf()) open.pop();
            }
        });
        return root[0];
    }

    static String upperCamel(String ruleName) {
        StringBuilder sb = new StringBuilder(ruleName.length());
        boolean upper = true;
        for (int i = 0; i < ruleName.length(); i++) {
            char ch = ruleName.charAt(i);
            if (ch == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(ch) : ch);
                upper = false;
            }
        }
        return sb.toString();
    }
}
