package info.isaksson.erland.svinst.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one syntax tree node for full-tree output.
 *
 * <p>Interior nodes carry a kind and children; leaves carry the token text and the line (and,
 * for tokens that came from an included file, the file) they originate from.</p>
 */
public final class TreeNode {
    public final String kind;
    public final String token;
    public final int line;
    /** Originating file for tokens from included files, otherwise null. */
    public final String file;

    private final List<TreeNode> children;

    private TreeNode(String kind, String token, int line, String file, List<TreeNode> children) {
        this.kind = kind;
        this.token = token;
        this.line = line;
        this.file = file;
        this.children = children;
    }

    public static TreeNode interior(String kind) {
        return new TreeNode(Objects.requireNonNull(kind, "kind"), null, 0, null, new ArrayList<>());
    }

    public static TreeNode leaf(String token, int line, String file) {
        return new TreeNode(null, Objects.requireNonNull(token, "token"), line, file, List.of());
    }

    public boolean isLeaf() {
        return kind == null;
    }

    public TreeNode addChild(TreeNode child) {
        if (isLeaf()) throw new IllegalStateException("leaf nodes have no children");
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    public List<TreeNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override public String toString() {
        return isLeaf() ? "Token(" + token + "@" + line + ")" : kind + children;
    }
}
