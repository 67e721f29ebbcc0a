package info.isaksson.erland.svinst.extract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first traversal producing enter/leave events.
 *
 * <p>Uses an explicit stack, so deeply nested expressions or generate blocks cannot overflow
 * the call stack.</p>
 */
public final class SyntaxWalker {

    public interface Listener {
        void enter(SyntaxNode node);

        default void leave(SyntaxNode node) {}
    }

    private SyntaxWalker() {}

    public static void walk(SyntaxNode root, Listener listener) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.children == null) {
                listener.enter(top.node);
                top.children = top.node.isLeaf() ? List.of() : top.node.children();
            }
            if (top.next < top.children.size()) {
                stack.push(new Frame(top.children.get(top.next++)));
            } else {
                stack.pop();
                listener.leave(top.node);
            }
        }
    }

    private static final class Frame {
        final SyntaxNode node;
        List<SyntaxNode> children;
        int next;

        Frame(SyntaxNode node) {
            this.node = node;
        }
    }
}
