package info.isaksson.erland.svinst.preprocess;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Nesting state of {@code `ifdef} groups.
 *
 * <p>Operations return false instead of throwing when the directive does not fit the current
 * nesting; the caller knows the source position and reports the error.</p>
 */
public final class ConditionalStack {

    private static final class Frame {
        final boolean parentActive;
        boolean active;
        boolean taken;
        boolean sawElse;

        Frame(boolean parentActive) {
            this.parentActive = parentActive;
        }
    }

    private final Deque<Frame> frames = new ArrayDeque<>();

    /** True when text at the current position is emitted. */
    public boolean isActive() {
        Frame f = frames.peek();
        return f == null || (f.parentActive && f.active);
    }

    /** {@code `ifdef} / {@code `ifndef}: open a group whose first branch is taken iff {@code condition}. */
    public void pushIf(boolean condition) {
        Frame f = new Frame(isActive());
        f.active = f.parentActive && condition;
        f.taken = f.active;
        frames.push(f);
    }

    public boolean elsif(boolean condition) {
        Frame f = frames.peek();
        if (f == null || f.sawElse) return false;
        if (f.taken) {
            f.active = false;
        } else {
            f.active = f.parentActive && condition;
            f.taken = f.active;
        }
        return true;
    }

    public boolean elseBranch() {
        Frame f = frames.peek();
        if (f == null || f.sawElse) return false;
        f.sawElse = true;
        f.active = f.parentActive && !f.taken;
        f.taken = true;
        return true;
    }

    public boolean pop() {
        return frames.poll() != null;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }
}
