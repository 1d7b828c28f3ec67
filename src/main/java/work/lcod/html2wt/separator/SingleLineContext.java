package work.lcod.html2wt.separator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of single-line activations. The innermost entry decides whether newlines may be emitted.
 */
public final class SingleLineContext {
    private final Deque<Boolean> stack = new ArrayDeque<>();

    /** Suppress newlines until the matching {@link #pop()}. */
    public void enforce() {
        stack.push(Boolean.TRUE);
    }

    /** Lift an outer suppression until the matching {@link #pop()}. */
    public void disable() {
        stack.push(Boolean.FALSE);
    }

    public void pop() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Single-line context stack underflow");
        }
        stack.pop();
    }

    public boolean enforced() {
        var top = stack.peek();
        return top != null && top;
    }

    public int depth() {
        return stack.size();
    }
}
