package work.lcod.html2wt.separator;

import work.lcod.html2wt.dom.Node;

/**
 * The pending separator slot: whitespace source collected since the last chunk and the constraint
 * accumulated between the node that ended the last chunk and the node about to start the next one.
 */
public final class Separator {
    private StringBuilder source;
    private NewlineConstraint constraint;
    private Node left;
    private Node right;

    public String source() {
        return source == null ? null : source.toString();
    }

    public NewlineConstraint constraint() {
        return constraint;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    public boolean hasConstraint() {
        return constraint != null;
    }

    public boolean isEmpty() {
        return source == null && constraint == null;
    }

    public void appendSource(String text) {
        if (source == null) {
            source = new StringBuilder();
        }
        source.append(text);
    }

    public void replaceSource(String text) {
        source = text == null ? null : new StringBuilder(text);
    }

    /**
     * Merges {@code update}, computed between {@code from} and {@code to}, into the pending constraint.
     */
    public void merge(NewlineConstraint update, Node from, Node to) {
        constraint = constraint == null ? update : NewlineConstraint.combine(constraint, update);
        if (left == null) {
            left = from;
        }
        right = to;
    }

    public void clear() {
        source = null;
        constraint = null;
        left = null;
        right = null;
    }
}
