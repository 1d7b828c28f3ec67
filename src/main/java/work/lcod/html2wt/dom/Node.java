package work.lcod.html2wt.dom;

/**
 * Base type of the read-only document tree. A node is owned by at most one parent.
 */
public abstract class Node {
    private Element parent;
    private int index = -1;

    Node() {}

    void attach(Element newParent, int position) {
        if (parent != null) {
            throw new IllegalStateException("Node is already attached to <" + parent.name() + ">");
        }
        this.parent = newParent;
        this.index = position;
    }

    public Element parent() {
        return parent;
    }

    public int index() {
        return index;
    }

    public Node previousSibling() {
        if (parent == null || index <= 0) {
            return null;
        }
        return parent.children().get(index - 1);
    }

    public Node nextSibling() {
        if (parent == null) {
            return null;
        }
        var siblings = parent.children();
        return index + 1 < siblings.size() ? siblings.get(index + 1) : null;
    }

    /**
     * Concatenated text of this node, following DOM {@code textContent} rules.
     */
    public abstract String textContent();
}
