package work.lcod.html2wt.separator;

import work.lcod.html2wt.dom.Node;

/**
 * Tracks the output line being written and the node that opened it.
 */
public final class CurrentLine {
    private final StringBuilder text = new StringBuilder();
    private Node firstNode;

    public Node firstNode() {
        return firstNode;
    }

    public String text() {
        return text.toString();
    }

    public boolean atStartOfLine() {
        return text.length() == 0;
    }

    /**
     * Records {@code chunk} as written on behalf of {@code node}.
     */
    public void append(String chunk, Node node) {
        if (chunk.isEmpty()) {
            return;
        }
        int lastNewline = chunk.lastIndexOf('\n');
        if (lastNewline < 0) {
            if (text.length() == 0) {
                firstNode = node;
            }
            text.append(chunk);
            return;
        }
        text.setLength(0);
        text.append(chunk, lastNewline + 1, chunk.length());
        firstNode = text.length() == 0 ? null : node;
    }
}
