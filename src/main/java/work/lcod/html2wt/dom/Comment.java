package work.lcod.html2wt.dom;

import java.util.Objects;

public final class Comment extends Node {
    private final String value;

    public Comment(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String value() {
        return value;
    }

    /**
     * Wikitext form of the comment.
     */
    public String toWikitext() {
        return "<!--" + value + "-->";
    }

    @Override
    public String textContent() {
        return value;
    }

    @Override
    public String toString() {
        return toWikitext();
    }
}
