package work.lcod.html2wt.dom;

import java.util.Objects;

/**
 * A parsed page: the {@code body} root and, when known, the wikitext it was parsed from.
 */
public record Document(Element body, String source) {
    public Document {
        Objects.requireNonNull(body, "body");
        if (body.parent() != null) {
            throw new IllegalArgumentException("Document root must not have a parent");
        }
    }

    public static Document withoutSource(Element body) {
        return new Document(body, null);
    }

    public boolean hasSource() {
        return source != null;
    }
}
