package work.lcod.html2wt.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured reconstruction data for encapsulated content ({@code data-mw}).
 *
 * @param parts transclusion parts, empty when absent
 * @param name extension tag name, or {@code null}
 * @param attrs extension attributes in source order
 * @param body extension body, or {@code null} for self-closing tags
 */
public record DataMw(List<Part> parts, String name, Map<String, String> attrs, ExtensionBody body) {
    public static final DataMw EMPTY = new DataMw(List.of(), null, Map.of(), null);

    public DataMw {
        parts = parts == null ? List.of() : List.copyOf(parts);
        attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public boolean hasParts() {
        return !parts.isEmpty();
    }

    public DataMw withName(String newName) {
        return new DataMw(parts, newName, attrs, body);
    }

    /**
     * @param extSrc raw extension content, or {@code null}
     * @param html fragment to serialize, or {@code null}
     */
    public record ExtensionBody(String extSrc, Element html) {}
}
