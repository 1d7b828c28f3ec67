package work.lcod.html2wt.dom;

import java.util.Locale;

/**
 * Markers written by the DOM differ into {@code data-parsoid-diff}.
 */
public enum DiffMark {
    INSERTED("inserted"),
    DELETED("deleted"),
    MODIFIED_WRAPPER("modified-wrapper"),
    SUBTREE_CHANGED("subtree-changed"),
    CHILDREN_CHANGED("children-changed");

    private final String label;

    DiffMark(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DiffMark from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Diff marker must not be null");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var mark : values()) {
            if (mark.label.equals(normalized)) {
                return mark;
            }
        }
        throw new IllegalArgumentException("Unsupported diff marker: " + value);
    }
}
