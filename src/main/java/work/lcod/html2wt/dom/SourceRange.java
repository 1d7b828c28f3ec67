package work.lcod.html2wt.dom;

/**
 * Offsets of a node in the original wikitext: {@code [start, end, openWidth, closeWidth]}.
 * Any entry may be missing.
 */
public record SourceRange(Integer start, Integer end, Integer openWidth, Integer closeWidth) {

    public static SourceRange of(int start, int end, int openWidth, int closeWidth) {
        return new SourceRange(start, end, openWidth, closeWidth);
    }

    public boolean isValid() {
        return start != null && end != null && start >= 0 && end >= start;
    }

    public boolean hasValidTagWidths() {
        return isValid()
            && openWidth != null && closeWidth != null
            && openWidth >= 0 && closeWidth >= 0
            && openWidth + closeWidth <= end - start;
    }

    /**
     * Offset right after the opening tag.
     */
    public int innerStart() {
        return start + (openWidth == null ? 0 : openWidth);
    }

    /**
     * Offset of the closing tag.
     */
    public int innerEnd() {
        return end - (closeWidth == null ? 0 : closeWidth);
    }
}
