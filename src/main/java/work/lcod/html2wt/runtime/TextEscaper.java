package work.lcod.html2wt.runtime;

import work.lcod.html2wt.dom.Text;

/**
 * Protects text content that would otherwise be read back as markup in its surrounding context.
 */
@FunctionalInterface
public interface TextEscaper {
    TextEscaper NONE = (text, node, state) -> text;

    String escape(String text, Text node, SerializerState state);
}
