package work.lcod.html2wt.html;

import java.util.Set;
import work.lcod.html2wt.dom.Comment;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.SerializerState;

/**
 * Opening and closing tags for elements kept as literal HTML in the wikitext.
 */
public final class HtmlTagSerializer {
    private static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source",
        "track", "wbr"
    );

    private HtmlTagSerializer() {}

    public static boolean isVoidElement(String name) {
        return VOID_ELEMENTS.contains(name);
    }

    /**
     * Opening tag: copied from the original source when the wrapper is unmodified, empty when the parser
     * inserted it, otherwise rebuilt from the current attributes.
     */
    public static String startTag(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        if (wrapperUnmodified) {
            var dsr = dp.dsr();
            return state.originalSource(dsr.start(), dsr.innerStart());
        }
        if (dp.autoInsertedStart()) {
            return "";
        }
        return synthesizedStartTag(node);
    }

    public static String endTag(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        if (wrapperUnmodified) {
            var dsr = dp.dsr();
            return state.originalSource(dsr.innerEnd(), dsr.end());
        }
        if (dp.autoInsertedEnd() || isVoidElement(node.name()) || dp.selfClose()) {
            return "";
        }
        return "</" + node.name() + ">";
    }

    /**
     * HTML source of the whole subtree, with text escaped and parser-internal attributes dropped.
     */
    public static String outerHtml(Element node) {
        var out = new StringBuilder();
        appendOuterHtml(node, out);
        return out.toString();
    }

    private static void appendOuterHtml(Node node, StringBuilder out) {
        if (node instanceof Text text) {
            out.append(escapeText(text.value()));
        } else if (node instanceof Comment comment) {
            out.append(comment.toWikitext());
        } else {
            var element = (Element) node;
            out.append(synthesizedStartTag(element));
            for (var child : element.children()) {
                appendOuterHtml(child, out);
            }
            if (!isVoidElement(element.name()) && !element.dataParsoid().selfClose()) {
                out.append("</").append(element.name()).append('>');
            }
        }
    }

    private static String synthesizedStartTag(Element node) {
        var attributes = AttributeSerializer.serialize(node);
        var close = isVoidElement(node.name()) || node.dataParsoid().selfClose() ? " /" : "";
        return "<" + node.name() + (attributes.isEmpty() ? "" : " " + attributes) + close + ">";
    }

    static String escapeText(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
