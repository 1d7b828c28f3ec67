package work.lcod.html2wt.html;

import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.handlers.HandlerKey;
import work.lcod.html2wt.handlers.HandlerRegistry;
import work.lcod.html2wt.handlers.NodeHandler;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Fallback for elements without wikitext syntax: emits them as HTML tags around their serialized
 * children.
 */
public final class HtmlElementHandler {
    private HtmlElementHandler() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.HTML_ELEMENT, NodeHandler.builder(HtmlElementHandler::emit)
            .before(HtmlElementHandler::listItemHackLine)
            .build());
        return registry;
    }

    public static void emit(Element node, SerializerState state, boolean wrapperUnmodified) {
        emitListItemHack(node, state);
        state.emitStartTag(HtmlTagSerializer.startTag(node, state, wrapperUnmodified), node);
        if (!node.children().isEmpty()) {
            if (node.name().equals("pre")) {
                // The parser drops one newline right after <pre>.
                state.emitChunk(lostLine(node), node);
            }
            state.serializeChildren(node);
        }
        state.emitEndTag(HtmlTagSerializer.endTag(node, state, wrapperUnmodified), node);
    }

    /**
     * Restores {@code * <li class="x">text} style items: the recorded bullet source is emitted when the
     * element opens a list or follows another item.
     */
    // A list item that reopens its bullets has to start its own line.
    private static NewlineConstraint listItemHackLine(Node node, Node other, SerializerState state) {
        return ((Element) node).dataParsoid().liHackSrc() != null && DomUtils.isListItem(other)
            ? NewlineConstraint.of(1, 2)
            : NewlineConstraint.NONE;
    }

    private static void emitListItemHack(Element node, SerializerState state) {
        var liHackSrc = node.dataParsoid().liHackSrc();
        if (liHackSrc == null) {
            return;
        }
        var prev = DomUtils.previousNonSepSibling(node);
        if ((prev == null && DomUtils.isList(node.parent())) || (prev != null && DomUtils.isListItem(prev))) {
            state.emitChunk(liHackSrc, node);
        }
    }

    static String lostLine(Element pre) {
        if (pre.firstChild() instanceof Text text && text.value().startsWith("\n")) {
            return "\n";
        }
        return pre.dataParsoid().strippedNL() ? "\n" : "";
    }
}
