package work.lcod.html2wt.handlers;

import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.CurrentLine;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Paragraphs, line breaks, horizontal rules and the document body.
 */
public final class ParagraphHandlers {
    private static final Pattern BREAKS_TO_CONTENT = Pattern.compile("\\n\\S");

    private ParagraphHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.P, NodeHandler.builder((node, state, wrapperUnmodified) -> state.serializeChildren(node))
            // Otherwise leading whitespace before the paragraph would start an indent-pre.
            .forceStartOfLine()
            .before(ParagraphHandlers::beforeParagraph)
            .after(ParagraphHandlers::afterParagraph)
            .build());
        registry.register(HandlerKey.BR, NodeHandler.builder(ParagraphHandlers::emitBreak)
            .before((node, other, state) -> other == node.parent() && DomUtils.hasName(other, "p")
                ? NewlineConstraint.of(1, 2)
                : NewlineConstraint.NONE)
            .after((node, other, state) -> DomUtils.isListItem(node.parent())
                ? NewlineConstraint.NONE
                : NewlineConstraint.atLeast(1))
            .build());
        registry.register(HandlerKey.HR, NodeHandler.builder((node, state, wrapperUnmodified) ->
                state.emitChunk("-".repeat(4 + node.dataParsoid().extraDashes()), node))
            .before(1, 2)
            .after(0, 2)
            .build());
        registry.register(HandlerKey.BODY, NodeHandler.builder((node, state, wrapperUnmodified) -> state.serializeChildren(node))
            .firstChild(0, 1)
            .lastChild(0, 1)
            .build());
        return registry;
    }

    private static void emitBreak(Element node, SerializerState state, boolean wrapperUnmodified) {
        if (node.dataParsoid().isLiteralHtml() || !DomUtils.hasName(node.parent(), "p")) {
            state.emitChunk("<br>", node);
            return;
        }
        var pending = state.separator().constraint();
        if (pending != null && Integer.valueOf(2).equals(pending.min()) && node.parent().children().size() == 1) {
            // A paragraph holding only a break: keep it as an empty line.
            state.separator().merge(NewlineConstraint.of(2, 2), node, node);
        }
        state.emitChunk("", node);
    }

    private static NewlineConstraint beforeParagraph(Node node, Node other, SerializerState state) {
        boolean cellOrBody = DomUtils.hasName(other, "td") || DomUtils.hasName(other, "th") || DomUtils.isBody(other);
        if (node.parent() == other && (DomUtils.isListItem(other) || cellOrBody)) {
            return cellOrBody ? NewlineConstraint.of(0, 1) : NewlineConstraint.of(0, 0);
        }
        boolean paragraphTransition = other == DomUtils.previousNonDeletedSibling(node)
            && DomUtils.hasName(other, "p")
            && !DomUtils.isLiteralHtmlNode(other);
        boolean textTransition = other instanceof Text
            && other == DomUtils.previousNonSepSibling(node)
            && !currentLineHasBlockNode(state.currentLine(), other, false);
        if (paragraphTransition || textTransition) {
            return NewlineConstraint.of(2, 2);
        }
        if (other instanceof Text
            || (DomUtils.isBlockNode(other) && node.parent() == other)
            || (DomUtils.emitsSolTransparentSingleLineWikitext(other) && DomUtils.isNewElt(node))) {
            return NewlineConstraint.of(1, 2);
        }
        return NewlineConstraint.of(0, 2);
    }

    private static NewlineConstraint afterParagraph(Node node, Node other, SerializerState state) {
        var element = (Element) node;
        boolean endsWithBreak = DomUtils.hasName(element.lastChild(), "br");
        if (!endsWithBreak
            && DomUtils.hasName(other, "p")
            && !DomUtils.isLiteralHtmlNode(other)
            && !currentLineHasBlockNode(state.currentLine(), node, true)
            && !nextLineMightHaveBlockNode(other)) {
            return NewlineConstraint.of(2, 2);
        }
        if (other instanceof Text || (DomUtils.isBlockNode(other) && node.parent() == other)) {
            return NewlineConstraint.of(1, 2);
        }
        return NewlineConstraint.of(0, 2);
    }

    /**
     * Walks backwards from {@code node} over the current output line looking for a block element that
     * renders on that line.
     */
    static boolean currentLineHasBlockNode(CurrentLine line, Node node, boolean skipNode) {
        if (!skipNode && BREAKS_TO_CONTENT.matcher(node.textContent()).find()) {
            return false;
        }
        Node parent = node.parent();
        Node current = DomUtils.previousNonDeletedSibling(node);
        while (current == null || !DomUtils.atTheTop(current)) {
            while (current != null) {
                if (DomUtils.isBlockNodeWithVisibleWikitext(current)) {
                    return true;
                }
                if (current.textContent().indexOf('\n') >= 0) {
                    return false;
                }
                current = DomUtils.previousNonDeletedSibling(current);
                var first = line.firstNode();
                // Never look past the start of the current line.
                if (first != null && (current == null || current == first || DomUtils.isAncestorOf(current, first))) {
                    return false;
                }
            }
            if (parent == null) {
                return false;
            }
            current = parent;
            parent = current.parent();
        }
        return false;
    }

    /**
     * True when the line starting at {@code node} could hold a block element next to it.
     */
    static boolean nextLineMightHaveBlockNode(Node node) {
        Node current = DomUtils.nextNonDeletedSibling(node);
        while (current != null) {
            if (current instanceof Text text) {
                if (text.value().indexOf('\n') >= 0) {
                    return false;
                }
            } else if (current instanceof Element) {
                if (DomUtils.requiresStartOfLine(current) && !DomUtils.isLiteralHtmlNode(current)) {
                    return false;
                }
                return DomUtils.isBlockNodeWithVisibleWikitext(current);
            }
            current = DomUtils.nextNonDeletedSibling(current);
        }
        return false;
    }
}
