package work.lcod.html2wt.handlers;

import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.SerializerState;

/**
 * Italic ({@code ''}) and bold ({@code '''}) quotes.
 */
public final class QuoteHandlers {
    static final String ESCAPE = "<nowiki/>";

    private QuoteHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.I, quote("''"));
        registry.register(HandlerKey.B, quote("'''"));
        return registry;
    }

    static NodeHandler quote(String quotes) {
        return NodeHandler.builder((node, state, wrapperUnmodified) -> {
            if (precedingQuoteRequiresEscape(node, state)) {
                state.emitStartTag(ESCAPE, node);
            }
            state.emitStartTag(quotes, node);
            if (node.children().isEmpty()) {
                // '''' or '''''' would not read back as an empty element.
                if (!state.rtTestMode() || !node.dataParsoid().autoInsertedEnd()) {
                    state.emitStartTag(ESCAPE, node);
                    state.emitEndTag(quotes, node);
                }
                return;
            }
            state.serializeChildren(node);
            state.emitEndTag(quotes, node);
        }).build();
    }

    /**
     * True when the apostrophes closing the previous sibling and those opening {@code node} would form a
     * run of four or more.
     */
    static boolean precedingQuoteRequiresEscape(Element node, SerializerState state) {
        var prev = DomUtils.previousNonDeletedSibling(node);
        if (!DomUtils.isQuoteElt(prev)) {
            return false;
        }
        int trailing = trailingRun(prev, state);
        return trailing > 0 && trailing + leadingRun(node, state) >= 4;
    }

    static int trailingRun(Node node, SerializerState state) {
        if (node instanceof Text text) {
            int count = 0;
            var value = text.value();
            for (int i = value.length() - 1; i >= 0 && value.charAt(i) == '\''; i--) {
                count++;
            }
            return count;
        }
        if (!DomUtils.isQuoteElt(node)) {
            return 0;
        }
        var element = (Element) node;
        if (state.rtTestMode() && element.dataParsoid().autoInsertedEnd()) {
            return 0;
        }
        int own = quoteWidth(element);
        var last = DomUtils.lastNonDeletedChildNode(element);
        return last == null ? own : own + trailingRun(last, state);
    }

    static int leadingRun(Node node, SerializerState state) {
        if (node instanceof Text text) {
            int count = 0;
            var value = text.value();
            while (count < value.length() && value.charAt(count) == '\'') {
                count++;
            }
            return count;
        }
        if (!DomUtils.isQuoteElt(node)) {
            return 0;
        }
        var element = (Element) node;
        if (state.rtTestMode() && element.dataParsoid().autoInsertedStart()) {
            return 0;
        }
        int own = quoteWidth(element);
        var first = DomUtils.firstNonDeletedChildNode(element);
        return first == null ? own : own + leadingRun(first, state);
    }

    private static int quoteWidth(Element element) {
        return element.name().equals("b") ? 3 : 2;
    }
}
