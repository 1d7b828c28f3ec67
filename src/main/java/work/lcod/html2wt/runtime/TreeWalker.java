package work.lcod.html2wt.runtime;

import work.lcod.html2wt.dom.Comment;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.handlers.HandlerKey;
import work.lcod.html2wt.handlers.WikitextEscapes;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Depth-first walk dispatching elements to their handlers and feeding separators in between.
 */
final class TreeWalker {
    private TreeWalker() {}

    static void serializeDocument(SerializerState state) {
        var body = state.document().body();
        serializeNode(state, body);
        state.flushSeparator(body);
    }

    static void serializeChildren(SerializerState state, Element parent) {
        Node child = parent.firstChild();
        while (child != null) {
            child = serializeNode(state, child);
        }
        var last = state.prevNode();
        if (last != null && last != parent && last.parent() == parent) {
            updateSeparatorConstraints(state, last, parent);
        }
    }

    /**
     * @return the node the walk continues with
     */
    static Node serializeNode(SerializerState state, Node node) {
        if (node instanceof Text text) {
            serializeText(state, text);
            return text.nextSibling();
        }
        if (node instanceof Comment comment) {
            state.appendSeparatorSource(comment.toWikitext());
            return comment.nextSibling();
        }
        var element = (Element) node;
        var key = HandlerKey.resolve(element);
        if (key == HandlerKey.DIFF_MARKER) {
            return element.nextSibling();
        }
        var handler = state.registry().get(key);
        var prev = state.prevNode();
        if (prev != null) {
            updateSeparatorConstraints(state, prev, element);
        }
        if (handler.forceStartOfLine()) {
            state.requireStartOfLine(prev, element);
        }
        state.setPrevNode(element);
        if (state.selserMode() && element.subtreeUnmodified() && element.dataParsoid().hasValidDsr()) {
            emitOriginalSource(state, element);
        } else {
            boolean wrapperUnmodified = state.selserMode() && DomUtils.wrapperUnmodified(element);
            handler.emitter().emit(element, state, wrapperUnmodified);
        }
        state.setPrevNode(element);
        return key.skipsEncapsulatedRange() ? DomUtils.skipOverEncapsulatedContent(element) : element.nextSibling();
    }

    private static void emitOriginalSource(SerializerState state, Element element) {
        var dsr = element.dataParsoid().dsr();
        var source = state.originalSource(dsr.start(), dsr.end());
        state.diagnostics().log("trace/selser", "reusing source for", element);
        state.singleLineContext().disable();
        try {
            state.emitChunk(source, element);
        } finally {
            state.singleLineContext().pop();
        }
    }

    private static void serializeText(SerializerState state, Text text) {
        var value = text.value();
        if (DomUtils.isIEW(text)) {
            state.appendSeparatorSource(value);
            return;
        }
        int start = 0;
        while (start < value.length() && Character.isWhitespace(value.charAt(start))) {
            start++;
        }
        int end = value.length();
        while (end > start && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        var leading = value.substring(0, start);
        var trailing = value.substring(end);
        if (leading.indexOf('\n') >= 0) {
            state.appendSeparatorSource(leading);
        } else {
            start = 0;
        }
        if (trailing.indexOf('\n') < 0) {
            end = value.length();
        }
        var prev = state.prevNode();
        if (prev != null) {
            updateSeparatorConstraints(state, prev, text);
        }
        state.setPrevNode(text);
        var content = state.currentEscaper().escape(value.substring(start, end), text, state);
        state.flushSeparator(text);
        state.emitChunk(escapeLineStarts(state, text, content), text);
        if (end < value.length()) {
            state.appendSeparatorSource(trailing);
        }
    }

    // Preformatted text keeps its line starts verbatim.
    private static String escapeLineStarts(SerializerState state, Text text, String content) {
        if (content.isEmpty() || DomUtils.hasAncestor(text, "pre")) {
            return content;
        }
        boolean inWikiTable = state.wikiTableNesting() > 0;
        boolean multiLine = !state.singleLineContext().enforced();
        var lines = content.split("\n", -1);
        var out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            boolean lineStart = i == 0 ? state.atStartOfLine() : multiLine;
            out.append(lineStart ? WikitextEscapes.lineStart(lines[i], inWikiTable) : lines[i]);
        }
        return out.toString();
    }

    /**
     * Merges the constraint between {@code a}, the node that ended the last chunk, and {@code b}: parent
     * to first child, last child to parent, or sibling to sibling.
     */
    static void updateSeparatorConstraints(SerializerState state, Node a, Node b) {
        var registry = state.registry();
        var handlerA = registry.handlerFor(a);
        var handlerB = registry.handlerFor(b);
        NewlineConstraint fromA;
        NewlineConstraint fromB;
        if (b.parent() == a) {
            fromA = handlerA.firstChild().apply(a, b, state);
            fromB = handlerB.before().apply(b, a, state);
        } else if (a.parent() == b) {
            fromA = handlerA.after().apply(a, b, state);
            fromB = handlerB.lastChild().apply(b, a, state);
        } else {
            fromA = handlerA.after().apply(a, b, state);
            fromB = handlerB.before().apply(b, a, state);
        }
        state.separator().merge(NewlineConstraint.combine(fromA, fromB), a, b);
    }
}
