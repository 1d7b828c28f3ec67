package work.lcod.html2wt.handlers;

import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Section headings {@code h1} to {@code h6}.
 */
public final class HeadingHandlers {
    private HeadingHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.H1, heading("="));
        registry.register(HandlerKey.H2, heading("=="));
        registry.register(HandlerKey.H3, heading("==="));
        registry.register(HandlerKey.H4, heading("===="));
        registry.register(HandlerKey.H5, heading("====="));
        registry.register(HandlerKey.H6, heading("======"));
        return registry;
    }

    static NodeHandler heading(String marks) {
        return NodeHandler.builder((node, state, wrapperUnmodified) -> emit(marks, node, state))
            .forceStartOfLine()
            .before((node, other, state) -> {
                if (DomUtils.isNewElt(node) && DomUtils.previousNonSepSibling(node) != null) {
                    return NewlineConstraint.of(2, 2);
                }
                if (DomUtils.isNewElt(other) && DomUtils.previousNonSepSibling(node) == other) {
                    // Keep a freshly inserted neighbour visually apart.
                    return NewlineConstraint.of(2, 2);
                }
                return NewlineConstraint.of(1, 2);
            })
            .after(1, 2)
            .build();
    }

    private static void emit(String marks, Element node, SerializerState state) {
        var space = "";
        if (DomUtils.isNewElt(node)) {
            var first = node.firstChild();
            if (first != null && !(first instanceof Text text && text.value().matches("(?s)^\\s.*"))) {
                space = " ";
            }
        }
        state.emitChunk(marks + space, node);
        state.singleLineContext().enforce();
        try {
            if (node.children().isEmpty()) {
                // Keeps the two runs of '=' from merging.
                state.emitChunk("<nowiki/>", node);
            } else {
                state.serializeChildren(node, WikitextEscapes.heading(node));
            }
            space = "";
            if (DomUtils.isNewElt(node)) {
                var last = node.lastChild();
                if (last != null && !(last instanceof Text text && text.value().matches("(?s).*\\s$"))) {
                    space = " ";
                }
            }
            state.emitChunk(space + marks, node);
        } finally {
            state.singleLineContext().pop();
        }
    }
}
