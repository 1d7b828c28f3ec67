package work.lcod.html2wt.handlers;

import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.html.AttributeSerializer;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Wiki table markup: table open and close, row, data cell, header cell and caption lines.
 */
public final class TableHandlers {
    private TableHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        var justChildren = NodeHandler.builder((node, state, wrapperUnmodified) -> state.serializeChildren(node)).build();
        registry.register(HandlerKey.TABLE, NodeHandler.builder(TableHandlers::emitTable)
            .before((node, other, state) -> node.parent() == other && DomUtils.hasName(other, "dd")
                ? NewlineConstraint.of(0, 2)
                : NewlineConstraint.of(1, 2))
            .after((node, other, state) -> DomUtils.isNewElt(node) || DomUtils.isNewElt(other)
                ? NewlineConstraint.of(1, 2)
                : NewlineConstraint.of(0, 2))
            .firstChild(1, 2)
            .lastChild(1, 2)
            .build());
        registry.register(HandlerKey.TBODY, justChildren);
        registry.register(HandlerKey.THEAD, justChildren);
        registry.register(HandlerKey.TFOOT, justChildren);
        registry.register(HandlerKey.TR, NodeHandler.builder(TableHandlers::emitRow)
            .before((node, other, state) -> DomUtils.previousNonDeletedSibling(node) == null
                && ((Element) node).dataParsoid().startTagSrc() == null
                ? NewlineConstraint.of(0, 2)
                : NewlineConstraint.of(1, 2))
            .after(0, 2)
            .build());
        registry.register(HandlerKey.TH, NodeHandler.builder((node, state, wrapperUnmodified) -> emitCell(node, state, wrapperUnmodified, "!", "!!"))
            .before((node, other, state) -> DomUtils.hasName(other, "th") && isRowSyntax(node)
                ? NewlineConstraint.of(0, 2)
                : NewlineConstraint.of(1, 2))
            .after((node, other, state) -> DomUtils.hasName(other, "td")
                ? NewlineConstraint.of(1, 2)
                : NewlineConstraint.of(0, 2))
            .build());
        registry.register(HandlerKey.TD, NodeHandler.builder((node, state, wrapperUnmodified) -> emitCell(node, state, wrapperUnmodified, "|", "||"))
            .before((node, other, state) -> DomUtils.hasName(other, "td") && isRowSyntax(node)
                ? NewlineConstraint.of(0, 2)
                : NewlineConstraint.of(1, 2))
            .after(0, 2)
            .build());
        registry.register(HandlerKey.CAPTION, NodeHandler.builder(TableHandlers::emitCaption)
            .before((node, other, state) -> DomUtils.hasName(other, "table")
                ? NewlineConstraint.of(0, 2)
                : NewlineConstraint.of(1, 2))
            .after(1, 2)
            .build());
        return registry;
    }

    private static void emitTable(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        var open = dp.startTagSrc() != null ? dp.startTagSrc() : "{|";
        boolean indented = DomUtils.hasName(node.parent(), "dd") && DomUtils.previousNonSepSibling(node) == null;
        if (indented) {
            state.singleLineContext().disable();
        }
        try {
            state.emitChunk(tableTag(open, "", state, node, wrapperUnmodified), node);
            boolean wikiTable = !DomUtils.isLiteralHtmlNode(node);
            if (wikiTable) {
                state.enterWikiTable();
            }
            try {
                state.serializeChildren(node);
            } finally {
                if (wikiTable) {
                    state.exitWikiTable();
                }
            }
            // A table without element children never records a last-child constraint.
            if (!state.separator().hasConstraint()) {
                state.separator().merge(NewlineConstraint.of(1, 2), node, node);
            }
            state.emitEndTag(dp.endTagSrc() != null ? dp.endTagSrc() : "|}", node);
        } finally {
            if (indented) {
                state.singleLineContext().pop();
            }
        }
    }

    private static void emitRow(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        if (DomUtils.previousNonSepSibling(node) != null
            || dp.startTagSrc() != null
            || !AttributeSerializer.serialize(node).isEmpty()) {
            var open = dp.startTagSrc() != null ? dp.startTagSrc() : "|-";
            state.emitStartTag(tableTag(open, "", state, node, wrapperUnmodified), node);
        }
        state.serializeChildren(node);
    }

    private static void emitCell(
        Element node,
        SerializerState state,
        boolean wrapperUnmodified,
        String blockSymbol,
        String rowSymbol
    ) {
        var dp = node.dataParsoid();
        boolean usable = cellSyntaxTrusted(node);
        var startTagSrc = usable ? dp.startTagSrc() : null;
        var attrSepSrc = usable ? dp.attrSepSrc() : null;
        var symbol = usable && isRowSyntax(node) ? rowSymbol : blockSymbol;
        var tag = tableTag(
            startTagSrc == null || startTagSrc.isEmpty() ? symbol : startTagSrc,
            attrSepSrc == null || attrSepSrc.isEmpty() ? null : attrSepSrc,
            state,
            node,
            wrapperUnmodified
        );
        state.emitStartTag(tag, node);
        state.serializeChildren(node, WikitextEscapes.tableCell(node, tag.length() > 1));
    }

    private static void emitCaption(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        var open = dp.startTagSrc() != null ? dp.startTagSrc() : "|+";
        state.emitStartTag(tableTag(open, null, state, node, wrapperUnmodified), node);
        state.serializeChildren(node);
    }

    private static boolean isRowSyntax(Node node) {
        return node instanceof Element element && "row".equals(element.dataParsoid().stxV());
    }

    /**
     * Row-syntax provenance is stale unless the previous sibling is a cell of the same kind.
     */
    static boolean cellSyntaxTrusted(Element node) {
        if (node.dataParsoid().stxV() == null) {
            return true;
        }
        var prev = DomUtils.previousNonDeletedSibling(node);
        return prev instanceof Element element && element.name().equals(node.name());
    }

    static String tableTag(
        String symbol,
        String endSymbol,
        SerializerState state,
        Element node,
        boolean wrapperUnmodified
    ) {
        if (wrapperUnmodified) {
            var dsr = node.dataParsoid().dsr();
            return state.originalSource(dsr.start(), dsr.start() + dsr.openWidth());
        }
        return tableElement(symbol, endSymbol, node);
    }

    /**
     * Table markup followed by the serialized attributes. {@code endSymbol} closes the attribute list
     * ({@code " |"} when null); an empty {@code endSymbol} means the attributes end the line.
     */
    static String tableElement(String symbol, String endSymbol, Element node) {
        var attributes = AttributeSerializer.serialize(node);
        if (!attributes.isEmpty()) {
            return symbol + " " + attributes + (endSymbol != null ? endSymbol : " |");
        }
        return symbol + (endSymbol == null ? "" : endSymbol);
    }
}
