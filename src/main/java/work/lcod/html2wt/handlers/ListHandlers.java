package work.lcod.html2wt.handlers;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.LiteralPart;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Bullet lists, numbered lists and definition lists.
 */
public final class ListHandlers {
    private static final Map<String, String> PARENT_BULLETS = Map.of("ul", "*", "ol", "#");
    private static final Map<String, String> ITEM_BULLETS = Map.of(
        "ul", "",
        "ol", "",
        "dl", "",
        "li", "",
        "dt", ";",
        "dd", ":"
    );
    private static final Pattern SHARED_PREFIX = Pattern.compile("^[*#:;]{2,}$");
    private static final Pattern TRANSCLUSION = Pattern.compile("(?:^|\\s)mw:Transclusion(?=$|\\s)");
    private static final Pattern EXTENSION_OR_PARAM = Pattern.compile("(?:^|\\s)mw:(Extension|Param)");

    private ListHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.UL, listHandler(Set.of("li")));
        registry.register(HandlerKey.OL, listHandler(Set.of("li")));
        registry.register(HandlerKey.DL, listHandler(Set.of("dt", "dd")));
        registry.register(HandlerKey.LI, NodeHandler.builder(ListHandlers::emitItem)
            .forceStartOfLine()
            .before((node, other, state) -> {
                if ((other == node.parent() && (DomUtils.hasName(other, "ul") || DomUtils.hasName(other, "ol")))
                    || DomUtils.isLiteralHtmlNode(other)) {
                    return NewlineConstraint.NONE;
                }
                return NewlineConstraint.of(1, 2);
            })
            .after(ListHandlers::listEndOfLine)
            .firstChild(ListHandlers::itemFirstChild)
            .build());
        registry.register(HandlerKey.DT, NodeHandler.builder(ListHandlers::emitItem)
            .forceStartOfLine()
            .before(1, 2)
            .after((node, other, state) -> {
                if (other instanceof Element element && element.name().equals("dd")
                    && "row".equals(element.dataParsoid().stx())) {
                    return NewlineConstraint.of(0, 0);
                }
                return listEndOfLine(node, other, state);
            })
            .firstChild(ListHandlers::itemFirstChild)
            .build());
        registry.register(HandlerKey.DD, NodeHandler.builder(ListHandlers::emitItem)
            .forceStartOfLine()
            .before(1, 2)
            .after(ListHandlers::listEndOfLine)
            .firstChild(ListHandlers::itemFirstChild)
            .build());
        registry.register(HandlerKey.DD_ROW, NodeHandler.builder(ListHandlers::emitRowItem)
            .before(0, 0)
            .after(ListHandlers::listEndOfLine)
            .firstChild(ListHandlers::itemFirstChild)
            .build());
        return registry;
    }

    private static NodeHandler listHandler(Set<String> itemNames) {
        return NodeHandler.builder((node, state, wrapperUnmodified) -> {
                // Nested lists need their separators even inside a single-line item.
                state.singleLineContext().disable();
                try {
                    var first = DomUtils.firstNonSepChildNode(node);
                    while (first instanceof Element element && isBuilderInserted(element)) {
                        first = DomUtils.firstNonSepChildNode(element);
                    }
                    if (!(first instanceof Element element)
                        || !itemNames.contains(element.name())
                        || isTemplateListWithoutSharedPrefix(first)) {
                        state.emitChunk(listBullets(state, node), node);
                    }
                    state.serializeChildren(node, WikitextEscapes.listItem(node));
                } finally {
                    state.singleLineContext().pop();
                }
            })
            .forceStartOfLine()
            .before((node, other, state) -> {
                if (DomUtils.isBody(other)) {
                    return NewlineConstraint.of(0, 0);
                }
                if (other instanceof Text && DomUtils.isListItem(node.parent())) {
                    return NewlineConstraint.of(1, 1);
                }
                return NewlineConstraint.of(1, 2);
            })
            .after(ListHandlers::listEndOfLine)
            .build();
    }

    private static void emitItem(Element node, SerializerState state, boolean wrapperUnmodified) {
        var first = DomUtils.firstNonSepChildNode(node);
        if (!DomUtils.isList(first) || isTemplateListWithoutSharedPrefix(first)) {
            state.emitChunk(listBullets(state, node), node);
        }
        state.singleLineContext().enforce();
        try {
            state.serializeChildren(node, WikitextEscapes.listItem(node));
        } finally {
            state.singleLineContext().pop();
        }
    }

    private static void emitRowItem(Element node, SerializerState state, boolean wrapperUnmodified) {
        var first = DomUtils.firstNonSepChildNode(node);
        if (!DomUtils.isList(first) || isTemplateListWithoutSharedPrefix(first)) {
            state.emitChunk(":", node);
        }
        state.singleLineContext().enforce();
        try {
            state.serializeChildren(node, WikitextEscapes.listItem(node));
        } finally {
            state.singleLineContext().pop();
        }
    }

    private static NewlineConstraint itemFirstChild(Node node, Node other, SerializerState state) {
        return DomUtils.isList(other) ? NewlineConstraint.NONE : NewlineConstraint.of(0, 0);
    }

    private static boolean isBuilderInserted(Element element) {
        var dp = element.dataParsoid();
        return dp.autoInsertedStart() && dp.autoInsertedEnd();
    }

    /**
     * Bullet prefix of {@code node}, built from its list ancestry. New items get a trailing space unless
     * their content already starts with whitespace.
     */
    public static String listBullets(SerializerState state, Element node) {
        var space = "";
        if (DomUtils.isNewElt(node)) {
            var first = node.firstChild();
            if (first != null && !(first instanceof Text text && startsWithWhitespace(text.value()))) {
                space = " ";
            }
        }
        var bullets = new StringBuilder();
        Element current = node;
        while (current != null) {
            var name = current.name();
            var dp = current.dataParsoid();
            if (!dp.isLiteralHtml() && ITEM_BULLETS.containsKey(name)) {
                if (name.equals("li")) {
                    var list = current.parent();
                    while (list != null && !PARENT_BULLETS.containsKey(list.name())) {
                        list = list.parent();
                    }
                    if (list != null) {
                        bullets.insert(0, PARENT_BULLETS.get(list.name()));
                    } else {
                        state.diagnostics().log(
                            "error/html2wt",
                            "Input DOM is not well-formed.",
                            "Top-level <li> found that is not nested in <ol>/<ul>. LI-node:",
                            current
                        );
                    }
                } else {
                    bullets.insert(0, ITEM_BULLETS.get(name));
                }
            } else if (!dp.isLiteralHtml() || !dp.autoInsertedStart() || !dp.autoInsertedEnd()) {
                break;
            }
            current = current.parent();
        }
        return bullets.length() == 0 ? "" : bullets + space;
    }

    /**
     * True when {@code node} starts a template, extension or parameter range that did not receive the
     * bullets shared with its container, so the container must still emit them.
     */
    public static boolean isTemplateListWithoutSharedPrefix(Node node) {
        if (!DomUtils.isTplOrExtToplevelNode(node)) {
            return false;
        }
        var element = (Element) node;
        var typeOf = element.typeOf();
        if (TRANSCLUSION.matcher(typeOf).find()) {
            var parts = element.dataMw().parts();
            if (parts.isEmpty() || !(parts.get(0) instanceof LiteralPart literal)) {
                return true;
            }
            return !SHARED_PREFIX.matcher(literal.text()).matches();
        }
        return EXTENSION_OR_PARAM.matcher(typeOf).find();
    }

    /**
     * Separator after a list or list item.
     */
    static NewlineConstraint listEndOfLine(Node node, Node other, SerializerState state) {
        if (!(other instanceof Element otherElement)
            || DomUtils.isBody(other)
            || DomUtils.isFirstEncapsulationWrapperNode(other)) {
            return NewlineConstraint.of(0, 2);
        }
        var next = DomUtils.nextNonSepSibling(node);
        var dp = otherElement.dataParsoid();
        if ((next == other && dp.isLiteralHtml()) || dp.src() != null) {
            return NewlineConstraint.of(0, 2);
        }
        if (next == other && DomUtils.isListOrListItem(other)) {
            if (DomUtils.isList(node) && otherElement.name().equals(((Element) node).name())) {
                // Adjacent lists of the same type would merge.
                return NewlineConstraint.of(2, 2);
            }
            if (DomUtils.isListItem(node) || DomUtils.hasName(node.parent(), "li")
                || DomUtils.hasName(node.parent(), "dd")) {
                return NewlineConstraint.of(1, 1);
            }
            return NewlineConstraint.of(1, 2);
        }
        if (DomUtils.isList(other) || dp.isLiteralHtml()) {
            // Last child of the list: the list decides.
            return NewlineConstraint.NONE;
        }
        return NewlineConstraint.of(1, 2);
    }

    private static boolean startsWithWhitespace(String value) {
        return !value.isEmpty() && Character.isWhitespace(value.charAt(0));
    }
}
