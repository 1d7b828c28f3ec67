package work.lcod.html2wt.dom;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Node classification predicates and sibling navigation used by the serializer.
 */
public final class DomUtils {
    private static final Pattern ENCAPSULATION_TYPE =
        Pattern.compile("(?:^|\\s)mw:(?:Transclusion|Param|LanguageVariant|Extension/\\S+)(?=$|\\s)");
    private static final Pattern SOL_TRANSPARENT_LINK_REL =
        Pattern.compile("(?:^|\\s)mw:PageProp/(?:Category|redirect|Language)(?=$|\\s)");
    private static final Pattern PAGE_PROP = Pattern.compile("^mw:PageProp/.*");
    private static final Pattern WHITESPACE = Pattern.compile("^\\s*$");

    private static final Set<String> LISTS = Set.of("ul", "ol", "dl");
    private static final Set<String> LIST_ITEMS = Set.of("li", "dt", "dd");
    private static final Set<String> QUOTES = Set.of("i", "b");
    private static final Set<String> BLOCK_TAGS = Set.of(
        "address", "article", "aside", "blockquote", "body", "caption", "center", "dd", "details", "dialog",
        "dir", "div", "dl", "dt", "fieldset", "figcaption", "figure", "footer", "form", "h1", "h2", "h3",
        "h4", "h5", "h6", "header", "hgroup", "hr", "li", "main", "nav", "ol", "p", "pre", "section",
        "table", "tbody", "td", "tfoot", "th", "thead", "tr", "ul"
    );
    private static final Set<String> ZERO_WIDTH_WIKITEXT_TAGS = Set.of("p", "meta", "link");
    private static final Set<String> TAGS_REQUIRING_SOL = Set.of(
        "pre", "h1", "h2", "h3", "h4", "h5", "h6", "hr", "ul", "ol", "dl", "li", "dt", "dd", "table",
        "tr", "caption"
    );

    private DomUtils() {}

    public static boolean isElement(Node node) {
        return node instanceof Element;
    }

    public static boolean isText(Node node) {
        return node instanceof Text;
    }

    public static boolean isComment(Node node) {
        return node instanceof Comment;
    }

    public static boolean isBody(Node node) {
        return node instanceof Element element && element.name().equals("body");
    }

    public static boolean hasName(Node node, String name) {
        return node instanceof Element element && element.name().equals(name);
    }

    public static boolean hasAncestor(Node node, String name) {
        for (var parent = node.parent(); parent != null; parent = parent.parent()) {
            if (parent.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isList(Node node) {
        return node instanceof Element element && LISTS.contains(element.name());
    }

    public static boolean isListItem(Node node) {
        return node instanceof Element element && LIST_ITEMS.contains(element.name());
    }

    public static boolean isListOrListItem(Node node) {
        return isList(node) || isListItem(node);
    }

    public static boolean isQuoteElt(Node node) {
        return node instanceof Element element && QUOTES.contains(element.name());
    }

    public static boolean isBlockNode(Node node) {
        return node instanceof Element element && BLOCK_TAGS.contains(element.name());
    }

    public static boolean isZeroWidthWikitextElt(Node node) {
        return node instanceof Element element
            && ZERO_WIDTH_WIKITEXT_TAGS.contains(element.name())
            && !isLiteralHtmlNode(element);
    }

    public static boolean isBlockNodeWithVisibleWikitext(Node node) {
        return isBlockNode(node) && !isZeroWidthWikitextElt(node);
    }

    public static boolean requiresStartOfLine(Node node) {
        return node instanceof Element element && TAGS_REQUIRING_SOL.contains(element.name());
    }

    public static boolean isLiteralHtmlNode(Node node) {
        return node instanceof Element element && element.dataParsoid().isLiteralHtml();
    }

    /**
     * True for elements inserted by an editor. The root is never new.
     */
    public static boolean isNewElt(Node node) {
        if (!(node instanceof Element element) || element.parent() == null) {
            return false;
        }
        return element.dataParsoid().isNew() || element.diffMarks().contains(DiffMark.INSERTED);
    }

    public static boolean hasDiffMarkers(Element element) {
        return !element.diffMarks().isEmpty();
    }

    /**
     * True when only the content below the element changed, not its own tag.
     */
    public static boolean onlySubtreeChanged(Element element) {
        for (DiffMark mark : element.diffMarks()) {
            if (mark != DiffMark.SUBTREE_CHANGED && mark != DiffMark.CHILDREN_CHANGED) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the opening and closing tags of the element can be copied from the original source.
     */
    public static boolean wrapperUnmodified(Element element) {
        return !isNewElt(element)
            && onlySubtreeChanged(element)
            && element.dataParsoid().dsr() != null
            && element.dataParsoid().dsr().hasValidTagWidths();
    }

    public static boolean isIEW(Node node) {
        return node instanceof Text text && WHITESPACE.matcher(text.value()).matches();
    }

    /**
     * Inter-element whitespace or a comment.
     */
    public static boolean isSeparator(Node node) {
        return isIEW(node) || isComment(node);
    }

    public static boolean isMarkerMeta(Node node, String type) {
        return node instanceof Element element && element.name().equals("meta") && element.hasTypeOf(type);
    }

    public static boolean isDiffMarker(Node node) {
        return node instanceof Element element
            && element.name().equals("meta")
            && element.typeOf().startsWith("mw:DiffMarker");
    }

    public static boolean isFirstEncapsulationWrapperNode(Node node) {
        return node instanceof Element element && ENCAPSULATION_TYPE.matcher(element.typeOf()).find();
    }

    public static boolean isTplOrExtToplevelNode(Node node) {
        if (isFirstEncapsulationWrapperNode(node)) {
            return true;
        }
        return node instanceof Element element
            && element.about() != null
            && element.about().startsWith("#mwt");
    }

    public static boolean isSolTransparentLink(Node node) {
        if (!(node instanceof Element element) || !element.name().equals("link")) {
            return false;
        }
        var rel = element.attr("rel");
        return rel != null && SOL_TRANSPARENT_LINK_REL.matcher(rel).find();
    }

    public static boolean isBehaviorSwitch(Node node) {
        if (!(node instanceof Element element) || !element.name().equals("meta")) {
            return false;
        }
        var property = element.attr("property");
        return property != null && PAGE_PROP.matcher(property).matches();
    }

    /**
     * True when the node serializes to wikitext that never changes start-of-line state: plain spaces,
     * comments, category links and behavior switches.
     */
    public static boolean emitsSolTransparentSingleLineWikitext(Node node) {
        if (node instanceof Text text) {
            return text.value().chars().allMatch(ch -> ch == ' ' || ch == '\t');
        }
        if (node instanceof Comment) {
            return true;
        }
        return isSolTransparentLink(node) || isBehaviorSwitch(node);
    }

    public static boolean atTheTop(Node node) {
        return node == null || node.parent() == null || isBody(node);
    }

    public static boolean isAncestorOf(Node ancestor, Node node) {
        if (ancestor == null || node == null) {
            return false;
        }
        Node current = node.parent();
        while (current != null) {
            if (current == ancestor) {
                return true;
            }
            current = current.parent();
        }
        return false;
    }

    public static Node previousNonSepSibling(Node node) {
        Node prev = node.previousSibling();
        while (prev != null && isSeparator(prev)) {
            prev = prev.previousSibling();
        }
        return prev;
    }

    public static Node nextNonSepSibling(Node node) {
        Node next = node.nextSibling();
        while (next != null && isSeparator(next)) {
            next = next.nextSibling();
        }
        return next;
    }

    public static Node previousNonDeletedSibling(Node node) {
        Node prev = node.previousSibling();
        while (prev != null && isDiffMarker(prev)) {
            prev = prev.previousSibling();
        }
        return prev;
    }

    public static Node nextNonDeletedSibling(Node node) {
        Node next = node.nextSibling();
        while (next != null && isDiffMarker(next)) {
            next = next.nextSibling();
        }
        return next;
    }

    public static Node firstNonSepChildNode(Node node) {
        if (!(node instanceof Element element)) {
            return null;
        }
        Node child = element.firstChild();
        while (child != null && isSeparator(child)) {
            child = child.nextSibling();
        }
        return child;
    }

    public static Node firstNonDeletedChildNode(Node node) {
        if (!(node instanceof Element element)) {
            return null;
        }
        Node child = element.firstChild();
        while (child != null && isDiffMarker(child)) {
            child = child.nextSibling();
        }
        return child;
    }

    public static Node lastNonDeletedChildNode(Node node) {
        if (!(node instanceof Element element)) {
            return null;
        }
        Node child = element.lastChild();
        while (child != null && isDiffMarker(child)) {
            child = child.previousSibling();
        }
        return child;
    }

    /**
     * Returns the node that follows the encapsulation range started by {@code node}: every following
     * sibling that shares its {@code about} id, with interstitial whitespace and comments in between.
     */
    public static Node skipOverEncapsulatedContent(Node node) {
        if (!(node instanceof Element element) || element.about() == null) {
            return node.nextSibling();
        }
        var about = element.about();
        Node last = node;
        Node next = node.nextSibling();
        while (next != null) {
            if (next instanceof Element sibling && about.equals(sibling.about())) {
                last = next;
            } else if (!isSeparator(next)) {
                break;
            }
            next = next.nextSibling();
        }
        return last.nextSibling();
    }
}
