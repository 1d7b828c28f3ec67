package work.lcod.html2wt.handlers;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.Comment;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;

/**
 * Closed set of handler slots: element kind, refined by syntax variant where the markup differs.
 */
public enum HandlerKey {
    B("b", null),
    I("i", null),
    UL("ul", null),
    OL("ol", null),
    DL("dl", null),
    LI("li", null),
    DT("dt", null),
    DD("dd", null),
    DD_ROW("dd", "row"),
    TABLE("table", null),
    TBODY("tbody", null),
    THEAD("thead", null),
    TFOOT("tfoot", null),
    TR("tr", null),
    TH("th", null),
    TD("td", null),
    CAPTION("caption", null),
    P("p", null),
    PRE("pre", null),
    PRE_HTML("pre", "html"),
    META("meta", null),
    SPAN("span", null),
    A("a", null),
    LINK("link", null),
    HR("hr", null),
    H1("h1", null),
    H2("h2", null),
    H3("h3", null),
    H4("h4", null),
    H5("h5", null),
    H6("h6", null),
    BR("br", null),
    BODY("body", null),
    /** First node of a transclusion, extension or parameter range. */
    ENCAPSULATION(null, null),
    /** Placeholders and unedited nowikis that round-trip their recorded source. */
    SOURCE_PASSTHROUGH(null, null),
    /** Entities with recorded source. */
    ENTITY_SOURCE(null, null),
    DIFF_MARKER(null, null),
    /** Generic element fallback. */
    HTML_ELEMENT(null, null),
    TEXT(null, null),
    COMMENT(null, null);

    private static final Pattern PLACEHOLDER = Pattern.compile("(^|\\s)mw:Placeholder(/\\w*)?$");
    private static final Map<String, HandlerKey> BY_TAG = new HashMap<>();
    private static final Map<String, HandlerKey> BY_VARIANT = new HashMap<>();

    static {
        for (var key : values()) {
            if (key.tag == null) {
                continue;
            }
            if (key.variant == null) {
                BY_TAG.put(key.tag, key);
            } else {
                BY_VARIANT.put(key.tag + "_" + key.variant, key);
            }
        }
    }

    private final String tag;
    private final String variant;

    HandlerKey(String tag, String variant) {
        this.tag = tag;
        this.variant = variant;
    }

    public String tag() {
        return tag;
    }

    public String variant() {
        return variant;
    }

    public boolean skipsEncapsulatedRange() {
        return this == ENCAPSULATION;
    }

    public static HandlerKey resolve(Node node) {
        if (node instanceof Text) {
            return TEXT;
        }
        if (node instanceof Comment) {
            return COMMENT;
        }
        var element = (Element) node;
        if (DomUtils.isFirstEncapsulationWrapperNode(element)) {
            return ENCAPSULATION;
        }
        var dp = element.dataParsoid();
        var typeOf = element.typeOf();
        if (dp.src() != null) {
            if (PLACEHOLDER.matcher(typeOf).find()
                || (typeOf.equals("mw:Nowiki") && element.textContent().equals(dp.src()))) {
                return SOURCE_PASSTHROUGH;
            }
            if (typeOf.equals("mw:Entity") && element.children().size() == 1) {
                return ENTITY_SOURCE;
            }
        }
        if (DomUtils.isDiffMarker(element)) {
            return DIFF_MARKER;
        }
        if (dp.stx() != null) {
            var specialized = BY_VARIANT.get(element.name() + "_" + dp.stx());
            if (specialized != null) {
                return specialized;
            }
        }
        if (dp.isLiteralHtml()) {
            return HTML_ELEMENT;
        }
        return BY_TAG.getOrDefault(element.name(), HTML_ELEMENT);
    }
}
