package work.lcod.html2wt.handlers;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.html.HtmlElementHandler;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Wiki links, external links, category links and redirects.
 */
public final class LinkHandlers {
    private static final Pattern WIKI_LINK = Pattern.compile("(?:^|\\s)mw:WikiLink(?=$|\\s)");
    private static final Pattern EXT_LINK = Pattern.compile("(?:^|\\s)mw:ExtLink(?=$|\\s)");
    private static final Pattern CATEGORY = Pattern.compile("(?:^|\\s)mw:PageProp/Category(?=$|\\s)");
    private static final Pattern REDIRECT = Pattern.compile("(?:^|\\s)mw:PageProp/redirect(?=$|\\s)");

    private LinkHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.A, NodeHandler.builder(LinkHandlers::emitAnchor).build());
        NodeHandler.SeparatorRule ownLine = (node, other, state) ->
            DomUtils.isSolTransparentLink(node) && DomUtils.isNewElt(node) && !DomUtils.isBody(other)
                ? NewlineConstraint.atLeast(1)
                : NewlineConstraint.NONE;
        registry.register(HandlerKey.LINK, NodeHandler.builder(LinkHandlers::emitLink)
            .before(ownLine)
            .after(ownLine)
            .build());
        return registry;
    }

    private static void emitAnchor(Element node, SerializerState state, boolean wrapperUnmodified) {
        var rel = node.attr("rel") == null ? "" : node.attr("rel");
        var href = node.attr("href");
        if (href != null && WIKI_LINK.matcher(rel).find()) {
            var target = linkTarget(node, href);
            var plain = plainContent(node, target);
            if (plain != null) {
                state.emitChunk("[[" + plain + "]]", node);
            } else {
                state.emitChunk("[[" + target + "|", node);
                state.serializeChildren(node);
                state.emitChunk("]]", node);
            }
        } else if (href != null && EXT_LINK.matcher(rel).find()) {
            var url = sourceValue(node, "href", href);
            if ("url".equals(node.dataParsoid().stx()) || url.equals(plainContent(node, url))) {
                state.emitChunk(url, node);
            } else if (node.children().isEmpty()) {
                state.emitChunk("[" + url + "]", node);
            } else {
                state.emitChunk("[" + url + " ", node);
                state.serializeChildren(node);
                state.emitChunk("]", node);
            }
        } else {
            HtmlElementHandler.emit(node, state, wrapperUnmodified);
        }
    }

    private static void emitLink(Element node, SerializerState state, boolean wrapperUnmodified) {
        var rel = node.attr("rel") == null ? "" : node.attr("rel");
        var href = node.attr("href");
        if (href != null && CATEGORY.matcher(rel).find()) {
            var target = linkTarget(node, href);
            var hash = target.indexOf('#');
            if (hash >= 0) {
                var sortKey = target.substring(hash + 1);
                target = target.substring(0, hash);
                state.emitChunk("[[" + target + "|" + sortKey + "]]", node);
            } else {
                state.emitChunk("[[" + target + "]]", node);
            }
        } else if (href != null && REDIRECT.matcher(rel).find()) {
            var src = node.dataParsoid().src();
            var prefix = src == null ? "#REDIRECT " : src;
            state.emitChunk(prefix + "[[" + linkTarget(node, href) + "]]", node);
        } else {
            HtmlElementHandler.emit(node, state, wrapperUnmodified);
        }
    }

    /**
     * Link target in wikitext form: the recorded source when the href is unchanged, else the href
     * without its {@code ./} prefix, percent-decoded, underscores read as spaces.
     */
    static String linkTarget(Element node, String href) {
        var recorded = node.dataParsoid().sa().get("href");
        if (recorded != null && href.equals(node.dataParsoid().a().get("href"))) {
            return recorded;
        }
        var target = href.startsWith("./") ? href.substring(2) : href;
        target = URLDecoder.decode(target.replace("+", "%2B"), StandardCharsets.UTF_8);
        return target.replace('_', ' ');
    }

    private static String sourceValue(Element node, String key, String value) {
        var recorded = node.dataParsoid().sa().get(key);
        if (recorded != null && value.equals(node.dataParsoid().a().get(key))) {
            return recorded;
        }
        return value;
    }

    /**
     * The link text when it can stand in for the target itself, else {@code null}.
     */
    private static String plainContent(Node node, String target) {
        var element = (Element) node;
        if (element.children().size() != 1 || !(element.firstChild() instanceof Text text)) {
            return null;
        }
        var content = text.value();
        if (content.equals(target)) {
            return content;
        }
        // The first letter of a page title is case-insensitive.
        boolean sameTitle = !content.isEmpty() && !target.isEmpty()
            && content.substring(1).equals(target.substring(1))
            && Character.toUpperCase(content.charAt(0)) == Character.toUpperCase(target.charAt(0));
        return sameTitle ? content : null;
    }
}
