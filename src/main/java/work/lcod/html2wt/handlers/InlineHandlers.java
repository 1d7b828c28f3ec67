package work.lcod.html2wt.handlers;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.html.AttributeSerializer;
import work.lcod.html2wt.html.HtmlElementHandler;
import work.lcod.html2wt.html.HtmlTagSerializer;
import work.lcod.html2wt.runtime.SerializerState;

/**
 * Generated-content {@code <span>} wrappers: nowiki, entities, placeholders and misnesting markers.
 */
public final class InlineHandlers {
    private static final Set<String> GENERATED_CONTENT_TYPES = Set.of(
        "mw:Nowiki",
        "mw:Image",
        "mw:Image/Frameless",
        "mw:Image/Frame",
        "mw:Image/Thumb",
        "mw:Entity",
        "mw:DiffMarker",
        "mw:Placeholder"
    );
    private static final Pattern NOWIKI_TAG = Pattern.compile("<(/?nowiki\\s*/?\\s*)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE = Pattern.compile("(?:^|\\s)mw:Image(/(Frame|Frameless|Thumb))?");
    private static final Pattern ENTITY = Pattern.compile("(?:^|\\s)mw:Entity");
    private static final Pattern PLACEHOLDER = Pattern.compile("(^|\\s)mw:Placeholder(/\\w*)?");
    private static final Pattern NBSP_RUN = Pattern.compile("\\u00a0+");

    private InlineHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.SPAN, NodeHandler.builder(InlineHandlers::emitSpan).build());
        return registry;
    }

    private static void emitSpan(Element node, SerializerState state, boolean wrapperUnmodified) {
        var type = node.typeOf();
        if (!isGeneratedContentWrapper(type)) {
            var dp = node.dataParsoid();
            if (!state.rtTestMode() && dp.misnested() && !dp.isLiteralHtml() && AttributeSerializer.serialize(node).isEmpty()) {
                // Wrapper only flags misnested content; selser would normally have reused the source.
                state.diagnostics().log("warn", "Serializing misnested content:", node);
                state.serializeChildren(node);
            } else {
                HtmlElementHandler.emit(node, state, wrapperUnmodified);
            }
            return;
        }
        if (type.equals("mw:Nowiki")) {
            emitNowiki(node, state);
        } else if (IMAGE.matcher(type).find()) {
            // Media is kept as plain HTML.
            HtmlElementHandler.emit(node, state, wrapperUnmodified);
        } else if (ENTITY.matcher(type).find() && node.children().size() == 1) {
            if (node.firstChild() instanceof Text text) {
                state.emitChunk(entityEncodeAll(text.value()), text);
            } else {
                state.serializeChildren(node);
            }
        } else if (PLACEHOLDER.matcher(type).find()) {
            if (node.children().size() == 1
                && node.firstChild() instanceof Text text
                && NBSP_RUN.matcher(text.value()).find()) {
                state.emitChunk(" ".repeat(text.value().length()), text);
            } else {
                HtmlElementHandler.emit(node, state, wrapperUnmodified);
            }
        }
    }

    private static void emitNowiki(Element node, SerializerState state) {
        state.emitChunk("<nowiki>", node);
        for (var child : node.children()) {
            if (child instanceof Element element) {
                if (DomUtils.isMarkerMeta(element, "mw:DiffMarker")) {
                    continue;
                }
                if (element.name().equals("span") && element.typeOf().equals("mw:Entity")) {
                    state.serializeNode(element);
                } else {
                    state.emitChunk(HtmlTagSerializer.outerHtml(element), node);
                }
            } else if (child instanceof Text text) {
                state.emitChunk(escapeNowikiTags(text.value()), text);
            } else {
                state.serializeNode(child);
            }
        }
        state.emitEndTag("</nowiki>", node);
    }

    static boolean isGeneratedContentWrapper(String type) {
        if (type == null || type.isEmpty()) {
            return false;
        }
        for (var token : type.split("\\s+")) {
            if (GENERATED_CONTENT_TYPES.contains(token)) {
                return true;
            }
        }
        return false;
    }

    static String escapeNowikiTags(String text) {
        return NOWIKI_TAG.matcher(text).replaceAll("&lt;$1&gt;");
    }

    /**
     * Encodes every code point as a hexadecimal character reference; non-breaking spaces use
     * {@code &nbsp;}.
     */
    static String entityEncodeAll(String text) {
        var out = new StringBuilder();
        text.codePoints().forEach(codePoint -> {
            var hex = Integer.toHexString(codePoint).toUpperCase(Locale.ROOT);
            if (hex.length() == 1) {
                hex = "0" + hex;
            }
            if (hex.equals("A0")) {
                out.append("&nbsp;");
            } else {
                out.append("&#x").append(hex).append(';');
            }
        });
        return out.toString();
    }
}
