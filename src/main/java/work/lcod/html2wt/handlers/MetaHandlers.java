package work.lcod.html2wt.handlers;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.html.HtmlElementHandler;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Page properties, behavior switches and include markers carried by {@code <meta>}.
 */
public final class MetaHandlers {
    private static final Pattern PAGE_PROP = Pattern.compile("^mw:PageProp/(.*)$");
    private static final Pattern SOURCE_PREFIX = Pattern.compile("^([^:]+:)(.*)$");
    private static final Pattern PLACEHOLDER = Pattern.compile("(^|\\s)mw:Placeholder(/|$)");
    private static final Set<String> MAGIC_MASQUERADES = Set.of("defaultsort", "displaytitle");

    private MetaHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.META, NodeHandler.builder(MetaHandlers::emit)
            .before((node, other, state) -> {
                var element = (Element) node;
                var type = element.typeOf().isEmpty() ? element.attr("property") : element.typeOf();
                if (type != null && type.contains("mw:PageProp/categorydefaultsort")) {
                    // Outside the paragraph it has to sit on a line of its own.
                    return DomUtils.hasName(other, "p") && !DomUtils.isLiteralHtmlNode(other)
                        ? NewlineConstraint.atLeast(2)
                        : NewlineConstraint.atLeast(1);
                }
                return ownLine(element);
            })
            .after((node, other, state) -> ownLine((Element) node))
            .build());
        return registry;
    }

    private static NewlineConstraint ownLine(Element node) {
        if (DomUtils.isNewElt(node) && !PLACEHOLDER.matcher(node.typeOf()).find()) {
            return NewlineConstraint.atLeast(1);
        }
        return NewlineConstraint.NONE;
    }

    private static void emit(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        var property = node.attr("property");
        // Property first, so page properties with templated values round-trip.
        if (property != null && !property.isEmpty()) {
            var switchType = PAGE_PROP.matcher(property);
            if (!switchType.matches()) {
                HtmlElementHandler.emit(node, state, wrapperUnmodified);
                return;
            }
            var name = switchType.group(1).replaceFirst("^(?:category)?", "");
            String out;
            if (MAGIC_MASQUERADES.contains(name)) {
                var content = node.attr("content") == null ? "" : node.attr("content");
                if (dp.src() != null) {
                    out = SOURCE_PREFIX.matcher(dp.src()).replaceFirst("$1" + Matcher.quoteReplacement(content) + "}}");
                } else {
                    var magicWord = name.toUpperCase(Locale.ROOT);
                    state.diagnostics().log("warn", name, "is missing source. Rendering as", magicWord, "magicword");
                    out = "{{" + magicWord + ":" + content + "}}";
                }
            } else {
                out = behaviorSwitch(switchType.group(1), dp.magicSrc());
            }
            state.emitChunk(out, node);
            return;
        }
        var type = node.typeOf();
        switch (type) {
            case "mw:Includes/IncludeOnly" -> state.emitChunk(dp.src() == null ? "<includeonly>" : dp.src(), node);
            case "mw:Includes/IncludeOnly/End" -> {
                // The closing tag travels with the opening marker's source.
            }
            case "mw:Includes/NoInclude" -> state.emitChunk(dp.src() == null ? "<noinclude>" : dp.src(), node);
            case "mw:Includes/NoInclude/End" -> state.emitChunk(dp.src() == null ? "</noinclude>" : dp.src(), node);
            case "mw:Includes/OnlyInclude" -> state.emitChunk(dp.src() == null ? "<onlyinclude>" : dp.src(), node);
            case "mw:Includes/OnlyInclude/End" -> state.emitChunk(dp.src() == null ? "</onlyinclude>" : dp.src(), node);
            case "mw:DiffMarker", "mw:Separator" -> {
                // nothing to emit
            }
            default -> HtmlElementHandler.emit(node, state, wrapperUnmodified);
        }
    }

    /**
     * Wikitext of a behavior switch: the recorded source spelling, else the canonical
     * {@code __NAME__} form.
     */
    static String behaviorSwitch(String name, String magicSrc) {
        if (magicSrc != null && !magicSrc.isEmpty()) {
            return magicSrc;
        }
        return "__" + name.toUpperCase(Locale.ROOT) + "__";
    }
}
