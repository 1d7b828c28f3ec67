package work.lcod.html2wt.encap;

import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.handlers.HandlerKey;
import work.lcod.html2wt.handlers.HandlerRegistry;
import work.lcod.html2wt.handlers.NodeHandler;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Handlers for templated content and for nodes that round-trip their recorded source.
 */
public final class EncapsulationHandlers {
    private static final Pattern REFERENCES = Pattern.compile("(?:^|\\s)mw:Extension/references(?=$|\\s)");
    private static final Pattern TRANSCLUSION = Pattern.compile("(?:^|\\s)mw:Transclusion(?=$|\\s)");
    private static final Pattern NEWLINES_ONLY = Pattern.compile("^\\n+$");

    private EncapsulationHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.ENCAPSULATION, NodeHandler.builder(EncapsulationHandlers::emitEncapsulated)
            .before((node, other, state) -> {
                var typeOf = ((Element) node).typeOf();
                // New references lists go on their own line.
                if (DomUtils.isNewElt(node) && REFERENCES.matcher(typeOf).find() && !TRANSCLUSION.matcher(typeOf).find()) {
                    return NewlineConstraint.of(1, 2);
                }
                return NewlineConstraint.of(0, 2);
            })
            .build());
        registry.register(HandlerKey.SOURCE_PASSTHROUGH, NodeHandler.builder(EncapsulationHandlers::emitSource).build());
        registry.register(HandlerKey.ENTITY_SOURCE, NodeHandler.builder(EncapsulationHandlers::emitEntity).build());
        return registry;
    }

    private static void emitEncapsulated(Element node, SerializerState state, boolean wrapperUnmodified) {
        var wikitext = EncapsulationReconstructor.reconstruct(node, state);
        state.singleLineContext().disable();
        try {
            state.emitChunk(wikitext, node);
        } finally {
            state.singleLineContext().pop();
        }
    }

    private static void emitSource(Element node, SerializerState state, boolean wrapperUnmodified) {
        var src = node.dataParsoid().src();
        if (NEWLINES_ONLY.matcher(src).matches()) {
            state.appendSeparatorSource(src);
        } else {
            state.emitChunk(src, node);
        }
    }

    private static void emitEntity(Element node, SerializerState state, boolean wrapperUnmodified) {
        var dp = node.dataParsoid();
        var content = node.textContent();
        state.emitChunk(content.equals(dp.srcContent()) ? dp.src() : content, node);
    }
}
