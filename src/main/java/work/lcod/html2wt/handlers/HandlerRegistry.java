package work.lcod.html2wt.handlers;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.encap.EncapsulationHandlers;
import work.lcod.html2wt.html.HtmlElementHandler;

/**
 * Maps every {@link HandlerKey} to its {@link NodeHandler}.
 */
public final class HandlerRegistry {
    private final Map<HandlerKey, NodeHandler> handlers = new EnumMap<>(HandlerKey.class);

    public HandlerRegistry register(HandlerKey key, NodeHandler handler) {
        handlers.put(key, handler);
        return this;
    }

    public NodeHandler get(HandlerKey key) {
        var handler = handlers.get(key);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + key);
        }
        return handler;
    }

    public NodeHandler handlerFor(Node node) {
        return get(HandlerKey.resolve(node));
    }

    public Set<HandlerKey> missingKeys() {
        var missing = EnumSet.allOf(HandlerKey.class);
        missing.removeAll(handlers.keySet());
        return missing;
    }

    public Map<HandlerKey, NodeHandler> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Registry holding every handler group; fails when a key is left without a handler.
     */
    public static HandlerRegistry create() {
        var registry = new HandlerRegistry();
        registry.register(HandlerKey.TEXT, NodeHandler.NO_OP);
        registry.register(HandlerKey.COMMENT, NodeHandler.NO_OP);
        registry.register(HandlerKey.DIFF_MARKER, NodeHandler.NO_OP);
        ListHandlers.register(registry);
        TableHandlers.register(registry);
        HeadingHandlers.register(registry);
        QuoteHandlers.register(registry);
        PreHandlers.register(registry);
        ParagraphHandlers.register(registry);
        MetaHandlers.register(registry);
        InlineHandlers.register(registry);
        LinkHandlers.register(registry);
        EncapsulationHandlers.register(registry);
        HtmlElementHandler.register(registry);
        var missing = registry.missingKeys();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Handler registry is incomplete, missing: " + missing);
        }
        return registry;
    }
}
