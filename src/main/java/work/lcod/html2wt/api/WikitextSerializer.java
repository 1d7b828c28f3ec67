package work.lcod.html2wt.api;

import java.time.Instant;
import java.util.function.Supplier;
import work.lcod.html2wt.diag.Diagnostics;
import work.lcod.html2wt.dom.Document;
import work.lcod.html2wt.dom.HtmlDocumentLoader;
import work.lcod.html2wt.handlers.HandlerRegistry;
import work.lcod.html2wt.runtime.ChunkBuffer;
import work.lcod.html2wt.runtime.SerializationException;
import work.lcod.html2wt.runtime.SerializerState;

/**
 * Public entry point: turns an annotated document back into wikitext. Instances are reusable and may be
 * shared; every call builds its own state.
 */
public final class WikitextSerializer {
    private final HandlerRegistry registry;

    public WikitextSerializer() {
        this(HandlerRegistry.create());
    }

    public WikitextSerializer(HandlerRegistry registry) {
        this.registry = registry;
    }

    public SerializeResult serialize(Document document) {
        return serialize(document, SerializerOptions.defaults());
    }

    public SerializeResult serialize(Document document, SerializerOptions options) {
        return serialize(() -> document, options);
    }

    /**
     * Parses {@code html} and serializes it; {@code source}, when given, enables source reuse. Malformed
     * provenance attributes fail with {@link SerializationException#INVALID_PROVENANCE}.
     */
    public SerializeResult serializeHtml(String html, String source, SerializerOptions options) {
        return serialize(() -> load(html, source), options);
    }

    private SerializeResult serialize(Supplier<Document> document, SerializerOptions options) {
        var started = Instant.now();
        var diagnostics = new Diagnostics(options.logLevel());
        var buffer = new ChunkBuffer();
        try {
            new SerializerState(registry, options, document.get(), buffer, diagnostics).run();
            return SerializeResult.success(buffer.text(), buffer.chunks(), diagnostics.entries(), started);
        } catch (SerializationException ex) {
            return fail(ex, ex.code(), diagnostics, started);
        } catch (RuntimeException ex) {
            return fail(ex, SerializationException.INTERNAL_ERROR, diagnostics, started);
        }
    }

    private static SerializeResult fail(RuntimeException ex, String code, Diagnostics diagnostics, Instant started) {
        diagnostics.log("fatal/html2wt", ex);
        if (Boolean.getBoolean("html2wt.debug")) {
            ex.printStackTrace();
        }
        var message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return SerializeResult.failure(message, code, diagnostics.entries(), started);
    }

    private static Document load(String html, String source) {
        try {
            return HtmlDocumentLoader.load(html, source);
        } catch (IllegalArgumentException ex) {
            throw new SerializationException(SerializationException.INVALID_PROVENANCE, ex.getMessage(), ex);
        }
    }

    /**
     * @throws SerializationException when the document cannot be reconstructed
     */
    public String serializeOrThrow(Document document, SerializerOptions options) {
        var buffer = new ChunkBuffer();
        new SerializerState(registry, options, document, buffer, new Diagnostics(options.logLevel())).run();
        return buffer.text();
    }

    public String serializeToJson(Document document, SerializerOptions options) {
        return serialize(document, options).toPrettyJson();
    }
}
