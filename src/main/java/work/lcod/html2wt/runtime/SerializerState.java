package work.lcod.html2wt.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import work.lcod.html2wt.api.SerializerOptions;
import work.lcod.html2wt.diag.Diagnostics;
import work.lcod.html2wt.dom.Document;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.handlers.HandlerRegistry;
import work.lcod.html2wt.separator.CurrentLine;
import work.lcod.html2wt.separator.NewlineConstraint;
import work.lcod.html2wt.separator.Separator;
import work.lcod.html2wt.separator.SeparatorEngine;
import work.lcod.html2wt.separator.SingleLineContext;

/**
 * Mutable context of one serialization, passed to every handler. Not shared between threads.
 */
public final class SerializerState {
    private final HandlerRegistry registry;
    private final SerializerOptions options;
    private final Document document;
    private final Diagnostics diagnostics;
    private final SingleLineContext singleLineContext = new SingleLineContext();
    private final Deque<TextEscaper> escapers = new ArrayDeque<>();
    private OutputSink sink;
    private CurrentLine currentLine = new CurrentLine();
    private Separator separator = new Separator();
    private Node prevNode;
    private int wikiTableNesting;
    private boolean outputStarted;

    public SerializerState(
        HandlerRegistry registry,
        SerializerOptions options,
        Document document,
        OutputSink sink,
        Diagnostics diagnostics
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
        this.document = Objects.requireNonNull(document, "document");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.diagnostics = diagnostics == null ? new Diagnostics(options.logLevel()) : diagnostics;
    }

    /**
     * Serializes the whole document into the sink, flushing the trailing separator.
     */
    public void run() {
        TreeWalker.serializeDocument(this);
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public SerializerOptions options() {
        return options;
    }

    public Document document() {
        return document;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public SingleLineContext singleLineContext() {
        return singleLineContext;
    }

    public CurrentLine currentLine() {
        return currentLine;
    }

    public Separator separator() {
        return separator;
    }

    public boolean rtTestMode() {
        return options.rtTestMode();
    }

    /**
     * True when unmodified subtrees may be copied from the original source.
     */
    public boolean selserMode() {
        return options.selser() && document.hasSource();
    }

    public Node prevNode() {
        return prevNode;
    }

    void setPrevNode(Node node) {
        this.prevNode = node;
    }

    public int wikiTableNesting() {
        return wikiTableNesting;
    }

    public void enterWikiTable() {
        wikiTableNesting++;
    }

    public void exitWikiTable() {
        wikiTableNesting--;
    }

    public boolean atStartOfLine() {
        return currentLine.atStartOfLine();
    }

    /**
     * Writes {@code text} for {@code node}, realizing the pending separator first. Empty text still
     * flushes the separator.
     */
    public void emitChunk(String text, Node node) {
        flushSeparator(node);
        var out = singleLineContext.enforced() ? text.replace('\n', ' ') : text;
        if (!out.isEmpty()) {
            write(out, node);
        }
    }

    private void write(String text, Node node) {
        sink.accept(text, node);
        currentLine.append(text, node);
        outputStarted = true;
    }

    /**
     * Replaces the pending separator source.
     */
    public void setSeparatorSource(String source) {
        separator.replaceSource(source);
    }

    public void appendSeparatorSource(String source) {
        separator.appendSource(source);
    }

    void flushSeparator(Node node) {
        if (separator.isEmpty()) {
            return;
        }
        var source = separator.source();
        if (source == null && !outputStarted) {
            // The start of the output is already the start of a line.
            separator.clear();
            return;
        }
        if (source == null && selserMode()) {
            source = SeparatorEngine.originalSeparator(separator.left(), separator.right(), document.source());
        }
        var resolution = SeparatorEngine.resolve(
            separator.constraint(),
            source,
            singleLineContext.enforced(),
            options.maxNewlines()
        );
        if (resolution.suppressed()) {
            diagnostics.log("debug/wts/sep", "single-line context dropped newlines before", node);
        }
        separator.clear();
        if (!resolution.text().isEmpty()) {
            write(resolution.text(), node);
        }
    }

    /**
     * Raises the pending minimum to one newline unless the output already sits at the start of a line.
     * An explicit zero maximum, or an active single-line cap, wins over the request.
     */
    void requireStartOfLine(Node from, Element node) {
        if (currentLine.atStartOfLine()) {
            return;
        }
        if (singleLineContext.enforced()) {
            diagnostics.log("debug/wts/sol", "single-line context keeps", node, "off the start of line");
            return;
        }
        var pending = separator.constraint();
        if (pending != null && pending.max() != null && pending.max() < 1) {
            diagnostics.log("debug/wts/sol", "separator maximum", pending.max(), "keeps", node, "off the start of line");
            return;
        }
        separator.merge(NewlineConstraint.atLeast(1), from == null ? node : from, node);
    }

    public void serializeChildren(Element node) {
        serializeChildren(node, null);
    }

    /**
     * Serializes the children of {@code node}; {@code escaper}, when given, applies to every text
     * descendant until a nested element installs its own.
     */
    public void serializeChildren(Element node, TextEscaper escaper) {
        if (escaper != null) {
            escapers.push(escaper);
        }
        try {
            TreeWalker.serializeChildren(this, node);
        } finally {
            if (escaper != null) {
                escapers.pop();
            }
        }
    }

    /**
     * Serializes a single node as if it were the next child of the walk.
     */
    public void serializeNode(Node node) {
        TreeWalker.serializeNode(this, node);
    }

    /**
     * Serializes the children of {@code node} into a string instead of the sink. The separator pending
     * before {@code node} is left untouched; the separator pending after its last child is included.
     */
    public String serializeChildrenToString(Element node) {
        var buffer = new ChunkBuffer();
        var savedSink = sink;
        var savedLine = currentLine;
        var savedSeparator = separator;
        boolean savedStarted = outputStarted;
        sink = buffer;
        currentLine = new CurrentLine();
        separator = new Separator();
        outputStarted = true;
        try {
            TreeWalker.serializeChildren(this, node);
            flushSeparator(node);
        } finally {
            sink = savedSink;
            currentLine = savedLine;
            separator = savedSeparator;
            outputStarted = savedStarted;
        }
        return buffer.text();
    }

    /**
     * Serializes a detached fragment (template argument or extension body) in a child walk.
     */
    public String serializeFragment(Element root) {
        var buffer = new ChunkBuffer();
        var child = new SerializerState(
            registry,
            options.toBuilder().selser(false).build(),
            Document.withoutSource(root),
            buffer,
            diagnostics
        );
        child.run();
        return buffer.text();
    }

    TextEscaper currentEscaper() {
        var escaper = escapers.peek();
        return escaper == null ? TextEscaper.NONE : escaper;
    }

    /**
     * Slice of the original source.
     *
     * @throws SerializationException when no source is attached or the range falls outside it
     */
    public String originalSource(int start, int end) {
        var source = document.source();
        if (source == null || start < 0 || end > source.length() || start > end) {
            throw new SerializationException(
                SerializationException.INVALID_SOURCE_RANGE,
                "Source range [" + start + ", " + end + "] is not available",
                Map.of("start", start, "end", end)
            );
        }
        return source.substring(start, end);
    }

    /**
     * Emits an opening tag unless the parser inserted it and round-trip test mode is on.
     *
     * @return false when the tag was dropped
     */
    public boolean emitStartTag(String source, Element node) {
        if (options.rtTestMode() && node.dataParsoid().autoInsertedStart()) {
            return false;
        }
        emitChunk(source, node);
        return true;
    }

    public boolean emitEndTag(String source, Element node) {
        if (options.rtTestMode() && node.dataParsoid().autoInsertedEnd()) {
            return false;
        }
        emitChunk(source, node);
        return true;
    }
}
