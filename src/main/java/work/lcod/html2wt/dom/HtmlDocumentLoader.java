package work.lcod.html2wt.dom;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.TextNode;

/**
 * Builds the read-only tree from annotated HTML. Sidecar attributes are decoded and removed from the
 * attribute map.
 */
public final class HtmlDocumentLoader {
    static final String DATA_PARSOID = "data-parsoid";
    static final String DATA_MW = "data-mw";
    static final String DATA_PARSOID_DIFF = "data-parsoid-diff";
    private static final Set<String> SIDECARS = Set.of(DATA_PARSOID, DATA_MW, DATA_PARSOID_DIFF);

    private HtmlDocumentLoader() {}

    /**
     * Parses {@code html} as body content. When {@code source} is given the body covers the whole source
     * and selective serialization may reuse it.
     */
    public static Document load(String html, String source) {
        var parsed = Jsoup.parseBodyFragment(html == null ? "" : html);
        var rootProvenance = source == null
            ? DataParsoid.builder().build()
            : DataParsoid.builder().dsr(SourceRange.of(0, source.length(), 0, 0)).build();
        var body = new Element("body", attributesOf(parsed.body()), convertChildren(parsed.body()), rootProvenance, null, null);
        return new Document(body, source);
    }

    public static Document load(Path htmlFile, Path sourceFile) {
        try {
            var html = Files.readString(htmlFile, StandardCharsets.UTF_8);
            var source = sourceFile == null ? null : Files.readString(sourceFile, StandardCharsets.UTF_8);
            return load(html, source);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read HTML input: " + htmlFile, ex);
        }
    }

    /**
     * Parses an HTML fragment (template argument or extension body) into a detached {@code body} root.
     */
    public static Element parseFragment(String html) {
        return load(html, null).body();
    }

    private static List<Node> convertChildren(org.jsoup.nodes.Element element) {
        var children = new ArrayList<Node>();
        for (var child : element.childNodes()) {
            if (child instanceof TextNode text) {
                children.add(new Text(text.getWholeText()));
            } else if (child instanceof org.jsoup.nodes.Comment comment) {
                children.add(new Comment(comment.getData()));
            } else if (child instanceof DataNode data) {
                children.add(new Text(data.getWholeData()));
            } else if (child instanceof org.jsoup.nodes.Element nested) {
                children.add(convertElement(nested));
            }
        }
        return children;
    }

    private static Element convertElement(org.jsoup.nodes.Element element) {
        DataParsoid dataParsoid = element.hasAttr(DATA_PARSOID)
            ? ProvenanceDecoder.decodeDataParsoid(element.attr(DATA_PARSOID))
            : DataParsoid.NEW;
        DataMw dataMw = element.hasAttr(DATA_MW)
            ? ProvenanceDecoder.decodeDataMw(element.attr(DATA_MW))
            : null;
        var diff = element.hasAttr(DATA_PARSOID_DIFF)
            ? ProvenanceDecoder.decodeDiff(element.attr(DATA_PARSOID_DIFF))
            : null;
        return new Element(element.normalName(), attributesOf(element), convertChildren(element), dataParsoid, dataMw, diff);
    }

    private static LinkedHashMap<String, String> attributesOf(org.jsoup.nodes.Element element) {
        var attributes = new LinkedHashMap<String, String>();
        for (Attribute attribute : element.attributes()) {
            if (!SIDECARS.contains(attribute.getKey())) {
                attributes.put(attribute.getKey(), attribute.getValue());
            }
        }
        return attributes;
    }
}
