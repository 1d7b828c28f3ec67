package work.lcod.html2wt.dom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Decodes the JSON sidecar attributes ({@code data-parsoid}, {@code data-mw}, {@code data-parsoid-diff}).
 */
final class ProvenanceDecoder {
    private static final ObjectMapper JSON = new ObjectMapper();

    private ProvenanceDecoder() {}

    static DataParsoid decodeDataParsoid(String raw) {
        var root = readObject(raw, "data-parsoid");
        var builder = DataParsoid.builder()
            .dsr(decodeDsr(root.get("dsr")))
            .stx(text(root, "stx"))
            .stxV(text(root, "stx_v"))
            .startTagSrc(text(root, "startTagSrc"))
            .endTagSrc(text(root, "endTagSrc"))
            .attrSepSrc(text(root, "attrSepSrc"))
            .autoInsertedStart(flag(root, "autoInsertedStart"))
            .autoInsertedEnd(flag(root, "autoInsertedEnd"))
            .src(text(root, "src"))
            .srcContent(text(root, "srcContent"))
            .strippedNL(flag(root, "strippedNL"))
            .misnested(flag(root, "misnested"))
            .autoInsertedRefs(flag(root, "autoInsertedRefs"))
            .extraDashes(root.path("extra_dashes").asInt(0))
            .magicSrc(text(root, "magicSrc"))
            .liHackSrc(text(root, "liHackSrc"))
            .selfClose(flag(root, "selfClose"));
        copyStrings(root.get("a"), builder::attributeValue);
        copyStrings(root.get("sa"), builder::attributeSource);
        return builder.build();
    }

    static DataMw decodeDataMw(String raw) {
        var root = readObject(raw, "data-mw");
        List<Part> parts = root.has("parts") ? decodeParts(root.get("parts")) : List.of();
        var attrs = new LinkedHashMap<String, String>();
        copyStrings(root.get("attrs"), attrs::put);
        DataMw.ExtensionBody body = null;
        var bodyNode = root.get("body");
        if (bodyNode != null && bodyNode.isObject()) {
            String html = text(bodyNode, "html");
            body = new DataMw.ExtensionBody(
                text(bodyNode, "extsrc"),
                html == null ? null : HtmlDocumentLoader.parseFragment(html)
            );
        }
        return new DataMw(parts, text(root, "name"), attrs, body);
    }

    static Set<DiffMark> decodeDiff(String raw) {
        var root = readObject(raw, "data-parsoid-diff");
        var marks = EnumSet.noneOf(DiffMark.class);
        var diff = root.get("diff");
        if (diff != null && diff.isArray()) {
            for (var item : diff) {
                marks.add(DiffMark.from(item.asText()));
            }
        }
        return marks;
    }

    private static List<Part> decodeParts(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("data-mw parts must be an array: " + node);
        }
        var parts = new ArrayList<Part>();
        for (var item : node) {
            if (item.isTextual()) {
                parts.add(new LiteralPart(item.asText()));
            } else if (item.has(InvocationPart.Kind.TEMPLATE.key())) {
                parts.add(decodeInvocation(InvocationPart.Kind.TEMPLATE, item.get(InvocationPart.Kind.TEMPLATE.key())));
            } else if (item.has(InvocationPart.Kind.TEMPLATE_ARG.key())) {
                parts.add(decodeInvocation(
                    InvocationPart.Kind.TEMPLATE_ARG,
                    item.get(InvocationPart.Kind.TEMPLATE_ARG.key())
                ));
            } else {
                throw new IllegalArgumentException("Unsupported data-mw part: " + item);
            }
        }
        return parts;
    }

    private static InvocationPart decodeInvocation(InvocationPart.Kind kind, JsonNode node) {
        var target = node.path("target");
        String targetWt = text(target, "wt");
        if (targetWt == null) {
            targetWt = text(target, "function");
        }
        if (targetWt == null) {
            throw new IllegalArgumentException("Invocation without target wikitext: " + node);
        }
        var params = new ArrayList<TemplateParam>();
        var paramsNode = node.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            var fields = paramsNode.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                params.add(decodeParam(entry.getKey(), entry.getValue()));
            }
        }
        return new InvocationPart(kind, targetWt, params, node.path("i").asInt(0));
    }

    private static TemplateParam decodeParam(String name, JsonNode node) {
        String keySource = text(node.path("key"), "wt");
        if (node.has("parts")) {
            return new TemplateParam(name, keySource, decodeParts(node.get("parts")), null);
        }
        String html = text(node, "html");
        if (html != null && !node.has("wt")) {
            return new TemplateParam(name, keySource, List.of(), HtmlDocumentLoader.parseFragment(html));
        }
        String wt = text(node, "wt");
        return new TemplateParam(name, keySource, List.of(new LiteralPart(wt == null ? "" : wt)), null);
    }

    private static SourceRange decodeDsr(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        return new SourceRange(intAt(node, 0), intAt(node, 1), intAt(node, 2), intAt(node, 3));
    }

    private static Integer intAt(JsonNode array, int index) {
        var item = array.get(index);
        return item == null || item.isNull() ? null : item.asInt();
    }

    private static JsonNode readObject(String raw, String attribute) {
        try {
            var root = JSON.readTree(raw);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException(attribute + " must be a JSON object: " + raw);
            }
            return root;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON in " + attribute + ": " + ex.getMessage(), ex);
        }
    }

    private static String text(JsonNode node, String field) {
        var value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean flag(JsonNode node, String field) {
        return node.path(field).asBoolean(false);
    }

    private static void copyStrings(JsonNode node, StringSink sink) {
        if (node == null || !node.isObject()) {
            return;
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            sink.put(entry.getKey(), entry.getValue().isNull() ? null : entry.getValue().asText());
        }
    }

    @FunctionalInterface
    private interface StringSink {
        Object put(String key, String value);
    }
}
