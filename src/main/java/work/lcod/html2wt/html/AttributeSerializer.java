package work.lcod.html2wt.html;

import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.Element;

/**
 * Renders the attributes of an element as HTML attribute source, leaving out parser-internal ones.
 */
public final class AttributeSerializer {
    private static final Pattern GENERATED_ID = Pattern.compile("^mw[\\w-]{2,}$");

    private AttributeSerializer() {}

    /**
     * @return {@code k="v"} pairs joined by single spaces, or an empty string
     */
    public static String serialize(Element node) {
        var dp = node.dataParsoid();
        var out = new ArrayList<String>();
        for (Map.Entry<String, String> entry : node.attributes().entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue() == null ? "" : entry.getValue();
            if (isInternal(key, value)) {
                continue;
            }
            if (key.equals("typeof")) {
                value = stripParserTypes(value);
                if (value.isEmpty()) {
                    continue;
                }
            }
            var recorded = dp.sa().get(key);
            if (recorded != null && value.equals(dp.a().get(key))) {
                out.add(key + "=" + quoteSource(recorded));
            } else {
                out.add(key + "=\"" + escapeValue(value) + "\"");
            }
        }
        return String.join(" ", out);
    }

    /**
     * Attribute pairs in source order, for extension tags rebuilt from their recorded attributes.
     */
    public static String serialize(Map<String, String> attributes) {
        var out = new ArrayList<String>();
        attributes.forEach((key, value) -> out.add(key + "=\"" + escapeValue(value == null ? "" : value) + "\""));
        return String.join(" ", out);
    }

    static boolean isInternal(String key, String value) {
        if (key.startsWith("data-parsoid") || key.equals("data-mw") || key.equals("data-ve-changed")) {
            return true;
        }
        if (key.equals("about") && value.startsWith("#mwt")) {
            return true;
        }
        return key.equals("id") && GENERATED_ID.matcher(value).matches();
    }

    private static String stripParserTypes(String typeOf) {
        var kept = new ArrayList<String>();
        for (var token : typeOf.trim().split("\\s+")) {
            if (!token.isEmpty() && !token.startsWith("mw:")) {
                kept.add(token);
            }
        }
        return String.join(" ", kept);
    }

    private static String quoteSource(String source) {
        if (source.indexOf('"') < 0) {
            return "\"" + source + "\"";
        }
        if (source.indexOf('\'') < 0) {
            return "'" + source + "'";
        }
        return "\"" + escapeValue(source) + "\"";
    }

    static String escapeValue(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;");
    }
}
