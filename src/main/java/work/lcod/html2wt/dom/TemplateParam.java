package work.lcod.html2wt.dom;

import java.util.List;
import java.util.Objects;

/**
 * A named invocation argument. The value is either a part sequence or an HTML fragment that must be
 * serialized back to wikitext first.
 *
 * @param name normalized parameter name ({@code "1"} for the first positional argument)
 * @param keySource original key wikitext, when it differs from {@code name}
 * @param value part sequence, empty when {@code html} is set
 * @param html fragment root, or {@code null}
 */
public record TemplateParam(String name, String keySource, List<Part> value, Element html) {
    public TemplateParam {
        Objects.requireNonNull(name, "name");
        value = value == null ? List.of() : List.copyOf(value);
    }

    public static TemplateParam literal(String name, String wikitext) {
        return new TemplateParam(name, null, List.of(new LiteralPart(wikitext)), null);
    }

    public boolean isPositional() {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
