package work.lcod.html2wt.dom;

import java.util.List;
import java.util.Objects;

/**
 * A template ({@code {{target|...}}}) or template argument ({@code {{{name|default}}}}) invocation.
 */
public record InvocationPart(Kind kind, String target, List<TemplateParam> params, int index) implements Part {
    public InvocationPart {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public enum Kind {
        TEMPLATE("template", "{{", "}}"),
        TEMPLATE_ARG("templatearg", "{{{", "}}}");

        private final String key;
        private final String open;
        private final String close;

        Kind(String key, String open, String close) {
            this.key = key;
            this.open = open;
            this.close = close;
        }

        public String key() {
            return key;
        }

        public String open() {
            return open;
        }

        public String close() {
            return close;
        }
    }
}
