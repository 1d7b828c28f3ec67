package work.lcod.html2wt.encap;

import java.util.List;
import work.lcod.html2wt.dom.InvocationPart;
import work.lcod.html2wt.dom.LiteralPart;
import work.lcod.html2wt.dom.Part;
import work.lcod.html2wt.dom.TemplateParam;
import work.lcod.html2wt.runtime.SerializerState;

/**
 * Rebuilds {@code {{target|arg|name=value}}} invocations from their recorded parts.
 */
final class TemplateWikitextBuilder {
    private final SerializerState state;

    TemplateWikitextBuilder(SerializerState state) {
        this.state = state;
    }

    String build(List<Part> parts) {
        var out = new StringBuilder();
        for (var part : parts) {
            if (part instanceof LiteralPart literal) {
                out.append(literal.text());
            } else if (part instanceof InvocationPart invocation) {
                appendInvocation(invocation, out);
            } else {
                throw new IllegalArgumentException("Unsupported part: " + part);
            }
        }
        return out.toString();
    }

    private void appendInvocation(InvocationPart invocation, StringBuilder out) {
        var kind = invocation.kind();
        out.append(kind.open()).append(invocation.target());
        int nextPosition = 1;
        boolean sequential = true;
        for (var param : invocation.params()) {
            var value = paramValue(param);
            sequential = sequential && param.name().equals(String.valueOf(nextPosition));
            if (sequential) {
                nextPosition++;
            }
            out.append('|');
            if (!sequential || value.indexOf('=') >= 0) {
                out.append(param.keySource() != null ? param.keySource() : param.name()).append('=');
            }
            out.append(value);
        }
        out.append(kind.close());
    }

    private String paramValue(TemplateParam param) {
        if (param.html() != null) {
            return state.serializeFragment(param.html());
        }
        return build(param.value());
    }
}
