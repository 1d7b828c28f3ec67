package work.lcod.html2wt.handlers;

import java.util.regex.Pattern;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.html.HtmlElementHandler;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;
import work.lcod.html2wt.separator.SeparatorEngine;

/**
 * Indent-pre (leading space on every line) and literal HTML {@code <pre>}.
 */
public final class PreHandlers {
    private static final String COMMENT = SeparatorEngine.COMMENT.pattern();
    private static final Pattern LINE_START = Pattern.compile("(\\n(?:" + COMMENT + ")*)");
    // Lines holding only comments are zero-width for the parser and must stay unindented.
    private static final Pattern COMMENT_ONLY_LINE =
        Pattern.compile("(^|\\n) ((?:[ \\t]*" + COMMENT + "[ \\t]*)+)(?=\\n|$)");

    private PreHandlers() {}

    public static HandlerRegistry register(HandlerRegistry registry) {
        registry.register(HandlerKey.PRE, NodeHandler.builder(PreHandlers::emitIndentPre)
            .before(PreHandlers::aroundPre)
            .after(PreHandlers::aroundPre)
            .build());
        registry.register(HandlerKey.PRE_HTML, NodeHandler.builder(HtmlElementHandler::emit)
            .firstChild(NodeHandler.SeparatorRule.constant(NewlineConstraint.atMost(NewlineConstraint.UNBOUNDED)))
            .lastChild(NodeHandler.SeparatorRule.constant(NewlineConstraint.atMost(NewlineConstraint.UNBOUNDED)))
            .build());
        return registry;
    }

    private static void emitIndentPre(Element node, SerializerState state, boolean wrapperUnmodified) {
        var content = state.serializeChildrenToString(node);
        boolean trailingNewline = content.endsWith("\n");
        if (trailingNewline) {
            content = content.substring(0, content.length() - 1);
        }
        state.emitChunk(indent(content), node);
        if (trailingNewline) {
            state.setSeparatorSource("\n");
        }
    }

    /**
     * Prefixes every line with a space, except lines made only of comments.
     */
    static String indent(String content) {
        var indented = " " + LINE_START.matcher(content).replaceAll("$1 ");
        return COMMENT_ONLY_LINE.matcher(indented).replaceAll("$1$2");
    }

    private static NewlineConstraint aroundPre(Node node, Node other, SerializerState state) {
        if (other instanceof Element element && element.name().equals("pre") && !element.dataParsoid().isLiteralHtml()) {
            // Adjacent indent-pres would merge into one block.
            return NewlineConstraint.atLeast(2);
        }
        return NewlineConstraint.atLeast(1);
    }
}
