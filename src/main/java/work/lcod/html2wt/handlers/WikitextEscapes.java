package work.lcod.html2wt.handlers;

import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Text;
import work.lcod.html2wt.runtime.TextEscaper;

/**
 * Context-specific text escapers installed by the structural handlers.
 */
public final class WikitextEscapes {
    private static final String BULLETS = "*#:;";

    private WikitextEscapes() {}

    public static String nowiki(String text) {
        return "<nowiki>" + text + "</nowiki>";
    }

    /**
     * Leading bullet characters in the first text of a list item, and colons anywhere in a term.
     */
    public static TextEscaper listItem(Element item) {
        boolean term = item.name().equals("dt");
        return (text, node, state) -> {
            var out = text;
            if (term && out.indexOf(':') >= 0) {
                out = out.replace(":", nowiki(":"));
            }
            if (isFirstContent(node, item) && !out.isEmpty() && BULLETS.indexOf(out.charAt(0)) >= 0) {
                out = nowiki(out.substring(0, 1)) + out.substring(1);
            }
            return out;
        };
    }

    /**
     * Leading and trailing {@code =} runs inside a heading.
     */
    public static TextEscaper heading(Element heading) {
        return (text, node, state) -> {
            if (node.parent() != heading) {
                return text;
            }
            var prefix = "";
            var body = text;
            var suffix = "";
            if (node.previousSibling() == null) {
                int lead = run(body, 0, 1);
                if (lead > 0) {
                    prefix = nowiki(body.substring(0, lead));
                    body = body.substring(lead);
                }
            }
            if (node.nextSibling() == null && !body.isEmpty()) {
                int trail = run(body, body.length() - 1, -1);
                if (trail > 0) {
                    suffix = nowiki(body.substring(body.length() - trail));
                    body = body.substring(0, body.length() - trail);
                }
            }
            return prefix + body + suffix;
        };
    }

    /**
     * Cell separators inside a cell, and row or table syntax at the start of a narrow cell.
     *
     * @param wide true when the cell markup is longer than a single character, so a leading
     *     dash, plus or closing brace cannot merge with it
     */
    public static TextEscaper tableCell(Element cell, boolean wide) {
        boolean header = cell.name().equals("th");
        return (text, node, state) -> {
            var out = text.replace("||", nowiki("||"));
            if (header) {
                out = out.replace("!!", nowiki("!!"));
            }
            if (!wide && isFirstContent(node, cell) && !out.isEmpty() && "-+}".indexOf(out.charAt(0)) >= 0) {
                out = nowiki(out.substring(0, 1)) + out.substring(1);
            }
            return out;
        };
    }

    /**
     * Escapes text that would open block syntax at the start of a line: list bullets, heading and
     * rule runs, indent-pre whitespace and table openers. Inside a wikitext table, row, caption, cell
     * and closing markup is escaped too.
     */
    public static String lineStart(String line, boolean inWikiTable) {
        if (line.isEmpty() || line.startsWith("<nowiki>")) {
            return line;
        }
        char first = line.charAt(0);
        int length = 0;
        if (BULLETS.indexOf(first) >= 0 || first == ' ' || first == '\t') {
            length = 1;
        } else if (first == '=') {
            length = run(line, 0, 1);
        } else if (line.startsWith("----")) {
            length = dashes(line);
        } else if (line.startsWith("{|")) {
            length = 2;
        } else if (inWikiTable && (line.startsWith("|}") || line.startsWith("|-") || line.startsWith("|+"))) {
            length = 2;
        } else if (inWikiTable && (first == '|' || first == '!')) {
            length = 1;
        }
        return length == 0 ? line : nowiki(line.substring(0, length)) + line.substring(length);
    }

    private static int dashes(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == '-') {
            count++;
        }
        return count;
    }

    private static boolean isFirstContent(Text node, Element container) {
        return node.parent() == container && DomUtils.previousNonSepSibling(node) == null;
    }

    private static int run(String text, int from, int step) {
        int count = 0;
        for (int i = from; i >= 0 && i < text.length() && text.charAt(i) == '='; i += step) {
            count++;
        }
        return count;
    }
}
