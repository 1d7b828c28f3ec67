package work.lcod.html2wt.separator;

import java.util.ArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.html2wt.dom.DomUtils;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;

/**
 * Turns a pending separator into literal whitespace.
 */
public final class SeparatorEngine {
    public static final Pattern COMMENT = Pattern.compile("<!--(?:[^-]|-(?!->))*-->");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n]*");

    private SeparatorEngine() {}

    /**
     * Realizes {@code pending} given the separator source collected so far.
     *
     * @param pending accumulated constraint, or {@code null} when no node expressed one
     * @param source verbatim separator text, or {@code null}
     * @param singleLine true when the single-line cap is active
     * @param ceiling default maximum for an absent upper bound
     * @return the whitespace (and carried comments) to emit
     */
    public static Resolution resolve(NewlineConstraint pending, String source, boolean singleLine, int ceiling) {
        var range = pending == null ? null : NewlineConstraint.normalize(pending, ceiling);
        String result;
        if (source != null) {
            int newlines = countNewlines(source);
            if (range == null || range.allows(newlines)) {
                result = source;
            } else if (WHITESPACE.matcher(source).matches()) {
                result = "\n".repeat(range.min());
            } else {
                result = adjustNewlines(source, newlines, range);
            }
        } else {
            result = range == null ? "" : "\n".repeat(range.min());
        }
        if (singleLine && countNewlines(result) > 0) {
            return new Resolution(stripNewlines(result), true);
        }
        return new Resolution(result, false);
    }

    /**
     * Original source between two elements whose source ranges are known, or {@code null} when it cannot
     * be recovered or is not pure whitespace.
     */
    public static String originalSeparator(Node left, Node right, String source) {
        if (source == null || !(left instanceof Element a) || !(right instanceof Element b)) {
            return null;
        }
        if (DomUtils.isNewElt(a) || DomUtils.isNewElt(b)) {
            return null;
        }
        var dsrA = a.dataParsoid().dsr();
        var dsrB = b.dataParsoid().dsr();
        if (dsrA == null || dsrB == null || !dsrA.isValid() || !dsrB.isValid()) {
            return null;
        }
        int from;
        int to;
        if (a == b) {
            if (!dsrA.hasValidTagWidths()) {
                return null;
            }
            from = dsrA.innerStart();
            to = dsrA.innerEnd();
        } else {
            boolean aContainsB = DomUtils.isAncestorOf(a, b);
            boolean bContainsA = DomUtils.isAncestorOf(b, a);
            if ((aContainsB && dsrA.openWidth() == null) || (bContainsA && dsrB.closeWidth() == null)) {
                return null;
            }
            from = aContainsB ? dsrA.innerStart() : dsrA.end();
            to = bContainsA ? dsrB.innerEnd() : dsrB.start();
        }
        if (from < 0 || to > source.length() || from > to) {
            return null;
        }
        var slice = source.substring(from, to);
        return WHITESPACE.matcher(slice).matches() ? slice : null;
    }

    /**
     * Counts newlines outside comments.
     */
    public static int countNewlines(String text) {
        int count = 0;
        for (var segment : segments(text)) {
            if (!segment.comment()) {
                for (int i = 0; i < segment.text().length(); i++) {
                    if (segment.text().charAt(i) == '\n') {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    private static String adjustNewlines(String source, int newlines, NewlineConstraint range) {
        if (newlines < range.min()) {
            return source + "\n".repeat(range.min() - newlines);
        }
        int excess = newlines - range.max();
        var chars = new StringBuilder(source);
        var segments = segments(source);
        for (int s = segments.length - 1; s >= 0 && excess > 0; s--) {
            var segment = segments[s];
            if (segment.comment()) {
                continue;
            }
            for (int i = segment.end() - 1; i >= segment.start() && excess > 0; i--) {
                if (chars.charAt(i) == '\n') {
                    chars.deleteCharAt(i);
                    excess--;
                }
            }
        }
        return chars.toString();
    }

    private static String stripNewlines(String text) {
        var builder = new StringBuilder();
        for (var segment : segments(text)) {
            builder.append(segment.comment() ? segment.text() : segment.text().replace("\n", ""));
        }
        return builder.toString();
    }

    private static Segment[] segments(String text) {
        var list = new ArrayList<Segment>();
        Matcher matcher = COMMENT.matcher(text);
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() > position) {
                list.add(new Segment(text.substring(position, matcher.start()), position, matcher.start(), false));
            }
            list.add(new Segment(matcher.group(), matcher.start(), matcher.end(), true));
            position = matcher.end();
        }
        if (position < text.length()) {
            list.add(new Segment(text.substring(position), position, text.length(), false));
        }
        return list.toArray(new Segment[0]);
    }

    private record Segment(String text, int start, int end, boolean comment) {}

    /**
     * @param text the separator to emit
     * @param suppressed true when the single-line cap removed newlines the constraint asked for
     */
    public record Resolution(String text, boolean suppressed) {}
}
