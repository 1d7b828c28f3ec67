package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;

final class ParagraphHandlersTest {
    @Test
    void consecutiveParagraphsAreSeparatedByABlankLine() {
        assertEquals("a\n\nb\n", wikitext("<p>a</p><p>b</p>"));
    }

    @Test
    void singleParagraphEndsWithANewline() {
        assertEquals("a\n", wikitext("<p>a</p>"));
    }

    @Test
    void breakOutsideAParagraphIsLiteralAndEndsTheLine() {
        assertEquals("a<br>\nb", wikitext("a<br>b"));
    }
}
