package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;

final class PreHandlersTest {
    @Test
    void everyLineIsIndented() {
        assertEquals(" a\n b", PreHandlers.indent("a\nb"));
    }

    @Test
    void commentLinesAreNotIndented() {
        assertEquals("<!--c-->\n b", PreHandlers.indent("<!--c-->\nb"));
    }

    @Test
    void newPreBecomesIndentPre() {
        assertEquals(" a\n b\n", wikitext("<pre>a\nb</pre>"));
    }

    @Test
    void htmlPreRestoresTheStrippedNewline() {
        assertEquals("<pre>\na</pre>", wikitext("<pre data-parsoid='{\"stx\":\"html\",\"strippedNL\":true}'>a</pre>"));
    }
}
