package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.SerializerOptions;

final class QuoteHandlersTest {
    @Test
    void adjacentQuotesAreSeparatedByAnEmptyNowiki() {
        assertEquals("'''a'''<nowiki/>''b''", wikitext("<b>a</b><i>b</i>"));
    }

    @Test
    void quotesSeparatedByTextNeedNoEscape() {
        assertEquals("''a'' '''b'''", wikitext("<i>a</i> <b>b</b>"));
    }

    @Test
    void emptyQuoteIsKeptVisible() {
        assertEquals("''<nowiki/>''", wikitext("<i></i>"));
    }

    @Test
    void autoInsertedEndIsDroppedOnlyInRoundTripTestMode() {
        var html = "<b data-parsoid='{\"autoInsertedEnd\":true}'>a</b>";
        assertEquals("'''a", wikitext(html, null, SerializerOptions.builder().rtTestMode(true).build()));
        assertEquals("'''a'''", wikitext(html));
    }
}
