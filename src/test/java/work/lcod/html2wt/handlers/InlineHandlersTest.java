package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;

final class InlineHandlersTest {
    @Test
    void nowikiWrapsItsContent() {
        assertEquals("<nowiki>''x''</nowiki>", wikitext("<span typeof=\"mw:Nowiki\" data-parsoid='{}'>''x''</span>"));
    }

    @Test
    void nowikiTagsInsideNowikiAreEscaped() {
        assertEquals("a&lt;/nowiki&gt;b", InlineHandlers.escapeNowikiTags("a</nowiki>b"));
    }

    @Test
    void newEntityIsEncoded() {
        assertEquals("&nbsp;", wikitext("<span typeof=\"mw:Entity\">\u00a0</span>"));
        assertEquals("&#x2014;", InlineHandlers.entityEncodeAll("\u2014"));
        assertEquals("&#x0A;", InlineHandlers.entityEncodeAll("\n"));
    }

    @Test
    void generatedContentTypesAreRecognizedAmongOtherTokens() {
        assertTrue(InlineHandlers.isGeneratedContentWrapper("foo mw:Entity"));
        assertFalse(InlineHandlers.isGeneratedContentWrapper("mw:Transclusion"));
        assertFalse(InlineHandlers.isGeneratedContentWrapper(""));
    }

    @Test
    void plainSpanIsKeptAsHtml() {
        assertEquals("<span class=\"c\">x</span>", wikitext("<span class=\"c\">x</span>"));
    }
}
