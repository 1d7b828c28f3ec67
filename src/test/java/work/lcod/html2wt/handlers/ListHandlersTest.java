package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.html2wt.support.SerializerTestSupport.serialize;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.dom.HtmlDocumentLoader;

final class ListHandlersTest {
    @Test
    void bulletListItemsGoOnTheirOwnLines() {
        assertEquals("* a\n* b", wikitext("<ul><li>a</li><li>b</li></ul>"));
    }

    @Test
    void nestedListsAccumulateBullets() {
        assertEquals("* a\n** b", wikitext("<ul><li>a<ul><li>b</li></ul></li></ul>"));
        assertEquals("* a\n*# b", wikitext("<ul><li>a<ol><li>b</li></ol></li></ul>"));
    }

    @Test
    void threeLevelBulletsFollowTheListTypes() {
        assertEquals("* a\n** b\n*** c", wikitext("<ul><li>a<ul><li>b<ul><li>c</li></ul></li></ul></li></ul>"));
        assertEquals("* a\n*# b\n*#* c", wikitext("<ul><li>a<ol><li>b<ul><li>c</li></ul></li></ol></li></ul>"));
    }

    @Test
    void definitionListUsesTermAndDescriptionMarkers() {
        assertEquals("; a\n: b", wikitext("<dl><dt>a</dt><dd>b</dd></dl>"));
    }

    @Test
    void rowDescriptionStaysOnTheTermLine() {
        assertEquals("; a:b", wikitext("<dl><dt>a</dt><dd data-parsoid='{\"stx\":\"row\"}'>b</dd></dl>"));
    }

    @Test
    void leadingBulletInItemTextIsEscaped() {
        assertEquals("* <nowiki>*</nowiki>x", wikitext("<ul><li>*x</li></ul>"));
    }

    @Test
    void colonInTermIsEscaped() {
        assertEquals("; a<nowiki>:</nowiki>b\n: c", wikitext("<dl><dt>a:b</dt><dd>c</dd></dl>"));
    }

    @Test
    void itemWithoutListIsReportedButStillSerialized() {
        var result = serialize("<li>a</li>");
        assertTrue(result.isSuccess());
        assertEquals("a", result.wikitext());
        assertTrue(result.diagnostics().stream().anyMatch(entry -> entry.logType().equals("error/html2wt")));
    }

    @Test
    void templateListWithoutSharedPrefixNeedsItsContainerBullets() {
        var body = HtmlDocumentLoader.parseFragment(
            "<span about=\"#mwt1\" typeof=\"mw:Transclusion\" data-mw='{\"parts\":[\"*\",{\"template\":{\"target\":{\"wt\":\"x\"},\"params\":{}}}]}'>a</span>"
                + "<span about=\"#mwt2\" typeof=\"mw:Transclusion\" data-mw='{\"parts\":[\"**\",{\"template\":{\"target\":{\"wt\":\"x\"},\"params\":{}}}]}'>b</span>"
                + "<span>plain</span>"
        );
        assertTrue(ListHandlers.isTemplateListWithoutSharedPrefix(body.children().get(0)));
        assertFalse(ListHandlers.isTemplateListWithoutSharedPrefix(body.children().get(1)));
        assertFalse(ListHandlers.isTemplateListWithoutSharedPrefix(body.children().get(2)));
    }
}
