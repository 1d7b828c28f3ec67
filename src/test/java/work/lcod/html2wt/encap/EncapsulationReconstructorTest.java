package work.lcod.html2wt.encap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.html2wt.support.SerializerTestSupport.serialize;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.SerializerOptions;
import work.lcod.html2wt.api.WikitextSerializer;
import work.lcod.html2wt.dom.HtmlDocumentLoader;
import work.lcod.html2wt.runtime.SerializationException;

final class EncapsulationReconstructorTest {
    private static String transclusion(String dataMw, String content) {
        return "<span about=\"#mwt1\" typeof=\"mw:Transclusion\" data-mw='" + dataMw + "'>" + content + "</span>";
    }

    private static String echo(String params) {
        return "{\"parts\":[{\"template\":{\"target\":{\"wt\":\"echo\"},\"params\":" + params + ",\"i\":0}}]}";
    }

    @Test
    void templateIsRebuiltFromItsParts() {
        var html = transclusion(echo("{\"1\":{\"wt\":\"foo\"},\"x\":{\"wt\":\"y\"}}"), "foo")
            + "<span about=\"#mwt1\">more</span> tail";
        assertEquals("{{echo|foo|x=y}} tail", wikitext(html));
    }

    @Test
    void positionalValueWithEqualsSignKeepsItsName() {
        assertEquals("{{echo|1=a=b}}", wikitext(transclusion(echo("{\"1\":{\"wt\":\"a=b\"}}"), "x")));
    }

    @Test
    void positionalNamesOutOfOrderAreWrittenExplicitly() {
        assertEquals("{{echo|2=b}}", wikitext(transclusion(echo("{\"2\":{\"wt\":\"b\"}}"), "x")));
    }

    @Test
    void recordedKeySpellingIsKept() {
        assertEquals(
            "{{echo| x =y}}",
            wikitext(transclusion(echo("{\"x\":{\"wt\":\"y\",\"key\":{\"wt\":\" x \"}}}"), "x"))
        );
    }

    @Test
    void htmlParameterValueIsSerialized() {
        assertEquals("{{echo|'''x'''}}", wikitext(transclusion(echo("{\"1\":{\"html\":\"<b>x</b>\"}}"), "x")));
    }

    @Test
    void templateArgumentUsesTripleBraces() {
        var dataMw = "{\"parts\":[{\"templatearg\":{\"target\":{\"wt\":\"a\"},\"params\":{\"1\":{\"wt\":\"d\"}},\"i\":0}}]}";
        assertEquals("{{{a|d}}}", wikitext(transclusion(dataMw, "d")));
    }

    @Test
    void literalPartsSurroundTheInvocation() {
        var dataMw = "{\"parts\":[\"pre \",{\"template\":{\"target\":{\"wt\":\"echo\"},\"params\":{},\"i\":0}},\" post\"]}";
        assertEquals("pre {{echo}} post", wikitext(transclusion(dataMw, "x")));
    }

    @Test
    void recordedSourceStandsInForMissingParts() {
        var result = serialize("<span about=\"#mwt1\" typeof=\"mw:Transclusion\" data-parsoid='{\"src\":\"{{foo}}\"}'>x</span>");
        assertEquals("{{foo}}", result.wikitext());
        assertTrue(result.diagnostics().stream().anyMatch(entry -> entry.logType().equals("error")));
    }

    @Test
    void transclusionWithoutDataFailsTheSerialization() {
        var result = serialize("<span about=\"#mwt1\" typeof=\"mw:Transclusion\">x</span>");
        assertFalse(result.isSuccess());
        assertEquals(SerializationException.MISSING_RECONSTRUCTION_DATA, result.errorCode());
        assertNull(result.wikitext());
        assertTrue(result.chunks().isEmpty());
        assertTrue(result.diagnostics().stream().anyMatch(entry -> entry.logType().equals("fatal/html2wt")));
    }

    @Test
    void serializeOrThrowPropagatesTheFailure() {
        var document = HtmlDocumentLoader.load("<span about=\"#mwt1\" typeof=\"mw:Param\">x</span>", null);
        var error = assertThrows(
            SerializationException.class,
            () -> new WikitextSerializer().serializeOrThrow(document, SerializerOptions.defaults())
        );
        assertEquals(SerializationException.MISSING_RECONSTRUCTION_DATA, error.code());
    }

    @Test
    void extensionTagIsRebuiltWithItsBody() {
        var html = "<sup about=\"#mwt2\" typeof=\"mw:Extension/ref\" "
            + "data-mw='{\"name\":\"ref\",\"attrs\":{\"name\":\"a\"},\"body\":{\"extsrc\":\"cite\"}}'>[1]</sup>";
        assertEquals("<ref name=\"a\">cite</ref>", wikitext(html));
    }

    @Test
    void extensionWithoutBodyIsSelfClosing() {
        var html = "<sup about=\"#mwt2\" typeof=\"mw:Extension/ref\" data-mw='{\"name\":\"ref\",\"attrs\":{\"name\":\"a\"}}'>[1]</sup>";
        assertEquals("<ref name=\"a\" />", wikitext(html));
    }

    @Test
    void extensionBodyHtmlIsPreferredOverItsSource() {
        var html = "<sup about=\"#mwt2\" typeof=\"mw:Extension/ref\" "
            + "data-mw='{\"name\":\"ref\",\"body\":{\"extsrc\":\"old\",\"html\":\"<i>new</i>\"}}'>[1]</sup>";
        assertEquals("<ref>''new''</ref>", wikitext(html));
    }

    @Test
    void extensionWithoutNameUsesItsTypeAndReportsIt() {
        var result = serialize("<div about=\"#mwt3\" typeof=\"mw:Extension/references\" data-mw='{}'></div>");
        assertEquals("<references />", result.wikitext());
        assertTrue(result.diagnostics().stream().anyMatch(entry -> entry.logType().equals("error")));
    }

    @Test
    void generatedReferencesAreDroppedInRoundTripTestMode() {
        var html = "<div about=\"#mwt3\" typeof=\"mw:Extension/references\" "
            + "data-parsoid='{\"autoInsertedRefs\":true}' data-mw='{\"name\":\"references\"}'></div>";
        assertEquals("", wikitext(html, null, SerializerOptions.builder().rtTestMode(true).build()));
    }

    @Test
    void sectionMarkerIsRebuiltFromItsContent() {
        assertEquals(
            "<section begin=\"s1\" />",
            wikitext("<meta about=\"#mwt4\" typeof=\"mw:Extension/LabeledSectionTransclusion/begin\" content=\"s1\">")
        );
    }

    @Test
    void placeholderRoundTripsItsSource() {
        assertEquals("{{!}}", wikitext("<span typeof=\"mw:Placeholder\" data-parsoid='{\"src\":\"{{!}}\"}'>|</span>"));
    }

    @Test
    void entityWithUnchangedContentUsesItsSource() {
        assertEquals(
            "&nbsp;",
            wikitext("<span typeof=\"mw:Entity\" data-parsoid='{\"src\":\"&amp;nbsp;\",\"srcContent\":\"\\u00a0\"}'>\u00a0</span>")
        );
    }

    @Test
    void editedEntityUsesItsNewContent() {
        assertEquals(
            "x",
            wikitext("<span typeof=\"mw:Entity\" data-parsoid='{\"src\":\"&amp;nbsp;\",\"srcContent\":\"\\u00a0\"}'>x</span>")
        );
    }
}
