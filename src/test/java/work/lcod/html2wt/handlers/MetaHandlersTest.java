package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.html2wt.support.SerializerTestSupport.serialize;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;

final class MetaHandlersTest {
    @Test
    void behaviorSwitchUsesCanonicalSpelling() {
        assertEquals("__NOTOC__\n", wikitext("<meta property=\"mw:PageProp/notoc\">"));
    }

    @Test
    void behaviorSwitchPrefersRecordedSource() {
        assertEquals("__notoc__", MetaHandlers.behaviorSwitch("notoc", "__notoc__"));
        assertEquals("__NOTOC__", MetaHandlers.behaviorSwitch("notoc", null));
    }

    @Test
    void defaultSortWithoutSourceFallsBackToTheMagicWord() {
        var result = serialize("<meta property=\"mw:PageProp/categorydefaultsort\" content=\"Foo\">");
        assertEquals("{{DEFAULTSORT:Foo}}\n", result.wikitext());
        assertTrue(result.diagnostics().stream().anyMatch(entry -> entry.logType().equals("warn")));
    }

    @Test
    void defaultSortReusesItsSourcePrefix() {
        assertEquals(
            "{{DEFAULTSORTKEY:Bar}}",
            wikitext("<meta property=\"mw:PageProp/categorydefaultsort\" content=\"Bar\" data-parsoid='{\"src\":\"{{DEFAULTSORTKEY:Foo}}\"}'>")
        );
    }

    @Test
    void includeMarkersUseTheirSource() {
        assertEquals(
            "<noinclude>",
            wikitext("<meta typeof=\"mw:Includes/NoInclude\" data-parsoid='{\"src\":\"<noinclude>\"}'>")
        );
    }
}
