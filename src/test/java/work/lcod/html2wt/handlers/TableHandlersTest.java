package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.SerializerOptions;

final class TableHandlersTest {
    @Test
    void newTableUsesBlockCellSyntax() {
        assertEquals("{|\n|a\n|b\n|}\n", wikitext("<table><tr><td>a</td><td>b</td></tr></table>"));
    }

    @Test
    void tableAttributesFollowTheOpeningToken() {
        assertEquals(
            "{| class=\"wikitable\"\n|a\n|}\n",
            wikitext("<table class=\"wikitable\"><tr><td>a</td></tr></table>")
        );
    }

    @Test
    void secondRowGetsARowSeparator() {
        assertEquals(
            "{|\n|a\n|-\n|b\n|}\n",
            wikitext("<table><tr><td>a</td></tr><tr><td>b</td></tr></table>")
        );
    }

    @Test
    void rowSyntaxIsKeptWhenThePreviousCellMatches() {
        assertEquals(
            "{|\n|a||b\n|}\n",
            wikitext("<table><tr><td>a</td><td data-parsoid='{\"stx_v\":\"row\"}'>b</td></tr></table>")
        );
    }

    @Test
    void staleRowSyntaxFallsBackToBlockSyntax() {
        assertEquals(
            "{|\n!h\n|b\n|}\n",
            wikitext("<table><tr><th>h</th><td data-parsoid='{\"stx_v\":\"row\"}'>b</td></tr></table>")
        );
    }

    @Test
    void captionFollowsTheTableOpening() {
        assertEquals(
            "{|\n|+c\n|a\n|}\n",
            wikitext("<table><caption>c</caption><tr><td>a</td></tr></table>")
        );
    }

    @Test
    void unmodifiedTableReproducesItsSource() {
        var source = "{|\n|a||b\n|-\n!c\n!d\n|}";
        var html = "<table data-parsoid='{\"dsr\":[0,20,2,2]}'><tbody data-parsoid='{}'>"
            + "<tr data-parsoid='{}'><td data-parsoid='{}'>a</td><td data-parsoid='{\"stx_v\":\"row\"}'>b</td></tr>"
            + "<tr data-parsoid='{}'><th data-parsoid='{}'>c</th><th data-parsoid='{}'>d</th></tr>"
            + "</tbody></table>";
        assertEquals(source, wikitext(html, source, SerializerOptions.defaults()));
    }

    @Test
    void cellTextThatLooksLikeTableSyntaxIsEscaped() {
        assertEquals("{|\n|<nowiki>-</nowiki>x\n|}\n", wikitext("<table><tr><td>-x</td></tr></table>"));
        assertEquals("{|\n|a<nowiki>||</nowiki>b\n|}\n", wikitext("<table><tr><td>a||b</td></tr></table>"));
    }
}
