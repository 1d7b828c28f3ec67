package work.lcod.html2wt.html;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.html2wt.support.SerializerTestSupport.wikitext;

import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.SerializerOptions;
import work.lcod.html2wt.dom.Comment;
import work.lcod.html2wt.dom.Element;

final class HtmlElementHandlerTest {
    @Test
    void unknownElementIsWrittenAsHtml() {
        assertEquals("<div class=\"x\">a</div>", wikitext("<div class=\"x\">a</div>"));
    }

    @Test
    void voidElementIsSelfClosed() {
        assertEquals("<img src=\"x.png\" />", wikitext("<img src=\"x.png\">"));
    }

    @Test
    void recordedAttributeSourceIsReused() {
        var html = "<span class=\"a\" data-parsoid='{\"a\":{\"class\":\"a\"},\"sa\":{\"class\":\"{{cls}}\"}}'>x</span>";
        assertEquals("<span class=\"{{cls}}\">x</span>", wikitext(html));
    }

    @Test
    void unmodifiedWrapperCopiesItsTagsFromTheSource() {
        var source = "<span  class=a>x</span>";
        var html = "<span class=\"a\" data-parsoid='{\"stx\":\"html\",\"dsr\":[0,23,15,7]}' "
            + "data-parsoid-diff='{\"diff\":[\"subtree-changed\"]}'>y</span>";
        assertEquals("<span  class=a>y</span>", wikitext(html, source, SerializerOptions.defaults()));
    }

    @Test
    void listItemHackSourcePrecedesTheTag() {
        var html = "<ul><li class=\"x\" data-parsoid='{\"stx\":\"html\",\"liHackSrc\":\"* \"}'>a</li></ul>";
        assertEquals("* <li class=\"x\">a</li>", wikitext(html));
    }

    @Test
    void listItemHackAfterAWikiItemStartsANewLine() {
        var html = "<ul><li>a</li><li class=\"x\" data-parsoid='{\"stx\":\"html\",\"liHackSrc\":\"* \"}'>b</li></ul>";
        assertEquals("* a\n* <li class=\"x\">b</li>", wikitext(html));
    }

    @Test
    void outerHtmlEscapesTextAndKeepsComments() {
        var node = Element.builder("b")
            .text("a<b")
            .child(new Comment("c"))
            .build();
        assertEquals("<b>a&lt;b<!--c--></b>", HtmlTagSerializer.outerHtml(node));
    }

    @Test
    void lostLineIsRestoredForHtmlPre() {
        var pre = Element.builder("pre").text("\nx").build();
        assertEquals("\n", HtmlElementHandler.lostLine(pre));
        assertEquals("", HtmlElementHandler.lostLine(Element.builder("pre").text("x").build()));
    }
}
