package work.lcod.html2wt.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.html2wt.support.SerializerTestSupport.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import work.lcod.html2wt.api.SerializerOptions;
import work.lcod.html2wt.dom.Document;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.HtmlDocumentLoader;
import work.lcod.html2wt.separator.NewlineConstraint;

final class SerializerStateTest {
    @Test
    void chunksKeepTheirOrigin() {
        var document = HtmlDocumentLoader.load("<p>a</p>", null);
        var sink = new ChunkBuffer();
        state(document, sink, SerializerOptions.defaults()).run();
        assertEquals("a\n", sink.text());
        var textChunk = sink.chunks().get(0);
        assertEquals("a", textChunk.text());
        assertSame(document.body().firstChild(), textChunk.origin().parent());
    }

    @Test
    void pendingSeparatorIsWrittenBeforeTheNextChunk() {
        var body = Element.builder("body").build();
        var sink = new ChunkBuffer();
        var state = state(Document.withoutSource(body), sink, SerializerOptions.defaults());
        state.emitChunk("a", body);
        state.separator().merge(NewlineConstraint.of(2, 2), body, body);
        state.emitChunk("b", body);
        assertEquals("a\n\nb", sink.text());
        assertTrue(state.separator().isEmpty());
    }

    @Test
    void singleLineContextTurnsNewlinesIntoSpaces() {
        var body = Element.builder("body").build();
        var sink = new ChunkBuffer();
        var state = state(Document.withoutSource(body), sink, SerializerOptions.defaults());
        state.singleLineContext().enforce();
        state.emitChunk("a\nb", body);
        state.singleLineContext().pop();
        state.emitChunk("\n", body);
        assertEquals("a b\n", sink.text());
    }

    @Test
    void outOfRangeSourceSliceIsRejected() {
        var body = Element.builder("body").build();
        var state = state(new Document(body, "abc"), new ChunkBuffer(), SerializerOptions.defaults());
        assertEquals("bc", state.originalSource(1, 3));
        var error = assertThrows(SerializationException.class, () -> state.originalSource(2, 9));
        assertEquals(SerializationException.INVALID_SOURCE_RANGE, error.code());
    }

    @Test
    void selserNeedsBothTheOptionAndTheSource() {
        var body = Element.builder("body").build();
        var withSource = new Document(body, "");
        assertTrue(state(withSource, new ChunkBuffer(), SerializerOptions.defaults()).selserMode());
        assertFalse(state(withSource, new ChunkBuffer(), SerializerOptions.builder().selser(false).build()).selserMode());
        var detached = Element.builder("body").build();
        assertFalse(state(Document.withoutSource(detached), new ChunkBuffer(), SerializerOptions.defaults()).selserMode());
    }

    @Test
    void escaperAppliesToTextBelowTheNode() {
        var document = HtmlDocumentLoader.load("<span>a<b>c</b></span>", null);
        var sink = new ChunkBuffer();
        var state = state(document, sink, SerializerOptions.defaults());
        List<String> seen = new ArrayList<>();
        var span = (Element) document.body().firstChild();
        state.serializeChildren(span, (text, node, current) -> {
            seen.add(text);
            return text.toUpperCase(Locale.ROOT);
        });
        assertEquals(List.of("a", "c"), seen);
        assertEquals("A'''C'''", sink.text());
    }

    @Test
    void childrenCanBeRenderedToAString() {
        var document = HtmlDocumentLoader.load("<span><i>x</i></span>", null);
        var state = state(document, new ChunkBuffer(), SerializerOptions.defaults());
        assertEquals("''x''", state.serializeChildrenToString((Element) document.body().firstChild()));
    }
}
