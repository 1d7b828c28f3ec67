package work.lcod.html2wt.dom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class ElementTest {
    @Test
    void childrenKnowTheirSiblings() {
        var a = new Text("a");
        var b = new Text("b");
        var parent = Element.builder("p").child(a).child(b).build();
        assertSame(parent, a.parent());
        assertSame(b, a.nextSibling());
        assertSame(a, b.previousSibling());
        assertNull(b.nextSibling());
        assertEquals("ab", parent.textContent());
    }

    @Test
    void nodeCannotBeAttachedTwice() {
        var text = new Text("a");
        Element.builder("p").child(text).build();
        assertThrows(IllegalStateException.class, () -> Element.builder("div").child(text).build());
    }

    @Test
    void typeofTokensAreMatchedWhole() {
        var node = Element.builder("span").attr("typeof", "mw:Entity mw:Nowiki").build();
        assertTrue(node.hasTypeOf("mw:Nowiki"));
        assertFalse(node.hasTypeOf("mw:Now"));
    }

    @Test
    void subtreeIsModifiedWhenADescendantIsNew() {
        var old = DataParsoid.builder().dsr(SourceRange.of(0, 1, 0, 0)).build();
        var unchanged = new Element("p", null, List.of(new Text("a")), old, null, null);
        assertTrue(unchanged.subtreeUnmodified());
        var withNewChild = new Element("p", null, List.of(Element.builder("b").build()), old, null, null);
        assertFalse(withNewChild.subtreeUnmodified());
    }

    @Test
    void documentRootMustBeDetached() {
        var child = Element.builder("p").build();
        Element.builder("body").child(child).build();
        assertThrows(IllegalArgumentException.class, () -> new Document(child, null));
    }
}
