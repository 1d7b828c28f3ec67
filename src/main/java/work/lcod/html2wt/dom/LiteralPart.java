package work.lcod.html2wt.dom;

import java.util.Objects;

public record LiteralPart(String text) implements Part {
    public LiteralPart {
        Objects.requireNonNull(text, "text");
    }
}
