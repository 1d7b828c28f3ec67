package work.lcod.html2wt.dom;

import java.util.Objects;

public final class Text extends Node {
    private final String value;

    public Text(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String value() {
        return value;
    }

    @Override
    public String textContent() {
        return value;
    }

    @Override
    public String toString() {
        return "#text(" + value.replace("\n", "\\n") + ")";
    }
}
