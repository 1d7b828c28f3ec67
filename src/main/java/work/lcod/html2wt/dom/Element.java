package work.lcod.html2wt.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Element node with attributes, children and the provenance sidecar of the forward parser.
 */
public final class Element extends Node {
    private final String name;
    private final Map<String, String> attributes;
    private final List<Node> children;
    private final DataParsoid dataParsoid;
    private final DataMw dataMw;
    private final Set<DiffMark> diffMarks;
    private Boolean subtreeUnmodified;

    public Element(
        String name,
        Map<String, String> attributes,
        List<? extends Node> children,
        DataParsoid dataParsoid,
        DataMw dataMw,
        Set<DiffMark> diffMarks
    ) {
        this.name = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.dataParsoid = dataParsoid == null ? DataParsoid.NEW : dataParsoid;
        this.dataMw = dataMw;
        this.diffMarks = diffMarks == null || diffMarks.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(diffMarks));
        var attached = new ArrayList<Node>(children == null ? 0 : children.size());
        if (children != null) {
            for (Node child : children) {
                child.attach(this, attached.size());
                attached.add(child);
            }
        }
        this.children = Collections.unmodifiableList(attached);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String attr(String key) {
        return attributes.get(key);
    }

    public boolean hasAttr(String key) {
        return attributes.containsKey(key);
    }

    public List<Node> children() {
        return children;
    }

    public Node firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public Node lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    public DataParsoid dataParsoid() {
        return dataParsoid;
    }

    /**
     * Encapsulation data, {@link DataMw#EMPTY} when the element carries none.
     */
    public DataMw dataMw() {
        return dataMw == null ? DataMw.EMPTY : dataMw;
    }

    public Set<DiffMark> diffMarks() {
        return diffMarks;
    }

    public String typeOf() {
        var value = attributes.get("typeof");
        return value == null ? "" : value;
    }

    public String about() {
        return attributes.get("about");
    }

    /**
     * True when {@code typeof} contains {@code type} as a whitespace separated token.
     */
    public boolean hasTypeOf(String type) {
        for (String token : typeOf().split("\\s+")) {
            if (token.equals(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when this element and every element below it are unchanged since the parse.
     */
    public boolean subtreeUnmodified() {
        if (subtreeUnmodified == null) {
            boolean unmodified = !dataParsoid.isNew() && diffMarks.isEmpty();
            for (int i = 0; unmodified && i < children.size(); i++) {
                if (children.get(i) instanceof Element child && !child.subtreeUnmodified()) {
                    unmodified = false;
                }
            }
            subtreeUnmodified = unmodified;
        }
        return subtreeUnmodified;
    }

    @Override
    public String textContent() {
        var builder = new StringBuilder();
        appendText(this, builder);
        return builder.toString();
    }

    private static void appendText(Element element, StringBuilder builder) {
        for (Node child : element.children) {
            if (child instanceof Text text) {
                builder.append(text.value());
            } else if (child instanceof Element nested) {
                appendText(nested, builder);
            }
        }
    }

    /**
     * Short description used in diagnostics: the opening tag with its attributes.
     */
    public String describe() {
        var builder = new StringBuilder("<").append(name);
        for (var entry : attributes.entrySet()) {
            builder.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return builder.append('>').toString();
    }

    @Override
    public String toString() {
        return describe();
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Node> children = new ArrayList<>();
        private DataParsoid dataParsoid = DataParsoid.NEW;
        private DataMw dataMw;
        private final Set<DiffMark> diffMarks = EnumSet.noneOf(DiffMark.class);

        private Builder(String name) {
            this.name = name;
        }

        public Builder attr(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        public Builder child(Node child) {
            children.add(child);
            return this;
        }

        public Builder text(String value) {
            children.add(new Text(value));
            return this;
        }

        public Builder children(List<? extends Node> nodes) {
            children.addAll(nodes);
            return this;
        }

        public Builder dataParsoid(DataParsoid dataParsoid) {
            this.dataParsoid = dataParsoid;
            return this;
        }

        public Builder dataMw(DataMw dataMw) {
            this.dataMw = dataMw;
            return this;
        }

        public Builder diff(DiffMark mark) {
            diffMarks.add(mark);
            return this;
        }

        public Element build() {
            return new Element(name, attributes, children, dataParsoid, dataMw, diffMarks);
        }
    }
}
