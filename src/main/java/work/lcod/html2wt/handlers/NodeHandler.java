package work.lcod.html2wt.handlers;

import java.util.Objects;
import work.lcod.html2wt.dom.Element;
import work.lcod.html2wt.dom.Node;
import work.lcod.html2wt.runtime.SerializerState;
import work.lcod.html2wt.separator.NewlineConstraint;

/**
 * Serialization routine for one {@link HandlerKey} plus the separator rules it imposes on its
 * neighbours.
 */
public record NodeHandler(
    Emitter emitter,
    boolean forceStartOfLine,
    SeparatorRule before,
    SeparatorRule after,
    SeparatorRule firstChild,
    SeparatorRule lastChild
) {
    /** Pass-through handler: emits nothing, has no separator opinion. */
    public static final NodeHandler NO_OP = builder((node, state, wrapperUnmodified) -> {}).build();

    public NodeHandler {
        Objects.requireNonNull(emitter, "emitter");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(firstChild, "firstChild");
        Objects.requireNonNull(lastChild, "lastChild");
    }

    public static Builder builder(Emitter emitter) {
        return new Builder(emitter);
    }

    @FunctionalInterface
    public interface Emitter {
        /**
         * @param wrapperUnmodified true when the element's own tags may be copied from the original source
         */
        void emit(Element node, SerializerState state, boolean wrapperUnmodified);
    }

    @FunctionalInterface
    public interface SeparatorRule {
        SeparatorRule NONE = constant(NewlineConstraint.NONE);

        /**
         * @param node the node owning this rule
         * @param otherNode the neighbour on the other side of the separator
         */
        NewlineConstraint apply(Node node, Node otherNode, SerializerState state);

        static SeparatorRule constant(NewlineConstraint constraint) {
            return (node, otherNode, state) -> constraint;
        }
    }

    public static final class Builder {
        private final Emitter emitter;
        private boolean forceStartOfLine;
        private SeparatorRule before = SeparatorRule.NONE;
        private SeparatorRule after = SeparatorRule.NONE;
        private SeparatorRule firstChild = SeparatorRule.NONE;
        private SeparatorRule lastChild = SeparatorRule.NONE;

        private Builder(Emitter emitter) {
            this.emitter = emitter;
        }

        public Builder forceStartOfLine() {
            this.forceStartOfLine = true;
            return this;
        }

        public Builder forceStartOfLine(boolean force) {
            this.forceStartOfLine = force;
            return this;
        }

        public Builder before(SeparatorRule rule) {
            this.before = rule;
            return this;
        }

        public Builder before(int min, int max) {
            return before(SeparatorRule.constant(NewlineConstraint.of(min, max)));
        }

        public Builder after(SeparatorRule rule) {
            this.after = rule;
            return this;
        }

        public Builder after(int min, int max) {
            return after(SeparatorRule.constant(NewlineConstraint.of(min, max)));
        }

        public Builder firstChild(SeparatorRule rule) {
            this.firstChild = rule;
            return this;
        }

        public Builder firstChild(int min, int max) {
            return firstChild(SeparatorRule.constant(NewlineConstraint.of(min, max)));
        }

        public Builder lastChild(SeparatorRule rule) {
            this.lastChild = rule;
            return this;
        }

        public Builder lastChild(int min, int max) {
            return lastChild(SeparatorRule.constant(NewlineConstraint.of(min, max)));
        }

        public NodeHandler build() {
            return new NodeHandler(emitter, forceStartOfLine, before, after, firstChild, lastChild);
        }
    }
}
