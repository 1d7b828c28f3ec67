package work.lcod.html2wt.api;

import java.util.Objects;

/**
 * Immutable engine options for one serialization.
 *
 * @param rtTestMode drop content the forward parser inserted on its own (auto-inserted tags, references)
 * @param maxNewlines ceiling used when a separator constraint has no upper bound
 * @param selser reuse original source for unmodified subtrees when the document carries its source
 * @param logLevel diagnostics threshold
 */
public record SerializerOptions(boolean rtTestMode, int maxNewlines, boolean selser, LogLevel logLevel) {
    public static final int DEFAULT_MAX_NEWLINES = 2;

    public SerializerOptions {
        Objects.requireNonNull(logLevel, "logLevel");
        if (maxNewlines < 0) {
            throw new IllegalArgumentException("maxNewlines must be non-negative: " + maxNewlines);
        }
    }

    public static SerializerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .rtTestMode(rtTestMode)
            .maxNewlines(maxNewlines)
            .selser(selser)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private boolean rtTestMode;
        private int maxNewlines = DEFAULT_MAX_NEWLINES;
        private boolean selser = true;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder rtTestMode(boolean rtTestMode) {
            this.rtTestMode = rtTestMode;
            return this;
        }

        public Builder maxNewlines(int maxNewlines) {
            this.maxNewlines = maxNewlines;
            return this;
        }

        public Builder selser(boolean selser) {
            this.selser = selser;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public SerializerOptions build() {
            return new SerializerOptions(rtTestMode, maxNewlines, selser, logLevel);
        }
    }
}
