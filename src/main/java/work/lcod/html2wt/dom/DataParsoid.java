package work.lcod.html2wt.dom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-element provenance written by the forward parser ({@code data-parsoid}).
 * Read-only to the serializer.
 */
public record DataParsoid(
    SourceRange dsr,
    String stx,
    String stxV,
    String startTagSrc,
    String endTagSrc,
    String attrSepSrc,
    boolean autoInsertedStart,
    boolean autoInsertedEnd,
    String src,
    String srcContent,
    boolean strippedNL,
    boolean misnested,
    boolean autoInsertedRefs,
    int extraDashes,
    String magicSrc,
    String liHackSrc,
    boolean selfClose,
    Map<String, String> a,
    Map<String, String> sa,
    boolean isNew
) {
    /** Provenance of an element the editor inserted. */
    public static final DataParsoid NEW = builder().isNew(true).build();

    public DataParsoid {
        a = a == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(a));
        sa = sa == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sa));
    }

    public boolean hasValidDsr() {
        return dsr != null && dsr.isValid();
    }

    public boolean isLiteralHtml() {
        return "html".equals(stx);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SourceRange dsr;
        private String stx;
        private String stxV;
        private String startTagSrc;
        private String endTagSrc;
        private String attrSepSrc;
        private boolean autoInsertedStart;
        private boolean autoInsertedEnd;
        private String src;
        private String srcContent;
        private boolean strippedNL;
        private boolean misnested;
        private boolean autoInsertedRefs;
        private int extraDashes;
        private String magicSrc;
        private String liHackSrc;
        private boolean selfClose;
        private Map<String, String> a = new LinkedHashMap<>();
        private Map<String, String> sa = new LinkedHashMap<>();
        private boolean isNew;

        public Builder dsr(SourceRange dsr) {
            this.dsr = dsr;
            return this;
        }

        public Builder stx(String stx) {
            this.stx = stx;
            return this;
        }

        public Builder stxV(String stxV) {
            this.stxV = stxV;
            return this;
        }

        public Builder startTagSrc(String startTagSrc) {
            this.startTagSrc = startTagSrc;
            return this;
        }

        public Builder endTagSrc(String endTagSrc) {
            this.endTagSrc = endTagSrc;
            return this;
        }

        public Builder attrSepSrc(String attrSepSrc) {
            this.attrSepSrc = attrSepSrc;
            return this;
        }

        public Builder autoInsertedStart(boolean autoInsertedStart) {
            this.autoInsertedStart = autoInsertedStart;
            return this;
        }

        public Builder autoInsertedEnd(boolean autoInsertedEnd) {
            this.autoInsertedEnd = autoInsertedEnd;
            return this;
        }

        public Builder src(String src) {
            this.src = src;
            return this;
        }

        public Builder srcContent(String srcContent) {
            this.srcContent = srcContent;
            return this;
        }

        public Builder strippedNL(boolean strippedNL) {
            this.strippedNL = strippedNL;
            return this;
        }

        public Builder misnested(boolean misnested) {
            this.misnested = misnested;
            return this;
        }

        public Builder autoInsertedRefs(boolean autoInsertedRefs) {
            this.autoInsertedRefs = autoInsertedRefs;
            return this;
        }

        public Builder extraDashes(int extraDashes) {
            this.extraDashes = extraDashes;
            return this;
        }

        public Builder magicSrc(String magicSrc) {
            this.magicSrc = magicSrc;
            return this;
        }

        public Builder liHackSrc(String liHackSrc) {
            this.liHackSrc = liHackSrc;
            return this;
        }

        public Builder selfClose(boolean selfClose) {
            this.selfClose = selfClose;
            return this;
        }

        public Builder attributeValue(String key, String value) {
            this.a.put(key, value);
            return this;
        }

        public Builder attributeSource(String key, String value) {
            this.sa.put(key, value);
            return this;
        }

        public Builder isNew(boolean isNew) {
            this.isNew = isNew;
            return this;
        }

        public DataParsoid build() {
            return new DataParsoid(
                dsr,
                stx,
                stxV,
                startTagSrc,
                endTagSrc,
                attrSepSrc,
                autoInsertedStart,
                autoInsertedEnd,
                src,
                srcContent,
                strippedNL,
                misnested,
                autoInsertedRefs,
                extraDashes,
                magicSrc,
                liHackSrc,
                selfClose,
                a,
                sa,
                isNew
            );
        }
    }
}
