package ai.docsite.corpus.xliff;

import org.w3c.dom.Document;

/**
 * The two incompatible XLIFF layouts understood by the extractor.
 */
public enum DocumentShape {
    /**
     * {@code trans-unit} elements with direct {@code source}/{@code target} children (XLIFF 1.x).
     */
    FLAT,
    /**
     * {@code unit} elements holding one or more {@code segment} children (XLIFF 2.x).
     */
    SEGMENTED;

    static final String TRANS_UNIT = "trans-unit";
    static final String UNIT = "unit";
    static final String SEGMENT = "segment";
    static final String SOURCE = "source";
    static final String TARGET = "target";

    /**
     * A single {@code trans-unit} anywhere in the document makes it {@link #FLAT}.
     */
    public static DocumentShape detect(Document document) {
        if (document.getElementsByTagNameNS("*", TRANS_UNIT).getLength() > 0) {
            return FLAT;
        }
        return SEGMENTED;
    }
}
