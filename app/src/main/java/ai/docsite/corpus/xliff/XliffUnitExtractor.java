package ai.docsite.corpus.xliff;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * Produces translation units from flat ({@code trans-unit}) or segmented ({@code unit/segment})
 * XLIFF documents. Elements are matched by local name; namespaces are ignored.
 */
public class XliffUnitExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(XliffUnitExtractor.class);

    private final XliffDocumentLoader loader;

    public XliffUnitExtractor() {
        this(new XliffDocumentLoader());
    }

    public XliffUnitExtractor(XliffDocumentLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Parses the file eagerly, so malformed XML fails here rather than during iteration.
     *
     * @throws XliffParseException when the file is not well-formed XML
     */
    public UnitSequence extract(Path xliffFile) {
        Document document = loader.load(xliffFile);
        UnitSequence units = extract(document);
        LOGGER.info("Reading {} as {} XLIFF", xliffFile, units.shape().name().toLowerCase(Locale.ROOT));
        return units;
    }

    public UnitSequence extract(Document document) {
        Objects.requireNonNull(document, "document");
        return new UnitSequence(document, DocumentShape.detect(document));
    }
}
