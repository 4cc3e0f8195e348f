package ai.docsite.corpus.xliff;

import java.util.Objects;

/**
 * One source/target text pair extracted from an XLIFF document.
 *
 * <p>The id is not guaranteed to be unique within a document. Texts keep their interior
 * whitespace exactly as found in the document.
 */
public record TranslationUnit(String id, String sourceText, String targetText) {

    public TranslationUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(targetText, "targetText");
    }
}
