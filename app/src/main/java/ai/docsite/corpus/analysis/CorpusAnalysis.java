package ai.docsite.corpus.analysis;

import ai.docsite.corpus.glossary.Glossary;
import ai.docsite.corpus.quality.QualityReport;
import java.util.Objects;

/**
 * Outcome of running both analyses over one corpus.
 */
public record CorpusAnalysis(int unitCount, QualityReport quality, Glossary glossary) {

    public CorpusAnalysis {
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(glossary, "glossary");
    }
}
