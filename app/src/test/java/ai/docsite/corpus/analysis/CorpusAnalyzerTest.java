package ai.docsite.corpus.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import ai.docsite.corpus.glossary.GlossaryBuilder;
import ai.docsite.corpus.glossary.GlossaryPair;
import ai.docsite.corpus.glossary.TargetTermExtractor;
import ai.docsite.corpus.quality.QualityClassifier;
import ai.docsite.corpus.quality.QualityThresholds;
import ai.docsite.corpus.xliff.TranslationUnit;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class CorpusAnalyzerTest {

    private static final List<TranslationUnit> UNITS = List.of(
            new TranslationUnit("1", "Hello World", "Hello World"),
            new TranslationUnit("2", "see Keter", "ケテル"),
            new TranslationUnit("3", "see Keter", "ケテル"));

    @Test
    void runsBothAnalysesOverTheSameUnits() {
        CorpusAnalyzer analyzer = new CorpusAnalyzer(new QualityClassifier(QualityThresholds.defaults()), new GlossaryBuilder());

        CorpusAnalysis analysis = analyzer.analyze(UNITS);

        assertThat(analysis.unitCount()).isEqualTo(3);
        assertThat(analysis.quality().summary().units()).isEqualTo(3);
        assertThat(analysis.quality().summary().untranslated()).isEqualTo(1);
        assertThat(analysis.glossary().pairs())
                .extracting(GlossaryPair::sourceTerm, GlossaryPair::count)
                .containsExactly(tuple("Keter", 2));
    }

    @Test
    void singlePassSourceIsReadOnce() {
        Iterator<TranslationUnit> once = UNITS.iterator();
        Iterable<TranslationUnit> singlePass = () -> once;
        CorpusAnalyzer analyzer = new CorpusAnalyzer(new QualityClassifier(QualityThresholds.defaults()), new GlossaryBuilder());

        CorpusAnalysis analysis = analyzer.analyze(singlePass);

        assertThat(analysis.quality().units()).hasSize(3);
        assertThat(analysis.glossary().pair("Keter", "ケテル")).isPresent();
    }

    @Test
    void matchesSequentialResults() {
        QualityClassifier classifier = new QualityClassifier(QualityThresholds.defaults());
        GlossaryBuilder builder = new GlossaryBuilder();

        CorpusAnalysis analysis = new CorpusAnalyzer(classifier, builder).analyze(UNITS);

        assertThat(analysis.quality()).isEqualTo(classifier.analyze(UNITS));
        assertThat(analysis.glossary().pairs()).isEqualTo(builder.build(UNITS).pairs());
    }

    @Test
    void propagatesFailureOfEitherAnalysis() {
        GlossaryBuilder failing = new GlossaryBuilder(text -> {
            throw new IllegalStateException("extractor broke");
        }, new TargetTermExtractor());
        CorpusAnalyzer analyzer = new CorpusAnalyzer(new QualityClassifier(QualityThresholds.defaults()), failing);

        Throwable thrown = catchThrowable(() -> analyzer.analyze(UNITS));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("extractor broke");
    }
}
