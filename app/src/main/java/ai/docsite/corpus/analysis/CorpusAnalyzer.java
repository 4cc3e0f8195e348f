package ai.docsite.corpus.analysis;

import ai.docsite.corpus.glossary.Glossary;
import ai.docsite.corpus.glossary.GlossaryBuilder;
import ai.docsite.corpus.quality.QualityClassifier;
import ai.docsite.corpus.quality.QualityReport;
import ai.docsite.corpus.xliff.TranslationUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the quality classifier and the glossary builder side by side over the same units.
 *
 * <p>Both analyses only read the unit list and keep their own accumulators, so no locking is needed.
 */
public class CorpusAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusAnalyzer.class);

    private final QualityClassifier qualityClassifier;
    private final GlossaryBuilder glossaryBuilder;

    public CorpusAnalyzer(QualityClassifier qualityClassifier, GlossaryBuilder glossaryBuilder) {
        this.qualityClassifier = Objects.requireNonNull(qualityClassifier, "qualityClassifier");
        this.glossaryBuilder = Objects.requireNonNull(glossaryBuilder, "glossaryBuilder");
    }

    public CorpusAnalysis analyze(Iterable<TranslationUnit> source) {
        Objects.requireNonNull(source, "source");
        List<TranslationUnit> units = materialize(source);
        LOGGER.debug("Analyzing {} units with two workers", units.size());

        ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "corpus-analysis");
            thread.setDaemon(true);
            return thread;
        });
        try {
            CompletableFuture<QualityReport> quality =
                    CompletableFuture.supplyAsync(() -> qualityClassifier.analyze(units), executor);
            CompletableFuture<Glossary> glossary =
                    CompletableFuture.supplyAsync(() -> glossaryBuilder.build(units), executor);
            return new CorpusAnalysis(units.size(), quality.join(), glossary.join());
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Corpus analysis failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static List<TranslationUnit> materialize(Iterable<TranslationUnit> source) {
        if (source instanceof List<TranslationUnit> list) {
            return List.copyOf(list);
        }
        List<TranslationUnit> units = new ArrayList<>();
        source.forEach(units::add);
        return List.copyOf(units);
    }
}
