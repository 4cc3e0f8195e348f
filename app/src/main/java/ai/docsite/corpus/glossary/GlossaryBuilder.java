package ai.docsite.corpus.glossary;

import ai.docsite.corpus.xliff.TranslationUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mines candidate terminology pairs from translation units.
 *
 * <p>A unit with exactly one source candidate and exactly one target candidate contributes a
 * pair. Any other unit puts each of its candidates into the matching unmatched bin instead.
 * There is no fuzzy matching and no cross-unit similarity, so the result does not depend on
 * the order of the units.
 */
public class GlossaryBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlossaryBuilder.class);

    private final TermExtractor sourceExtractor;
    private final TermExtractor targetExtractor;

    public GlossaryBuilder() {
        this(new SourceTermExtractor(), new TargetTermExtractor());
    }

    public GlossaryBuilder(TermExtractor sourceExtractor, TermExtractor targetExtractor) {
        this.sourceExtractor = Objects.requireNonNull(sourceExtractor, "sourceExtractor");
        this.targetExtractor = Objects.requireNonNull(targetExtractor, "targetExtractor");
    }

    public Glossary build(Iterable<TranslationUnit> units) {
        Objects.requireNonNull(units, "units");
        Map<TermPair, SortedSet<String>> pairIds = new HashMap<>();
        Map<TermPair, Integer> pairCounts = new HashMap<>();
        Map<String, SortedSet<String>> sourceUnmatched = new HashMap<>();
        Map<String, SortedSet<String>> targetUnmatched = new HashMap<>();
        int unitCount = 0;

        for (TranslationUnit unit : units) {
            unitCount++;
            List<String> sourceTerms = sourceExtractor.extract(unit.sourceText());
            List<String> targetTerms = targetExtractor.extract(unit.targetText());
            if (sourceTerms.size() == 1 && targetTerms.size() == 1) {
                TermPair key = new TermPair(sourceTerms.get(0), targetTerms.get(0));
                pairCounts.merge(key, 1, Integer::sum);
                pairIds.computeIfAbsent(key, ignored -> new TreeSet<>()).add(unit.id());
                continue;
            }
            for (String term : sourceTerms) {
                sourceUnmatched.computeIfAbsent(term, ignored -> new TreeSet<>()).add(unit.id());
            }
            for (String term : targetTerms) {
                targetUnmatched.computeIfAbsent(term, ignored -> new TreeSet<>()).add(unit.id());
            }
        }

        List<GlossaryPair> pairs = pairCounts.entrySet().stream()
                .map(entry -> new GlossaryPair(entry.getKey().sourceTerm(), entry.getKey().targetTerm(),
                        entry.getValue(), pairIds.get(entry.getKey())))
                .collect(Collectors.toList());
        LOGGER.info("Glossary over {} units: {} pairs, {} unmatched source terms, {} unmatched target terms",
                unitCount, pairs.size(), sourceUnmatched.size(), targetUnmatched.size());
        return new Glossary(pairs, candidates(sourceUnmatched), candidates(targetUnmatched));
    }

    private static List<TermCandidate> candidates(Map<String, SortedSet<String>> bins) {
        return bins.entrySet().stream()
                .map(entry -> new TermCandidate(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
