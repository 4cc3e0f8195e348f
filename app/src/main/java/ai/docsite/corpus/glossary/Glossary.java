package ai.docsite.corpus.glossary;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of a glossary run: aligned pairs plus the unmatched source and target candidates.
 * The list accessors return entries in report order.
 */
public final class Glossary {

    private final Map<TermPair, GlossaryPair> pairs;
    private final Map<String, TermCandidate> sourceUnmatched;
    private final Map<String, TermCandidate> targetUnmatched;

    Glossary(List<GlossaryPair> pairs, List<TermCandidate> sourceUnmatched, List<TermCandidate> targetUnmatched) {
        this.pairs = index(pairs, GlossaryPair::key, GlossaryPair.REPORT_ORDER);
        this.sourceUnmatched = index(sourceUnmatched, TermCandidate::term, TermCandidate.REPORT_ORDER);
        this.targetUnmatched = index(targetUnmatched, TermCandidate::term, TermCandidate.REPORT_ORDER);
    }

    public List<GlossaryPair> pairs() {
        return List.copyOf(pairs.values());
    }

    public List<TermCandidate> sourceUnmatched() {
        return List.copyOf(sourceUnmatched.values());
    }

    public List<TermCandidate> targetUnmatched() {
        return List.copyOf(targetUnmatched.values());
    }

    public Optional<GlossaryPair> pair(String sourceTerm, String targetTerm) {
        return Optional.ofNullable(pairs.get(new TermPair(sourceTerm, targetTerm)));
    }

    public Optional<TermCandidate> unmatchedSource(String term) {
        return Optional.ofNullable(sourceUnmatched.get(term));
    }

    public Optional<TermCandidate> unmatchedTarget(String term) {
        return Optional.ofNullable(targetUnmatched.get(term));
    }

    public boolean isEmpty() {
        return pairs.isEmpty() && sourceUnmatched.isEmpty() && targetUnmatched.isEmpty();
    }

    private static <K, V> Map<K, V> index(List<V> values, Function<V, K> key, Comparator<V> order) {
        Objects.requireNonNull(values, "values");
        return values.stream()
                .sorted(order)
                .collect(Collectors.toMap(key, Function.identity(), (left, right) -> {
                    throw new IllegalArgumentException("Duplicate glossary entry: " + key.apply(left));
                }, LinkedHashMap::new));
    }
}
