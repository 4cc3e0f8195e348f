package ai.docsite.corpus.glossary;

import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A candidate terminology pair with the number of units that aligned it and their ids.
 */
public record GlossaryPair(String sourceTerm, String targetTerm, int count, SortedSet<String> exampleIds) {

    /**
     * Most frequent first, then by source term, then by target term.
     */
    public static final Comparator<GlossaryPair> REPORT_ORDER = Comparator
            .comparingInt(GlossaryPair::count).reversed()
            .thenComparing(GlossaryPair::sourceTerm)
            .thenComparing(GlossaryPair::targetTerm);

    public GlossaryPair {
        Objects.requireNonNull(sourceTerm, "sourceTerm");
        Objects.requireNonNull(targetTerm, "targetTerm");
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        exampleIds = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(exampleIds, "exampleIds")));
    }

    public TermPair key() {
        return new TermPair(sourceTerm, targetTerm);
    }
}
