package ai.docsite.corpus.glossary;

import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A term that could not be aligned, with the ids of the units it appeared in.
 */
public record TermCandidate(String term, SortedSet<String> unitIds) {

    /**
     * Seen in the most units first, then alphabetical.
     */
    public static final Comparator<TermCandidate> REPORT_ORDER = Comparator
            .comparingInt(TermCandidate::count).reversed()
            .thenComparing(TermCandidate::term);

    public TermCandidate {
        Objects.requireNonNull(term, "term");
        unitIds = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(unitIds, "unitIds")));
    }

    public int count() {
        return unitIds.size();
    }
}
