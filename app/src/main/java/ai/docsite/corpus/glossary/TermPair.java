package ai.docsite.corpus.glossary;

import java.util.Objects;

/**
 * Key of an aligned pair: the exact source and target strings.
 */
public record TermPair(String sourceTerm, String targetTerm) {

    public TermPair {
        Objects.requireNonNull(sourceTerm, "sourceTerm");
        Objects.requireNonNull(targetTerm, "targetTerm");
    }
}
