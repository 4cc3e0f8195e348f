package ai.docsite.corpus.glossary;

/**
 * Matches a token anchored at a given position.
 */
@FunctionalInterface
public interface TokenPattern {

    /**
     * @return the exclusive end index of the match starting at {@code start}, or {@code -1} when
     *         the pattern does not match there
     */
    int matchEnd(CharSequence text, int start);
}
