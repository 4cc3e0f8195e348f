package ai.docsite.corpus.glossary;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scans text left to right with an ordered list of patterns.
 *
 * <p>At each position the first pattern that matches wins and scanning resumes after the match;
 * when no pattern matches the scanner moves on by one character. Pattern order is therefore
 * the priority order between overlapping alternatives.
 */
public final class TokenScanner {

    private final List<TokenPattern> patterns;

    public TokenScanner(List<TokenPattern> patterns) {
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        if (this.patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be empty");
        }
    }

    public List<String> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        int position = 0;
        while (position < text.length()) {
            int end = matchAt(text, position);
            if (end > position) {
                tokens.add(text.substring(position, end));
                position = end;
            } else {
                position++;
            }
        }
        return tokens;
    }

    private int matchAt(String text, int position) {
        for (TokenPattern pattern : patterns) {
            int end = pattern.matchEnd(text, position);
            if (end > position) {
                return end;
            }
        }
        return -1;
    }
}
