package ai.docsite.corpus.glossary;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks Latin-script term candidates: proper nouns, acronyms and designators such as {@code SCP}.
 */
public class SourceTermExtractor implements TermExtractor {

    static final Set<String> STOP_WORDS = Set.of(
            "The", "A", "An", "And", "Or", "But", "If", "Of", "For", "To", "In", "On", "At", "It",
            "You", "I", "We", "He", "She", "They", "Them", "Is", "Are", "Am", "Be", "Been", "Was", "Were",
            "This", "That", "These", "Those", "My", "Your", "Our", "Their", "With", "As", "Not",
            "Have", "Has", "Had", "Will", "Can", "Do", "Did", "So", "All", "Any");

    private static final int MIN_LENGTH = 2;

    private final TokenScanner scanner = new TokenScanner(List.of(
            TokenPatterns.literal("SCP"),
            TokenPatterns.capitalizedWord(),
            TokenPatterns.upperRun(2),
            TokenPatterns.camelCase(),
            TokenPatterns.capitalizedWithDigits()));

    @Override
    public List<String> extract(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String token : scanner.scan(text)) {
            String candidate = stripHyphens(token);
            if (candidate.codePointCount(0, candidate.length()) < MIN_LENGTH) {
                continue;
            }
            if (STOP_WORDS.contains(candidate)) {
                continue;
            }
            candidates.add(candidate);
        }
        return List.copyOf(candidates);
    }

    private static String stripHyphens(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '-') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '-') {
            end--;
        }
        return token.substring(start, end);
    }
}
