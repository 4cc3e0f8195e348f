package ai.docsite.corpus.glossary;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks Japanese term candidates: katakana loanwords and kanji compounds. Hiragana is left out
 * since it mostly carries grammatical particles.
 */
public class TargetTermExtractor implements TermExtractor {

    private static final int MIN_LENGTH = 2;

    private final TokenScanner scanner = new TokenScanner(List.of(
            TokenPatterns.katakanaRun(2),
            TokenPatterns.kanjiWithKatakana(),
            TokenPatterns.kanjiRun(2)));

    @Override
    public List<String> extract(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String token : scanner.scan(text)) {
            if (CharClasses.isAllHiragana(token)) {
                continue;
            }
            if (token.codePointCount(0, token.length()) < MIN_LENGTH) {
                continue;
            }
            candidates.add(token);
        }
        return List.copyOf(candidates);
    }
}
