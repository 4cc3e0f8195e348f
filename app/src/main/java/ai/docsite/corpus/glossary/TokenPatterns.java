package ai.docsite.corpus.glossary;

import java.util.Objects;

/**
 * Named token patterns. Each one behaves like a greedy regular expression anchored at the start position.
 */
public final class TokenPatterns {

    private TokenPatterns() {
    }

    /**
     * The exact character sequence {@code literal}.
     */
    public static TokenPattern literal(String literal) {
        Objects.requireNonNull(literal, "literal");
        if (literal.isEmpty()) {
            throw new IllegalArgumentException("literal must not be empty");
        }
        return (text, start) -> startsWith(text, start, literal) ? start + literal.length() : -1;
    }

    /**
     * {@code Word} or {@code Word-Word}: an uppercase ASCII letter followed by lowercase ones,
     * optionally joined by a hyphen to a second capitalized word.
     */
    public static TokenPattern capitalizedWord() {
        return (text, start) -> {
            int end = capitalizedWordEnd(text, start);
            if (end < 0) {
                return -1;
            }
            if (end < text.length() && text.charAt(end) == '-') {
                int joined = capitalizedWordEnd(text, end + 1);
                if (joined > 0) {
                    return joined;
                }
            }
            return end;
        };
    }

    /**
     * A run of at least {@code minLength} uppercase ASCII letters.
     */
    public static TokenPattern upperRun(int minLength) {
        return (text, start) -> {
            int end = start;
            while (end < text.length() && CharClasses.isUpperAscii(text.charAt(end))) {
                end++;
            }
            return end - start >= minLength ? end : -1;
        };
    }

    /**
     * Two capitalized words written together, such as {@code CamelCase}.
     */
    public static TokenPattern camelCase() {
        return (text, start) -> {
            int first = capitalizedWordEnd(text, start);
            return first < 0 ? -1 : capitalizedWordEnd(text, first);
        };
    }

    /**
     * A capitalized word immediately followed by one or more digits, such as {@code Site19}.
     */
    public static TokenPattern capitalizedWithDigits() {
        return (text, start) -> {
            int word = capitalizedWordEnd(text, start);
            if (word < 0) {
                return -1;
            }
            int end = word;
            while (end < text.length() && CharClasses.isDigit(text.charAt(end))) {
                end++;
            }
            return end > word ? end : -1;
        };
    }

    /**
     * A run of at least {@code minLength} katakana characters (prolonged sound mark included).
     */
    public static TokenPattern katakanaRun(int minLength) {
        return (text, start) -> {
            int end = runEnd(text, start, Kind.KATAKANA);
            return end - start >= minLength ? end : -1;
        };
    }

    /**
     * One or more kanji optionally followed by katakana, such as {@code 財団} or {@code 実験データ}.
     */
    public static TokenPattern kanjiWithKatakana() {
        return (text, start) -> {
            int kanjiEnd = runEnd(text, start, Kind.KANJI);
            if (kanjiEnd == start) {
                return -1;
            }
            return runEnd(text, kanjiEnd, Kind.KATAKANA);
        };
    }

    /**
     * A run of at least {@code minLength} kanji.
     */
    public static TokenPattern kanjiRun(int minLength) {
        return (text, start) -> {
            int end = runEnd(text, start, Kind.KANJI);
            return end - start >= minLength ? end : -1;
        };
    }

    private static int capitalizedWordEnd(CharSequence text, int start) {
        if (start >= text.length() || !CharClasses.isUpperAscii(text.charAt(start))) {
            return -1;
        }
        int end = start + 1;
        while (end < text.length() && CharClasses.isLowerAscii(text.charAt(end))) {
            end++;
        }
        return end > start + 1 ? end : -1;
    }

    private static int runEnd(CharSequence text, int start, Kind kind) {
        int end = start;
        while (end < text.length() && kind.accepts(text.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean startsWith(CharSequence text, int start, String literal) {
        if (start + literal.length() > text.length()) {
            return false;
        }
        for (int i = 0; i < literal.length(); i++) {
            if (text.charAt(start + i) != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private enum Kind {
        KATAKANA,
        KANJI;

        boolean accepts(char ch) {
            return switch (this) {
                case KATAKANA -> CharClasses.isKatakana(ch);
                case KANJI -> CharClasses.isKanji(ch);
            };
        }
    }
}
