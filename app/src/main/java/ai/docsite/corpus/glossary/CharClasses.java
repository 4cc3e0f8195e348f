package ai.docsite.corpus.glossary;

/**
 * Character class predicates used by the token patterns.
 */
final class CharClasses {

    private CharClasses() {
    }

    static boolean isUpperAscii(char ch) {
        return ch >= 'A' && ch <= 'Z';
    }

    static boolean isLowerAscii(char ch) {
        return ch >= 'a' && ch <= 'z';
    }

    static boolean isDigit(char ch) {
        return Character.isDigit(ch);
    }

    // U+30A1..U+30FA plus the prolonged sound mark U+30FC
    static boolean isKatakana(char ch) {
        return (ch >= '\u30A1' && ch <= '\u30FA') || ch == '\u30FC';
    }

    // CJK Unified Ideographs
    static boolean isKanji(char ch) {
        return ch >= '\u4E00' && ch <= '\u9FFF';
    }

    static boolean isHiragana(char ch) {
        return ch >= '\u3040' && ch <= '\u309F';
    }

    static boolean isAllHiragana(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!isHiragana(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
