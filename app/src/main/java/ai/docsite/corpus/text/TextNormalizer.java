package ai.docsite.corpus.text;

import java.util.Locale;

/**
 * Stateless string helpers shared by the quality and glossary analyses.
 *
 * <p>All counting is done per Unicode code point. A code point counts as whitespace when
 * {@link Character#isWhitespace(int)} or {@link Character#isSpaceChar(int)} holds, so the
 * no-break space and the ideographic space are treated as whitespace too.
 */
public final class TextNormalizer {

    private static final String BOLD_MARKER = "**";
    private static final String ITALIC_MARKER = "//";

    private TextNormalizer() {
    }

    /**
     * Removes every {@code **} and {@code //} sequence. Markers do not need to be paired,
     * so a URL such as {@code https://example.com} loses its double slash as well.
     */
    public static String stripMarkup(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace(BOLD_MARKER, "").replace(ITALIC_MARKER, "");
    }

    /**
     * Comparison key: all whitespace removed, lower-cased. Never used for display.
     */
    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(value.length());
        value.codePoints()
                .filter(codePoint -> !isWhitespace(codePoint))
                .forEach(builder::appendCodePoint);
        return builder.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Number of visible (non-whitespace) code points.
     */
    public static int visibleLength(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        return (int) value.codePoints()
                .filter(codePoint -> !isWhitespace(codePoint))
                .count();
    }

    /**
     * Fraction of visible code points below 128. Returns {@code 0.0} when there is nothing visible.
     */
    public static double asciiRatio(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        int visible = 0;
        int ascii = 0;
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            i += Character.charCount(codePoint);
            if (isWhitespace(codePoint)) {
                continue;
            }
            visible++;
            if (codePoint < 128) {
                ascii++;
            }
        }
        return visible == 0 ? 0.0 : (double) ascii / visible;
    }

    /**
     * Whether the value contains at least one ASCII letter ({@code A-Z} or {@code a-z}).
     */
    public static boolean containsAsciiLetter(String value) {
        if (value == null) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if ((ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z')) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips surrounding whitespace, turns newlines into spaces and keeps the first
     * {@code maxCodePoints} code points.
     */
    public static String preview(String value, int maxCodePoints) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String flattened = trim(value).replace('\n', ' ');
        int codePoints = flattened.codePointCount(0, flattened.length());
        if (codePoints <= maxCodePoints) {
            return flattened;
        }
        return flattened.substring(0, flattened.offsetByCodePoints(0, maxCodePoints));
    }

    /**
     * Removes leading and trailing whitespace using the same definition as {@link #visibleLength(String)}.
     */
    public static String trim(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end) {
            int codePoint = value.codePointAt(start);
            if (!isWhitespace(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        while (end > start) {
            int codePoint = value.codePointBefore(end);
            if (!isWhitespace(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return value.substring(start, end);
    }

    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }
}
