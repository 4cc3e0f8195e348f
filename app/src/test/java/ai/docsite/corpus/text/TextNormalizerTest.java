package ai.docsite.corpus.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void stripMarkupRemovesEveryMarkerEvenWhenUnpaired() {
        assertThat(TextNormalizer.stripMarkup("**Bold** and //italic//")).isEqualTo("Bold and italic");
        assertThat(TextNormalizer.stripMarkup("see https://example.com")).isEqualTo("see https:example.com");
        assertThat(TextNormalizer.stripMarkup("a ** b")).isEqualTo("a  b");
        assertThat(TextNormalizer.stripMarkup(null)).isEmpty();
    }

    @Test
    void stripMarkupIsStableForNonOverlappingMarkers() {
        String once = TextNormalizer.stripMarkup("**x** //y// z");

        assertThat(TextNormalizer.stripMarkup(once)).isEqualTo(once);
    }

    @Test
    void normalizeRemovesAllWhitespaceAndLowerCases() {
        assertThat(TextNormalizer.normalize("  Hello \n\tWorld ")).isEqualTo("helloworld");
        assertThat(TextNormalizer.normalize("財団　本部")).isEqualTo("財団本部");
        assertThat(TextNormalizer.normalize("   ")).isEmpty();
    }

    @Test
    void visibleLengthIgnoresWhitespaceAndCountsCodePoints() {
        assertThat(TextNormalizer.visibleLength("Hello World")).isEqualTo(10);
        assertThat(TextNormalizer.visibleLength("a b\nc")).isEqualTo(3);
        assertThat(TextNormalizer.visibleLength("𠮷野家")).isEqualTo(3);
        assertThat(TextNormalizer.visibleLength("")).isZero();
    }

    @Test
    void asciiRatioCountsOnlyVisibleCharacters() {
        assertThat(TextNormalizer.asciiRatio("")).isEqualTo(0.0);
        assertThat(TextNormalizer.asciiRatio(" \n\t ")).isEqualTo(0.0);
        assertThat(TextNormalizer.asciiRatio("abc")).isEqualTo(1.0);
        assertThat(TextNormalizer.asciiRatio("ab 財団")).isCloseTo(0.5, within(1e-9));
        assertThat(TextNormalizer.asciiRatio("財団")).isEqualTo(0.0);
    }

    @Test
    void asciiLetterDetectionIgnoresDigitsAndPunctuation() {
        assertThat(TextNormalizer.containsAsciiLetter("123 !?")).isFalse();
        assertThat(TextNormalizer.containsAsciiLetter("12a")).isTrue();
        assertThat(TextNormalizer.containsAsciiLetter("ＡＢＣ")).isFalse();
    }

    @Test
    void previewTrimsFlattensAndTruncates() {
        String longText = "  " + "x".repeat(70) + "  ";

        assertThat(TextNormalizer.preview("  first\nsecond  ", 60)).isEqualTo("first second");
        assertThat(TextNormalizer.preview(longText, 60)).hasSize(60);
        assertThat(TextNormalizer.preview("", 60)).isEmpty();
    }
}
