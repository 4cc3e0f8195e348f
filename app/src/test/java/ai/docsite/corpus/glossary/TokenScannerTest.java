package ai.docsite.corpus.glossary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenScannerTest {

    @Test
    void earlierPatternWinsAtTheSamePosition() {
        TokenScanner camelFirst = new TokenScanner(List.of(TokenPatterns.camelCase(), TokenPatterns.capitalizedWord()));
        TokenScanner wordFirst = new TokenScanner(List.of(TokenPatterns.capitalizedWord(), TokenPatterns.camelCase()));

        assertThat(camelFirst.scan("FooBar")).containsExactly("FooBar");
        assertThat(wordFirst.scan("FooBar")).containsExactly("Foo", "Bar");
    }

    @Test
    void resumesScanningAfterEachMatch() {
        TokenScanner scanner = new TokenScanner(List.of(TokenPatterns.literal("SCP"), TokenPatterns.upperRun(2)));

        assertThat(scanner.scan("SCPX-ABC d EF")).containsExactly("SCP", "ABC", "EF");
    }

    @Test
    void capitalizedWordWithDigitsNeedsAtLeastOneDigit() {
        TokenScanner scanner = new TokenScanner(List.of(TokenPatterns.capitalizedWithDigits()));

        assertThat(scanner.scan("Site19 and Site")).containsExactly("Site19");
    }

    @Test
    void kanjiRunHonoursMinimumLength() {
        TokenScanner scanner = new TokenScanner(List.of(TokenPatterns.kanjiRun(2)));

        assertThat(scanner.scan("猫と財団")).containsExactly("財団");
    }

    @Test
    void requiresAtLeastOnePattern() {
        assertThat(catchThrowable(() -> new TokenScanner(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
