package ai.docsite.corpus.xliff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XliffUnitExtractorTest {

    private static final String FLAT = """
            <?xml version="1.0" encoding="UTF-8"?>
            <xliff version="1.2" xmlns="urn:oasis:names:tc:xliff:document:1.2">
              <file source-language="en-US" target-language="ja" datatype="plaintext" original="doc.txt">
                <body>
                  <trans-unit id="1">
                    <source>Hello <g id="b">World</g></source>
                    <target>こんにちは<g id="b">世界</g></target>
                  </trans-unit>
                  <trans-unit id="2">
                    <source>Only a source</source>
                  </trans-unit>
                  <trans-unit id="3">
                    <source xml:space="preserve">line one
              line two</source>
                    <target><![CDATA[一行目]]></target>
                  </trans-unit>
                </body>
              </file>
            </xliff>
            """;

    private static final String SEGMENTED = """
            <xliff xmlns="urn:oasis:names:tc:xliff:document:2.0" version="2.0" srcLang="en" trgLang="ja">
              <file id="f1">
                <unit id="u1">
                  <segment><source>One</source><target>一</target></segment>
                </unit>
                <unit id="u2">
                  <segment><source>First.</source><target>最初。</target></segment>
                  <ignorable><source> </source></ignorable>
                  <segment><source>Second.</source><target>二番目。</target></segment>
                </unit>
                <unit id="u3">
                  <segment><source>No target here</source></segment>
                </unit>
                <unit id="u4">
                  <group><segment><source>Nested</source><target>入れ子</target></segment></group>
                </unit>
              </file>
            </xliff>
            """;

    private final XliffDocumentLoader loader = new XliffDocumentLoader();
    private final XliffUnitExtractor extractor = new XliffUnitExtractor(loader);

    @TempDir
    Path tempDir;

    @Test
    void extractsFlatUnitsAndSkipsIncompleteOnes() {
        UnitSequence units = extractor.extract(loader.parse(FLAT));

        assertThat(units.shape()).isEqualTo(DocumentShape.FLAT);
        assertThat(units.toList())
                .extracting(TranslationUnit::id, TranslationUnit::sourceText, TranslationUnit::targetText)
                .containsExactly(
                        tuple("1", "Hello World", "こんにちは世界"),
                        tuple("3", "line one\n  line two", "一行目"));
    }

    @Test
    void extractsSegmentedUnitsWithSegmentSuffixes() {
        UnitSequence units = extractor.extract(loader.parse(SEGMENTED));

        assertThat(units.shape()).isEqualTo(DocumentShape.SEGMENTED);
        assertThat(units.toList())
                .extracting(TranslationUnit::id, TranslationUnit::sourceText, TranslationUnit::targetText)
                .containsExactly(
                        tuple("u1", "One", "一"),
                        tuple("u2:1", "First.", "最初。"),
                        tuple("u2:2", "Second.", "二番目。"),
                        tuple("u4", "Nested", "入れ子"));
    }

    @Test
    void findsSourceAndTargetNestedDeeperInsideSegment() {
        String nested = """
                <xliff version="2.0">
                  <file id="f">
                    <unit id="n">
                      <segment>
                        <group><source>Deep</source></group>
                        <group><target>深い</target></group>
                      </segment>
                    </unit>
                  </file>
                </xliff>
                """;

        assertThat(extractor.extract(loader.parse(nested)).toList())
                .containsExactly(new TranslationUnit("n", "Deep", "深い"));
    }

    @Test
    void skippedSegmentKeepsItsPositionInTheNumbering() {
        String unit = """
                <xliff version="2.0">
                  <unit id="u">
                    <segment><mrk><source>A</source><target>B</target></mrk></segment>
                    <segment><source>Untranslated</source></segment>
                    <segment><source>C</source><target>D</target></segment>
                  </unit>
                </xliff>
                """;

        assertThat(extractor.extract(loader.parse(unit)).toList())
                .extracting(TranslationUnit::id, TranslationUnit::sourceText, TranslationUnit::targetText)
                .containsExactly(
                        tuple("u:1", "A", "B"),
                        tuple("u:3", "C", "D"));
    }

    @Test
    void flatUnitsTakePriorityOverSegmentedUnits() {
        String mixed = """
                <xliff>
                  <trans-unit id="flat"><source>A</source><target>B</target></trans-unit>
                  <unit id="seg"><segment><source>C</source><target>D</target></segment></unit>
                </xliff>
                """;

        UnitSequence units = extractor.extract(loader.parse(mixed));

        assertThat(units.shape()).isEqualTo(DocumentShape.FLAT);
        assertThat(units.toList()).extracting(TranslationUnit::id).containsExactly("flat");
    }

    @Test
    void matchesElementsByLocalNameWhateverThePrefix() {
        String prefixed = """
                <x:xliff xmlns:x="urn:example">
                  <x:trans-unit id="p"><x:source>Source</x:source><x:target>Target</x:target></x:trans-unit>
                </x:xliff>
                """;

        assertThat(extractor.extract(loader.parse(prefixed)).toList())
                .containsExactly(new TranslationUnit("p", "Source", "Target"));
    }

    @Test
    void elementNamesAreCaseSensitive() {
        String wrongCase = """
                <xliff><trans-unit id="1"><Source>A</Source><Target>B</Target></trans-unit></xliff>
                """;

        assertThat(extractor.extract(loader.parse(wrongCase)).toList()).isEmpty();
    }

    @Test
    void missingIdBecomesEmptyString() {
        String noId = "<xliff><trans-unit><source>A</source><target>B</target></trans-unit></xliff>";

        assertThat(extractor.extract(loader.parse(noId)).toList())
                .containsExactly(new TranslationUnit("", "A", "B"));
    }

    @Test
    void sequenceCanBeIteratedRepeatedly() {
        UnitSequence units = extractor.extract(loader.parse(SEGMENTED));

        List<TranslationUnit> first = units.toList();
        List<TranslationUnit> second = units.stream().toList();

        assertThat(second).isEqualTo(first).hasSize(4);
    }

    @Test
    void malformedXmlIsFatal() {
        Throwable thrown = catchThrowable(() -> loader.parse("<xliff><trans-unit id='1'><source>x</source></xliff>"));

        assertThat(thrown).isInstanceOf(XliffParseException.class);
    }

    @Test
    void readsDocumentFromFile() throws Exception {
        Path file = tempDir.resolve("translation.xml");
        Files.writeString(file, FLAT, StandardCharsets.UTF_8);

        UnitSequence units = extractor.extract(file);

        assertThat(units.toList()).hasSize(2);
    }

    @Test
    void missingFileSurfacesAsIoFailure() {
        Throwable thrown = catchThrowable(() -> extractor.extract(tempDir.resolve("missing.xml")));

        assertThat(thrown).isInstanceOf(UncheckedIOException.class);
    }
}
