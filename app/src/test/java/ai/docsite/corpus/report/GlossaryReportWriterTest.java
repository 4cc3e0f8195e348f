package ai.docsite.corpus.report;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.corpus.glossary.Glossary;
import ai.docsite.corpus.glossary.GlossaryBuilder;
import ai.docsite.corpus.xliff.TranslationUnit;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GlossaryReportWriterTest {

    @Test
    void writesThreeTablesIntoCreatedDirectory(@TempDir Path tempDir) throws Exception {
        Glossary glossary = new GlossaryBuilder().build(List.of(
                new TranslationUnit("2", "see Keter", "ケテル"),
                new TranslationUnit("1", "see Keter", "ケテル"),
                new TranslationUnit("3", "Alpha and Beta", "財団")));
        Path outDir = tempDir.resolve("build/glossary");

        List<Path> written = new GlossaryReportWriter().write(glossary, outDir);

        assertThat(written).containsExactly(
                outDir.resolve(GlossaryReportWriter.PAIRS_FILE),
                outDir.resolve(GlossaryReportWriter.SOURCE_UNMATCHED_FILE),
                outDir.resolve(GlossaryReportWriter.TARGET_UNMATCHED_FILE));
        assertThat(Files.readAllLines(written.get(0), StandardCharsets.UTF_8)).containsExactly(
                "source_term\ttarget_term\tcount\texample_ids",
                "Keter\tケテル\t2\t1,2");
        assertThat(Files.readAllLines(written.get(1), StandardCharsets.UTF_8)).containsExactly(
                "en_term\tcount\texample_ids",
                "Alpha\t1\t3",
                "Beta\t1\t3");
        assertThat(Files.readAllLines(written.get(2), StandardCharsets.UTF_8)).containsExactly(
                "ja_term\tcount\texample_ids",
                "財団\t1\t3");
    }

    @Test
    void emptyGlossaryWritesHeadersOnly(@TempDir Path tempDir) throws Exception {
        Glossary glossary = new GlossaryBuilder().build(List.of());

        List<Path> written = new GlossaryReportWriter().write(glossary, tempDir);

        for (Path path : written) {
            assertThat(Files.readAllLines(path, StandardCharsets.UTF_8)).hasSize(1);
        }
    }
}
