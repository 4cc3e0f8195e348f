package ai.docsite.corpus.report;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.corpus.quality.QualitySummary;
import ai.docsite.corpus.quality.UnitReport;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QualityTsvWriterTest {

    private final QualityTsvWriter writer = new QualityTsvWriter();

    @Test
    void writesHeaderAndOneRowPerUnit() {
        StringWriter out = new StringWriter();

        writer.writeUnits(List.of(
                new UnitReport("1", 10, 10, 1.0, true, true, false, "Hello World", "Hello World"),
                new UnitReport("2", 18, 5, 5.0 / 18, false, false, true, "Site-19 Containment", "サイト収容")), out);

        assertThat(out.toString().split("\n")).containsExactly(
                "id\tsrc_chars\ttgt_chars\tratio\tuntranslated\tascii_heavy\tratio_flag\tsource_preview\ttarget_preview",
                "1\t10\t10\t1.000\t1\t1\t0\tHello World\tHello World",
                "2\t18\t5\t0.278\t0\t0\t1\tSite-19 Containment\tサイト収容");
    }

    @Test
    void roundsTheStoredBinaryValue() {
        assertThat(ReportValues.ratio(0.1235)).isEqualTo("0.123");
        assertThat(ReportValues.ratio(2.0005)).isEqualTo("2.001");
        assertThat(ReportValues.round(0.1235)).isEqualTo(0.123);
        assertThat(ReportValues.round(2.0)).isEqualTo(2.0);
    }

    @Test
    void summaryRatiosNeverUseScientificNotation() {
        StringWriter out = new StringWriter();

        writer.writeSummary(new QualitySummary(1, 0, 0, 1, 12345678.0, 0.0001, 12345678.0), out);

        assertThat(out.toString()).contains(
                "avg_ratio: 12345678.0\n",
                "min_ratio: 0.0\n",
                "max_ratio: 12345678.0\n");
    }

    @Test
    void keepsCellsOnOneLine() {
        StringWriter out = new StringWriter();

        writer.writeUnits(List.of(new UnitReport("a\tb", 1, 1, 1.0, false, false, false, "x\ty", "")), out);

        assertThat(out.toString().split("\n")).hasSize(2);
        assertThat(out.toString()).contains("a b\t1\t1\t1.000\t0\t0\t0\tx y\t\n");
    }

    @Test
    void writesSummaryAsKeyValueLines() {
        StringWriter out = new StringWriter();

        writer.writeSummary(new QualitySummary(3, 1, 1, 1, 1.0925925925925926, 5.0 / 18, 2.0), out);

        assertThat(out.toString()).isEqualTo("\n# Summary\n"
                + "units: 3\n"
                + "untranslated: 1\n"
                + "ascii_heavy: 1\n"
                + "ratio_flags: 1\n"
                + "avg_ratio: 1.093\n"
                + "min_ratio: 0.278\n"
                + "max_ratio: 2.0\n");
    }

    @Test
    void writesEmptySummaryAsZeros() {
        StringWriter out = new StringWriter();

        writer.writeSummary(QualitySummary.empty(), out);

        assertThat(out.toString()).contains("units: 0\n", "avg_ratio: 0.0\n", "max_ratio: 0.0\n");
    }

    @Test
    void createsParentDirectoriesForFileOutput(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("nested/dir/quality.tsv");

        writer.writeUnits(List.of(new UnitReport("1", 2, 2, 1.0, false, false, false, "ab", "ab")), target);

        assertThat(Files.readAllLines(target, StandardCharsets.UTF_8))
                .hasSize(2)
                .last().isEqualTo("1\t2\t2\t1.000\t0\t0\t0\tab\tab");
    }
}
