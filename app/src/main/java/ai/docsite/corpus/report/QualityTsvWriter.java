package ai.docsite.corpus.report;

import ai.docsite.corpus.quality.QualitySummary;
import ai.docsite.corpus.quality.UnitReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes per-unit quality rows as tab-separated values and the summary as {@code key: value} lines.
 */
public class QualityTsvWriter {

    static final List<String> HEADER = List.of(
            "id", "src_chars", "tgt_chars", "ratio", "untranslated", "ascii_heavy", "ratio_flag",
            "source_preview", "target_preview");

    public void writeUnits(List<UnitReport> reports, Writer out) {
        try {
            out.write(String.join("\t", HEADER));
            out.write('\n');
            for (UnitReport report : reports) {
                out.write(String.join("\t",
                        ReportValues.cell(report.id()),
                        Integer.toString(report.sourceChars()),
                        Integer.toString(report.targetChars()),
                        ReportValues.ratio(report.ratio()),
                        ReportValues.flag(report.untranslated()),
                        ReportValues.flag(report.asciiHeavy()),
                        ReportValues.flag(report.ratioFlag()),
                        ReportValues.cell(report.sourcePreview()),
                        ReportValues.cell(report.targetPreview())));
                out.write('\n');
            }
            out.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write quality rows", ex);
        }
    }

    public void writeUnits(List<UnitReport> reports, Path path) {
        try {
            createParent(path);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writeUnits(reports, writer);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write quality report: " + path, ex);
        }
    }

    public void writeSummary(QualitySummary summary, Writer out) {
        try {
            out.write("\n# Summary\n");
            line(out, "units", Integer.toString(summary.units()));
            line(out, "untranslated", Integer.toString(summary.untranslated()));
            line(out, "ascii_heavy", Integer.toString(summary.asciiHeavy()));
            line(out, "ratio_flags", Integer.toString(summary.ratioFlags()));
            line(out, "avg_ratio", ReportValues.plainRatio(summary.avgRatio()));
            line(out, "min_ratio", ReportValues.plainRatio(summary.minRatio()));
            line(out, "max_ratio", ReportValues.plainRatio(summary.maxRatio()));
            out.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write quality summary", ex);
        }
    }

    private static void line(Writer out, String key, String value) throws IOException {
        out.write(key);
        out.write(": ");
        out.write(value);
        out.write('\n');
    }

    static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
