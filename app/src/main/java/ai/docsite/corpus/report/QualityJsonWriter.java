package ai.docsite.corpus.report;

import ai.docsite.corpus.quality.QualityReport;
import ai.docsite.corpus.quality.QualitySummary;
import ai.docsite.corpus.quality.UnitReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the quality report as {@code {"summary": {...}, "units": [...]}} with snake_case keys.
 * Non-ASCII text is written as-is; ratios are rounded to three decimals.
 */
public class QualityJsonWriter {

    private final ObjectMapper mapper;

    public QualityJsonWriter() {
        this(JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build());
    }

    QualityJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(QualityReport report, Path path) {
        try {
            QualityTsvWriter.createParent(path);
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(report, writer);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write quality JSON: " + path, ex);
        }
    }

    public void write(QualityReport report, Writer out) throws IOException {
        mapper.writeValue(out, toTree(report));
    }

    ObjectNode toTree(QualityReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.set("summary", summary(report.summary()));
        ArrayNode units = root.putArray("units");
        for (UnitReport unit : report.units()) {
            units.add(unit(unit));
        }
        return root;
    }

    private ObjectNode summary(QualitySummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("units", summary.units());
        node.put("untranslated", summary.untranslated());
        node.put("ascii_heavy", summary.asciiHeavy());
        node.put("ratio_flags", summary.ratioFlags());
        node.put("avg_ratio", ReportValues.round(summary.avgRatio()));
        node.put("min_ratio", ReportValues.round(summary.minRatio()));
        node.put("max_ratio", ReportValues.round(summary.maxRatio()));
        return node;
    }

    private ObjectNode unit(UnitReport unit) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", unit.id());
        node.put("source_chars", unit.sourceChars());
        node.put("target_chars", unit.targetChars());
        node.put("ratio", ReportValues.round(unit.ratio()));
        node.put("untranslated", unit.untranslated());
        node.put("ascii_heavy", unit.asciiHeavy());
        node.put("ratio_flag", unit.ratioFlag());
        node.put("source_preview", unit.sourcePreview());
        node.put("target_preview", unit.targetPreview());
        return node;
    }
}
