package ai.docsite.corpus.report;

import ai.docsite.corpus.glossary.Glossary;
import ai.docsite.corpus.glossary.GlossaryPair;
import ai.docsite.corpus.glossary.TermCandidate;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the three glossary tables into an output directory.
 */
public class GlossaryReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlossaryReportWriter.class);

    public static final String PAIRS_FILE = "glossary_pairs.tsv";
    public static final String SOURCE_UNMATCHED_FILE = "glossary_en_unmatched.tsv";
    public static final String TARGET_UNMATCHED_FILE = "glossary_ja_unmatched.tsv";

    /**
     * @return the written files, pairs first
     */
    public List<Path> write(Glossary glossary, Path outputDirectory) {
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create glossary directory: " + outputDirectory, ex);
        }
        Path pairs = outputDirectory.resolve(PAIRS_FILE);
        Path sourceUnmatched = outputDirectory.resolve(SOURCE_UNMATCHED_FILE);
        Path targetUnmatched = outputDirectory.resolve(TARGET_UNMATCHED_FILE);
        writeLines(pairs, pairLines(glossary.pairs()));
        writeLines(sourceUnmatched, candidateLines("en_term", glossary.sourceUnmatched()));
        writeLines(targetUnmatched, candidateLines("ja_term", glossary.targetUnmatched()));
        return List.of(pairs, sourceUnmatched, targetUnmatched);
    }

    static List<String> pairLines(List<GlossaryPair> pairs) {
        List<String> lines = new ArrayList<>(pairs.size() + 1);
        lines.add("source_term\ttarget_term\tcount\texample_ids");
        for (GlossaryPair pair : pairs) {
            lines.add(String.join("\t", pair.sourceTerm(), pair.targetTerm(),
                    Integer.toString(pair.count()), ReportValues.cell(ReportValues.ids(pair.exampleIds()))));
        }
        return lines;
    }

    static List<String> candidateLines(String header, List<TermCandidate> candidates) {
        List<String> lines = new ArrayList<>(candidates.size() + 1);
        lines.add(header + "\tcount\texample_ids");
        for (TermCandidate candidate : candidates) {
            lines.add(String.join("\t", candidate.term(), Integer.toString(candidate.count()),
                    ReportValues.cell(ReportValues.ids(candidate.unitIds()))));
        }
        return lines;
    }

    private static void writeLines(Path path, List<String> lines) {
        try {
            Files.writeString(path, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
            LOGGER.debug("Wrote {} rows to {}", lines.size() - 1, path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write glossary table: " + path, ex);
        }
    }
}
