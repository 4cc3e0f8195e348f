package ai.docsite.corpus.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "analyze", mixinStandardHelpOptions = true,
        description = "Run the quality check and the glossary extraction together and write all reports to a directory")
public class AnalyzeArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "XML", description = "Path to the XLIFF file")
    private Path xml;

    @CommandLine.Mixin
    private ThresholdOptions thresholds = new ThresholdOptions();

    @CommandLine.Option(names = "--out-dir", paramLabel = "DIR", description = "Output directory (default: build/glossary)")
    private Path outDir;

    public Path xml() {
        return xml;
    }

    public ThresholdOptions thresholds() {
        return thresholds;
    }

    public Path outDir() {
        return outDir;
    }
}
