package ai.docsite.corpus.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "check", mixinStandardHelpOptions = true,
        description = "Check translation consistency and length differences; prints a TSV table to stdout")
public class CheckArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "XML", description = "Path to the XLIFF file (e.g. translation.xml)")
    private Path xml;

    @CommandLine.Mixin
    private ThresholdOptions thresholds = new ThresholdOptions();

    @CommandLine.Option(names = "--json", paramLabel = "PATH", description = "Also write the summary and per-unit details as JSON")
    private Path json;

    public Path xml() {
        return xml;
    }

    public ThresholdOptions thresholds() {
        return thresholds;
    }

    public Path json() {
        return json;
    }
}
