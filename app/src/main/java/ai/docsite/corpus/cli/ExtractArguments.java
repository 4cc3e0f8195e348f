package ai.docsite.corpus.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Write the <target> texts of an XLIFF file to tgt.txt next to it")
public class ExtractArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "XML", description = "Path to the XLIFF file (1.x or 2.x)")
    private Path xml;

    @CommandLine.Option(names = "--sep", paramLabel = "SEP", defaultValue = "\n",
            description = "Separator between targets (default: newline). Use \\0 for NUL, \\t for tab")
    private String separator = "\n";

    @CommandLine.Option(names = "--no-empty", description = "Skip empty targets")
    private boolean noEmpty;

    public Path xml() {
        return xml;
    }

    public String separator() {
        return separator;
    }

    public boolean noEmpty() {
        return noEmpty;
    }
}
