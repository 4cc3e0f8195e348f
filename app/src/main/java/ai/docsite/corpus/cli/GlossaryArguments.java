package ai.docsite.corpus.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "glossary", mixinStandardHelpOptions = true,
        description = "Extract heuristic glossary pairs from an XLIFF file")
public class GlossaryArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "XML", description = "Path to the XLIFF file")
    private Path xml;

    @CommandLine.Option(names = "--out-dir", paramLabel = "DIR", description = "Output directory (default: build/glossary)")
    private Path outDir;

    public Path xml() {
        return xml;
    }

    public Path outDir() {
        return outDir;
    }
}
