package ai.docsite.corpus.cli;

import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "export", mixinStandardHelpOptions = true,
        description = "Split a text file into sentences and write an XLIFF 1.2 translation.xml next to it")
public class ExportArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Path to the UTF-8 input text file")
    private Path input;

    @CommandLine.Option(names = "--lang", paramLabel = "CODE", defaultValue = "en",
            description = "Language tag used for sentence boundaries (default: en)")
    private String language = "en";

    public Path input() {
        return input;
    }

    public String language() {
        return language;
    }
}
