package ai.docsite.corpus.cli;

import ai.docsite.corpus.config.LogFormat;
import picocli.CommandLine;

@CommandLine.Command(name = "xliff-corpus-analyzer", mixinStandardHelpOptions = true,
        description = "Heuristic quality checks and glossary mining for XLIFF corpora",
        subcommands = {
                CheckArguments.class,
                GlossaryArguments.class,
                AnalyzeArguments.class,
                ExtractArguments.class,
                ExportArguments.class
        })
public class CliArguments {

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
