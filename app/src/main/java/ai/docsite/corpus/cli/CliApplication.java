package ai.docsite.corpus.cli;

import ai.docsite.corpus.analysis.CorpusAnalysis;
import ai.docsite.corpus.analysis.CorpusAnalyzer;
import ai.docsite.corpus.config.Config;
import ai.docsite.corpus.config.ConfigLoader;
import ai.docsite.corpus.config.SystemEnvironmentReader;
import ai.docsite.corpus.glossary.Glossary;
import ai.docsite.corpus.glossary.GlossaryBuilder;
import ai.docsite.corpus.logging.LoggingConfigurator;
import ai.docsite.corpus.quality.QualityClassifier;
import ai.docsite.corpus.quality.QualityReport;
import ai.docsite.corpus.quality.QualityThresholds;
import ai.docsite.corpus.report.GlossaryReportWriter;
import ai.docsite.corpus.report.QualityJsonWriter;
import ai.docsite.corpus.report.QualityTsvWriter;
import ai.docsite.corpus.segment.BreakIteratorSentenceSegmenter;
import ai.docsite.corpus.segment.XliffExporter;
import ai.docsite.corpus.xliff.TargetTextExtractor;
import ai.docsite.corpus.xliff.UnitSequence;
import ai.docsite.corpus.xliff.XliffDocumentLoader;
import ai.docsite.corpus.xliff.XliffParseException;
import ai.docsite.corpus.xliff.XliffUnitExtractor;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the analyses.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 2;

    static final String TARGETS_FILE = "tgt.txt";
    static final String QUALITY_TSV_FILE = "quality.tsv";
    static final String QUALITY_JSON_FILE = "quality.json";

    private final ConfigLoader configLoader;
    private final XliffDocumentLoader documentLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), ConsoleStreams.utf8());
    }

    private CliApplication(ConfigLoader configLoader, ConsoleStreams streams) {
        this(configLoader, streams.out(), streams.err());
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.documentLoader = new XliffDocumentLoader();
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            ex.getCommandLine().usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (CommandLine.printHelpIfRequested(parseResult)) {
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (!parseResult.hasSubcommand()) {
            err.println("Missing command");
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        Object command = parseResult.subcommand().commandSpec().userObject();
        try {
            return dispatch(cliArguments, command);
        } catch (XliffParseException ex) {
            LOGGER.error("Aborting: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException ex) {
            LOGGER.error("Aborting: {}", ex.getMessage(), ex.getCause());
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int dispatch(CliArguments cliArguments, Object command) {
        if (command instanceof CheckArguments check) {
            return runCheck(configure(cliArguments, check.thresholds(), null), check);
        }
        if (command instanceof GlossaryArguments glossary) {
            return runGlossary(configure(cliArguments, null, glossary.outDir()), glossary);
        }
        if (command instanceof AnalyzeArguments analyze) {
            return runAnalyze(configure(cliArguments, analyze.thresholds(), analyze.outDir()), analyze);
        }
        if (command instanceof ExtractArguments extract) {
            configure(cliArguments, null, null);
            return runExtract(extract);
        }
        if (command instanceof ExportArguments export) {
            configure(cliArguments, null, null);
            return runExport(export);
        }
        throw new IllegalStateException("Unhandled command: " + command.getClass().getName());
    }

    private Config configure(CliArguments cliArguments, ThresholdOptions thresholds, Path outputDirectory) {
        Config config = configLoader.load(cliArguments, thresholds, outputDirectory);
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        return config;
    }

    private static QualityThresholds thresholds(Config config) {
        return config.thresholds().orElseGet(QualityThresholds::defaults);
    }

    private int runCheck(Config config, CheckArguments arguments) {
        if (!requireFile(arguments.xml())) {
            return EXIT_FAILURE;
        }
        UnitSequence units = new XliffUnitExtractor(documentLoader).extract(arguments.xml());
        QualityReport report = new QualityClassifier(thresholds(config)).analyze(units);

        QualityTsvWriter tsvWriter = new QualityTsvWriter();
        tsvWriter.writeUnits(report.units(), out);
        if (arguments.json() != null) {
            new QualityJsonWriter().write(report, arguments.json());
            LOGGER.info("Wrote JSON report to {}", arguments.json());
        }
        tsvWriter.writeSummary(report.summary(), err);
        return EXIT_OK;
    }

    private int runGlossary(Config config, GlossaryArguments arguments) {
        if (!requireFile(arguments.xml())) {
            return EXIT_FAILURE;
        }
        UnitSequence units = new XliffUnitExtractor(documentLoader).extract(arguments.xml());
        Glossary glossary = new GlossaryBuilder().build(units);
        List<Path> written = new GlossaryReportWriter().write(glossary, config.outputDirectory());
        written.forEach(path -> out.println("Wrote: " + path));
        return EXIT_OK;
    }

    private int runAnalyze(Config config, AnalyzeArguments arguments) {
        if (!requireFile(arguments.xml())) {
            return EXIT_FAILURE;
        }
        UnitSequence units = new XliffUnitExtractor(documentLoader).extract(arguments.xml());
        CorpusAnalyzer analyzer = new CorpusAnalyzer(new QualityClassifier(thresholds(config)), new GlossaryBuilder());
        CorpusAnalysis analysis = analyzer.analyze(units);

        Path directory = config.outputDirectory();
        Path tsv = directory.resolve(QUALITY_TSV_FILE);
        Path json = directory.resolve(QUALITY_JSON_FILE);
        new QualityTsvWriter().writeUnits(analysis.quality().units(), tsv);
        new QualityJsonWriter().write(analysis.quality(), json);
        out.println("Wrote: " + tsv);
        out.println("Wrote: " + json);
        new GlossaryReportWriter().write(analysis.glossary(), directory)
                .forEach(path -> out.println("Wrote: " + path));
        new QualityTsvWriter().writeSummary(analysis.quality().summary(), err);
        return EXIT_OK;
    }

    private int runExtract(ExtractArguments arguments) {
        if (!requireFile(arguments.xml())) {
            return EXIT_FAILURE;
        }
        Document document = documentLoader.load(arguments.xml());
        List<String> targets = new TargetTextExtractor().extract(document, arguments.noEmpty());

        String separator = unescapeSeparator(arguments.separator());
        StringBuilder content = new StringBuilder(String.join(separator, targets));
        if (!separator.endsWith("\n")) {
            content.append('\n');
        }
        Path output = arguments.xml().toAbsolutePath().resolveSibling(TARGETS_FILE);
        try {
            Files.writeString(output, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write to " + output, ex);
        }
        LOGGER.info("Wrote {} targets to {}", targets.size(), output);
        return EXIT_OK;
    }

    private int runExport(ExportArguments arguments) {
        if (!requireFile(arguments.input())) {
            return EXIT_FAILURE;
        }
        Locale locale = Locale.forLanguageTag(arguments.language());
        new XliffExporter(new BreakIteratorSentenceSegmenter(locale)).export(arguments.input());
        return EXIT_OK;
    }

    private boolean requireFile(Path path) {
        if (Files.isRegularFile(path)) {
            return true;
        }
        LOGGER.error("File not found: {}", path);
        err.println("Error: File not found: " + path);
        return false;
    }

    static String unescapeSeparator(String raw) {
        return switch (raw) {
            case "\\0" -> "\0";
            case "\\n" -> "\n";
            case "\\t" -> "\t";
            default -> raw;
        };
    }
}
