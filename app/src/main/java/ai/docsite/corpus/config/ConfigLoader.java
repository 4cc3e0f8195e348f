package ai.docsite.corpus.config;

import ai.docsite.corpus.cli.CliArguments;
import ai.docsite.corpus.cli.ThresholdOptions;
import ai.docsite.corpus.quality.QualityThresholds;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_VERBOSE = "LOG_VERBOSE";
    static final String ENV_MIN_RATIO = "QUALITY_MIN_RATIO";
    static final String ENV_MAX_RATIO = "QUALITY_MAX_RATIO";
    static final String ENV_ASCII_THRESHOLD = "QUALITY_ASCII_THRESHOLD";
    static final String ENV_GLOSSARY_OUT_DIR = "GLOSSARY_OUT_DIR";

    static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("build", "glossary");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    /**
     * @param thresholdOptions threshold overrides of the selected command, or {@code null} when it has none;
     *        threshold environment values are then neither read nor validated
     * @param outputDirectory output directory given on the command line, or {@code null}
     */
    public Config load(CliArguments arguments, ThresholdOptions thresholdOptions, Path outputDirectory) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);

        Optional<QualityThresholds> thresholds = Optional.ofNullable(thresholdOptions).map(this::resolveThresholds);

        Path resolvedOutputDirectory = Optional.ofNullable(outputDirectory)
                .or(() -> environmentReader.getNonBlank(ENV_GLOSSARY_OUT_DIR).map(Path::of))
                .orElse(DEFAULT_OUTPUT_DIRECTORY);

        return new Config(logFormat, verbose, thresholds, resolvedOutputDirectory);
    }

    private QualityThresholds resolveThresholds(ThresholdOptions options) {
        double minRatio = resolveDouble(options.minRatio(), ENV_MIN_RATIO, QualityThresholds.DEFAULT_MIN_RATIO);
        double maxRatio = resolveDouble(options.maxRatio(), ENV_MAX_RATIO, QualityThresholds.DEFAULT_MAX_RATIO);
        double asciiThreshold = resolveDouble(options.asciiRatio(), ENV_ASCII_THRESHOLD,
                QualityThresholds.DEFAULT_ASCII_THRESHOLD);
        return new QualityThresholds(minRatio, maxRatio, asciiThreshold);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.getNonBlank(ENV_LOG_VERBOSE)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private double resolveDouble(Double cliValue, String envKey, double defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.getNonBlank(envKey)
                .map(raw -> parseDouble(envKey, raw))
                .orElse(defaultValue);
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }
}
