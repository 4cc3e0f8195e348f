package ai.docsite.corpus.cli;

import picocli.CommandLine;

/**
 * Quality flag thresholds shared by the commands that classify units. Unset options fall back
 * to the environment and then to the defaults.
 */
public class ThresholdOptions {

    @CommandLine.Option(names = "--min-ratio", paramLabel = "RATIO", description = "Minimum acceptable target/source character ratio (default: 0.3)")
    private Double minRatio;

    @CommandLine.Option(names = "--max-ratio", paramLabel = "RATIO", description = "Maximum acceptable target/source character ratio (default: 2.5)")
    private Double maxRatio;

    @CommandLine.Option(names = "--ascii-ratio", paramLabel = "RATIO", description = "ASCII share of the target from which it is marked ascii_heavy (default: 0.7)")
    private Double asciiRatio;

    public Double minRatio() {
        return minRatio;
    }

    public Double maxRatio() {
        return maxRatio;
    }

    public Double asciiRatio() {
        return asciiRatio;
    }
}
