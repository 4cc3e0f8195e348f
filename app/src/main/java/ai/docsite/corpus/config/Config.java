package ai.docsite.corpus.config;

import ai.docsite.corpus.quality.QualityThresholds;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI options, environment values and defaults.
 *
 * <p>{@code thresholds} is present only for commands that classify units.
 */
public record Config(
        LogFormat logFormat,
        boolean verbose,
        Optional<QualityThresholds> thresholds,
        Path outputDirectory
) {

    public Config {
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        if (outputDirectory.toString().isBlank()) {
            throw new IllegalArgumentException("outputDirectory must not be blank");
        }
    }
}
