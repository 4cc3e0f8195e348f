package ai.docsite.corpus.quality;

/**
 * Sensitivity of the quality flags. Supplied by the caller, never hardcoded into the classifier.
 *
 * @param minRatio lowest acceptable target/source visible length ratio
 * @param maxRatio highest acceptable target/source visible length ratio
 * @param asciiThreshold share of ASCII among visible target characters from which a target counts as ASCII-heavy
 */
public record QualityThresholds(double minRatio, double maxRatio, double asciiThreshold) {

    public static final double DEFAULT_MIN_RATIO = 0.3;
    public static final double DEFAULT_MAX_RATIO = 2.5;
    public static final double DEFAULT_ASCII_THRESHOLD = 0.7;

    public QualityThresholds {
        requireFinite(minRatio, "minRatio");
        requireFinite(maxRatio, "maxRatio");
        requireFinite(asciiThreshold, "asciiThreshold");
        if (minRatio < 0) {
            throw new IllegalArgumentException("minRatio must be zero or greater");
        }
        if (minRatio > maxRatio) {
            throw new IllegalArgumentException("minRatio must not exceed maxRatio");
        }
        if (asciiThreshold < 0 || asciiThreshold > 1) {
            throw new IllegalArgumentException("asciiThreshold must be between 0 and 1");
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(DEFAULT_MIN_RATIO, DEFAULT_MAX_RATIO, DEFAULT_ASCII_THRESHOLD);
    }

    public boolean isRatioOutOfRange(double ratio) {
        return ratio < minRatio || ratio > maxRatio;
    }

    private static void requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite number");
        }
    }
}
