package ai.docsite.corpus.quality;

/**
 * Aggregate over all unit reports. Every value is zero when no unit was analyzed.
 */
public record QualitySummary(
        int units,
        int untranslated,
        int asciiHeavy,
        int ratioFlags,
        double avgRatio,
        double minRatio,
        double maxRatio
) {

    public static QualitySummary empty() {
        return new QualitySummary(0, 0, 0, 0, 0.0, 0.0, 0.0);
    }
}
