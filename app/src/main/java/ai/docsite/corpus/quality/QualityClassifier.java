package ai.docsite.corpus.quality;

import ai.docsite.corpus.text.TextNormalizer;
import ai.docsite.corpus.xliff.TranslationUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags likely untranslated, ASCII-heavy and length-anomalous translation units.
 *
 * <p>Classification is total: any string input, including empty strings, yields a report.
 */
public class QualityClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(QualityClassifier.class);
    static final int PREVIEW_LENGTH = 60;

    private final QualityThresholds thresholds;

    public QualityClassifier(QualityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public QualityThresholds thresholds() {
        return thresholds;
    }

    public QualityReport analyze(Iterable<TranslationUnit> units) {
        Objects.requireNonNull(units, "units");
        List<UnitReport> reports = new ArrayList<>();
        int untranslated = 0;
        int asciiHeavy = 0;
        int ratioFlags = 0;
        double ratioSum = 0.0;
        double minRatio = Double.POSITIVE_INFINITY;
        double maxRatio = Double.NEGATIVE_INFINITY;

        for (TranslationUnit unit : units) {
            UnitReport report = classify(unit);
            reports.add(report);
            if (report.untranslated()) {
                untranslated++;
            }
            if (report.asciiHeavy()) {
                asciiHeavy++;
            }
            if (report.ratioFlag()) {
                ratioFlags++;
            }
            ratioSum += report.ratio();
            minRatio = Math.min(minRatio, report.ratio());
            maxRatio = Math.max(maxRatio, report.ratio());
        }

        QualitySummary summary = reports.isEmpty()
                ? QualitySummary.empty()
                : new QualitySummary(reports.size(), untranslated, asciiHeavy, ratioFlags,
                        ratioSum / reports.size(), minRatio, maxRatio);
        LOGGER.info("Analyzed {} units: {} untranslated, {} ascii-heavy, {} ratio flags",
                summary.units(), summary.untranslated(), summary.asciiHeavy(), summary.ratioFlags());
        return new QualityReport(reports, summary);
    }

    public UnitReport classify(TranslationUnit unit) {
        String source = TextNormalizer.stripMarkup(unit.sourceText());
        String target = TextNormalizer.stripMarkup(unit.targetText());

        String sourceKey = TextNormalizer.normalize(source);
        boolean untranslated = !sourceKey.isEmpty() && sourceKey.equals(TextNormalizer.normalize(target));

        boolean asciiHeavy = TextNormalizer.asciiRatio(target) >= thresholds.asciiThreshold()
                && TextNormalizer.containsAsciiLetter(target);

        int sourceChars = Math.max(TextNormalizer.visibleLength(source), 1);
        int targetChars = TextNormalizer.visibleLength(target);
        double ratio = (double) targetChars / sourceChars;
        boolean ratioFlag = thresholds.isRatioOutOfRange(ratio);

        if (ratioFlag) {
            LOGGER.debug("Unit {} ratio {} outside [{}, {}]", unit.id(), ratio, thresholds.minRatio(), thresholds.maxRatio());
        }
        return new UnitReport(unit.id(), sourceChars, targetChars, ratio, untranslated, asciiHeavy, ratioFlag,
                TextNormalizer.preview(source, PREVIEW_LENGTH),
                TextNormalizer.preview(target, PREVIEW_LENGTH));
    }
}
