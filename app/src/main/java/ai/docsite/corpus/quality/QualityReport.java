package ai.docsite.corpus.quality;

import java.util.List;
import java.util.Objects;

/**
 * Per-unit reports in document order plus their summary.
 */
public record QualityReport(List<UnitReport> units, QualitySummary summary) {

    public QualityReport {
        units = List.copyOf(Objects.requireNonNull(units, "units"));
        Objects.requireNonNull(summary, "summary");
    }
}
