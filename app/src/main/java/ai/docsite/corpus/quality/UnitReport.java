package ai.docsite.corpus.quality;

import java.util.Objects;

/**
 * Quality verdict for a single translation unit.
 *
 * <p>{@code sourceChars} is the visible source length after flooring to one, i.e. the divisor
 * actually used for {@code ratio}. {@code ratio} is kept unrounded; report sinks round it.
 */
public record UnitReport(
        String id,
        int sourceChars,
        int targetChars,
        double ratio,
        boolean untranslated,
        boolean asciiHeavy,
        boolean ratioFlag,
        String sourcePreview,
        String targetPreview
) {

    public UnitReport {
        Objects.requireNonNull(id, "id");
        sourcePreview = sourcePreview == null ? "" : sourcePreview;
        targetPreview = targetPreview == null ? "" : targetPreview;
    }

    public boolean hasIssue() {
        return untranslated || asciiHeavy || ratioFlag;
    }
}
