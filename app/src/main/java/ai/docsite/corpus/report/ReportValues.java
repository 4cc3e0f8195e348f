package ai.docsite.corpus.report;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;

/**
 * Formatting shared by the report sinks.
 */
final class ReportValues {

    private static final int RATIO_SCALE = 3;

    private ReportValues() {
    }

    // rounds the exact binary value, so 0.1235 (stored slightly below) becomes 0.123
    static double round(double ratio) {
        if (!Double.isFinite(ratio)) {
            return ratio;
        }
        return new BigDecimal(ratio).setScale(RATIO_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Rounded ratio in plain notation with at least one fractional digit, e.g. {@code 2.0} or {@code 10000000.0}.
     */
    static String plainRatio(double ratio) {
        double rounded = round(ratio);
        if (!Double.isFinite(rounded)) {
            return Double.toString(rounded);
        }
        String plain = BigDecimal.valueOf(rounded).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    static String ratio(double ratio) {
        return String.format(Locale.ROOT, "%.3f", round(ratio));
    }

    static String flag(boolean value) {
        return value ? "1" : "0";
    }

    static String ids(Collection<String> ids) {
        return String.join(",", ids);
    }

    // a cell must not break the row or column structure
    static String cell(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\t', ' ').replace('\r', ' ').replace('\n', ' ');
    }
}
