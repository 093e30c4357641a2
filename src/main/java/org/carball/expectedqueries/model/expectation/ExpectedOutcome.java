package org.carball.expectedqueries.model.expectation;

import org.carball.expectedqueries.model.statistics.Statistic;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * What a test expects for one table operation. Either "don't care", or a set of
 * statistic name to comparison text pairs. The comparison text is parsed only when the
 * outcome is evaluated, so a malformed entry for a table that never ran is not an error.
 */
public final class ExpectedOutcome {

    public static final ExpectedOutcome DONT_CARE = new ExpectedOutcome(null);

    private static final ExpectedOutcome EXPECT_NONE = count("0");

    private final Map<String, String> comparisons;

    private ExpectedOutcome(Map<String, String> comparisons) {
        this.comparisons = comparisons;
    }

    /**
     * Default for table operations nobody mentioned: exactly zero.
     */
    public static ExpectedOutcome none() {
        return EXPECT_NONE;
    }

    public static ExpectedOutcome count(String comparison) {
        return statistics(Map.of(Statistic.COUNT.key(), comparison));
    }

    public static ExpectedOutcome count(long exactCount) {
        return count(Long.toString(exactCount));
    }

    public static ExpectedOutcome statistics(Map<String, String> comparisons) {
        if (comparisons.isEmpty()) {
            throw new InvalidExpectationException("statistic expectation must name at least one statistic");
        }
        return new ExpectedOutcome(Collections.unmodifiableMap(new TreeMap<>(comparisons)));
    }

    /**
     * Converts the loosely typed value found in a nested map (hand built or loaded from
     * YAML/JSON): {@code null} means don't care, a number is an exact count, a string is a
     * count comparison and a map holds per-statistic comparisons.
     */
    public static ExpectedOutcome fromValue(Object value) {
        if (value == null) {
            return DONT_CARE;
        }
        if (value instanceof ExpectedOutcome outcome) {
            return outcome;
        }
        if (value instanceof Number || value instanceof CharSequence) {
            return count(scalarText(value));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, String> comparisons = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() == null) {
                    throw new InvalidExpectationException(
                            "statistic '" + entry.getKey() + "' has no comparison");
                }
                if (!(entry.getValue() instanceof Number || entry.getValue() instanceof CharSequence)) {
                    throw new InvalidExpectationException(
                            "comparison for statistic '" + entry.getKey() + "' must be a number or a string, got "
                                    + entry.getValue().getClass().getSimpleName());
                }
                comparisons.put(String.valueOf(entry.getKey()), scalarText(entry.getValue()));
            }
            return statistics(comparisons);
        }
        throw new InvalidExpectationException(
                "unsupported expected outcome type: " + value.getClass().getName());
    }

    public boolean isDontCare() {
        return comparisons == null;
    }

    /**
     * Statistic name to raw comparison text, sorted by statistic name.
     */
    public Map<String, String> getComparisons() {
        return comparisons == null ? Map.of() : comparisons;
    }

    private static String scalarText(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpectedOutcome other)) {
            return false;
        }
        return getComparisons().equals(other.getComparisons()) && isDontCare() == other.isDontCare();
    }

    @Override
    public int hashCode() {
        return isDontCare() ? 0 : comparisons.hashCode();
    }

    @Override
    public String toString() {
        return isDontCare() ? "don't care" : comparisons.toString();
    }
}
