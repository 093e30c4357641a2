package org.carball.expectedqueries.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.expectation.Comparison;
import org.carball.expectedqueries.model.expectation.ExpectationSpec;
import org.carball.expectedqueries.model.expectation.ExpectedOutcome;
import org.carball.expectedqueries.model.expectation.InvalidExpectationException;
import org.carball.expectedqueries.model.expectation.Violation;
import org.carball.expectedqueries.model.statistics.StatSample;
import org.carball.expectedqueries.model.statistics.Statistic;
import org.carball.expectedqueries.model.statistics.TableOperation;
import org.carball.expectedqueries.parser.ComparisonParser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Checks aggregated statistics against an {@link ExpectationSpec}.
 * <p>
 * Only table operations that were actually observed are checked. A table named in the
 * spec that saw no queries is never evaluated, so this cannot verify that expected
 * queries ran at all.
 */
@Slf4j
public final class ExpectationEvaluator {

    private ExpectationEvaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns every violation, ordered by table, operation and statistic name.
     *
     * @throws InvalidExpectationException on the first malformed outcome; nothing is returned
     */
    public static List<Violation> evaluate(SortedMap<TableOperation, StatSample> statistics, ExpectationSpec expected) {
        List<Violation> violations = new ArrayList<>();

        for (Map.Entry<TableOperation, StatSample> entry : statistics.entrySet()) {
            TableOperation key = entry.getKey();
            ExpectedOutcome outcome = expected.resolve(key.table(), key.operation());
            if (outcome.isDontCare()) {
                log.debug("Skipping {} {}: any outcome accepted", key.table(), key.operation().key());
                continue;
            }

            for (Map.Entry<Statistic, String> check : normalize(outcome, key).entrySet()) {
                Statistic statistic = check.getKey();
                String rawOutcome = check.getValue();
                Comparison comparison = parse(rawOutcome, key);
                double actual = entry.getValue().get(statistic);

                if (comparison.isSatisfiedBy(actual)) {
                    log.debug("{} {} {}: '{}' satisfied by {}", key.table(), key.operation().key(),
                            statistic.key(), rawOutcome, formatValue(actual));
                    continue;
                }

                violations.add(new Violation(key.table(), key.operation(), statistic, rawOutcome, actual,
                        String.format("Expected %s '%s' %ss for table '%s', got '%s'",
                                statistic.key(), rawOutcome, key.operation().key(), key.table(), formatValue(actual))));
            }
        }

        return violations;
    }

    /**
     * Shortest plain rendering of a statistic: counts print as integers.
     */
    public static String formatValue(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static SortedMap<Statistic, String> normalize(ExpectedOutcome outcome, TableOperation key) {
        SortedMap<Statistic, String> checks = new TreeMap<>((a, b) -> a.key().compareTo(b.key()));
        for (Map.Entry<String, String> comparison : outcome.getComparisons().entrySet()) {
            try {
                checks.put(Statistic.fromKey(comparison.getKey()), comparison.getValue());
            } catch (InvalidExpectationException e) {
                log.error("Invalid expectation for {} {}: {}", key.table(), key.operation().key(), e.getMessage());
                throw e;
            }
        }
        return checks;
    }

    private static Comparison parse(String rawOutcome, TableOperation key) {
        try {
            return ComparisonParser.parse(rawOutcome);
        } catch (InvalidExpectationException e) {
            log.error("Invalid expectation for {} {}: {}", key.table(), key.operation().key(), e.getMessage());
            throw e;
        }
    }
}
