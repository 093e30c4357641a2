package org.carball.expectedqueries.model.expectation;

import java.math.BigDecimal;

/**
 * A parsed comparison such as {@code "<= 2"}; {@code raw} keeps the text for messages.
 */
public record Comparison(ComparisonOperator operator, BigDecimal threshold, String raw) {

    public boolean isSatisfiedBy(double actual) {
        return operator.test(actual, threshold.doubleValue());
    }
}
