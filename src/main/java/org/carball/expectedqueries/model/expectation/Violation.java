package org.carball.expectedqueries.model.expectation;

import org.carball.expectedqueries.model.query.SqlOperation;
import org.carball.expectedqueries.model.statistics.Statistic;

/**
 * One expectation that did not hold.
 */
public record Violation(
        String table,
        SqlOperation operation,
        Statistic statistic,
        String expectedOutcome,
        double actualValue,
        String message
) {}
