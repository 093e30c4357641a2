package org.carball.expectedqueries.parser;

import org.carball.expectedqueries.model.expectation.Comparison;
import org.carball.expectedqueries.model.expectation.ComparisonOperator;
import org.carball.expectedqueries.model.expectation.InvalidExpectationException;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses comparison text such as {@code "3"}, {@code "<= 2"} or {@code "< 0.5"}.
 */
public final class ComparisonParser {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    private static final Pattern EXACT_PATTERN = Pattern.compile("^\\s*" + NUMBER + "\\s*$");

    private static final Pattern OPERATOR_PATTERN = Pattern.compile("^\\s*(==|!=|>=|<=|>|<)\\s*" + NUMBER + "\\s*$");

    private ComparisonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @throws InvalidExpectationException if the text is not a non-negative number,
     *         optionally preceded by one of {@code == != > >= < <=}
     */
    public static Comparison parse(String raw) {
        if (raw == null) {
            throw new InvalidExpectationException("invalid comparison (null)");
        }

        Matcher exact = EXACT_PATTERN.matcher(raw);
        if (exact.matches()) {
            return new Comparison(ComparisonOperator.EQ, new BigDecimal(exact.group(1)), raw);
        }

        Matcher withOperator = OPERATOR_PATTERN.matcher(raw);
        if (withOperator.matches()) {
            ComparisonOperator operator = ComparisonOperator.fromSymbol(withOperator.group(1))
                    .orElseThrow(() -> new InvalidExpectationException("invalid comparison (" + raw + ")"));
            return new Comparison(operator, new BigDecimal(withOperator.group(2)), raw);
        }

        throw new InvalidExpectationException("invalid comparison (" + raw + ")");
    }
}
