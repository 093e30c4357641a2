package org.carball.expectedqueries.model.statistics;

import org.carball.expectedqueries.model.expectation.InvalidExpectationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Statistics an expectation may compare against.
 */
public enum Statistic {
    COUNT(StatSample::count),
    MEAN(StatSample::mean),
    SUM(StatSample::sum),
    MAX(StatSample::max),
    MIN(StatSample::min);

    private final ToDoubleFunction<StatSample> reader;

    Statistic(ToDoubleFunction<StatSample> reader) {
        this.reader = reader;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public double valueOf(StatSample sample) {
        return reader.applyAsDouble(sample);
    }

    /**
     * Looks up a statistic by its lowercase name.
     *
     * @throws InvalidExpectationException for any other name
     */
    public static Statistic fromKey(String key) {
        if (key != null) {
            for (Statistic statistic : values()) {
                if (statistic.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                    return statistic;
                }
            }
        }
        throw new InvalidExpectationException(String.format(
                "unsupported statistic '%s' (expected one of %s)", key,
                Arrays.stream(values()).map(Statistic::key).collect(Collectors.joining(", "))));
    }
}
