package org.carball.expectedqueries.model.statistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Durations (in seconds) of every query sharing one table and operation.
 * Derived values ignore sample order; mean, max and min are 0 when empty.
 */
public class StatSample {

    private final List<Double> samples = new ArrayList<>();

    public void add(double durationSeconds) {
        samples.add(durationSeconds);
    }

    public List<Double> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int count() {
        return samples.size();
    }

    /**
     * Sums in ascending order so the result does not depend on observation order.
     */
    public double sum() {
        List<Double> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        double sum = 0.0;
        for (double s : sorted) {
            sum += s;
        }
        return sum;
    }

    public double mean() {
        return samples.isEmpty() ? 0.0 : sum() / samples.size();
    }

    public double max() {
        return samples.isEmpty() ? 0.0 : Collections.max(samples);
    }

    public double min() {
        return samples.isEmpty() ? 0.0 : Collections.min(samples);
    }

    public double get(Statistic statistic) {
        return statistic.valueOf(this);
    }

    @Override
    public String toString() {
        return String.format("StatSample{count=%d, sum=%.6f, mean=%.6f, max=%.6f, min=%.6f}",
                count(), sum(), mean(), max(), min());
    }
}
