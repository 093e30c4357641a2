package org.carball.expectedqueries.trace;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.query.Query;
import org.carball.expectedqueries.parser.SqlClassifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Turns start/end notifications into classified {@link Query} records. The duration is
 * the time between the latest start and the end, or 0 when no start was seen.
 */
@Slf4j
public class QueryCollector implements QueryListener {

    private static final long NO_START = Long.MIN_VALUE;

    private final SqlClassifier classifier;
    private final StackTraceCapture stackTraceCapture;
    private final LongSupplier nanoClock;
    private final List<Query> queries = new ArrayList<>();

    private long startNanos = NO_START;

    public QueryCollector(SqlClassifier classifier, StackTraceCapture stackTraceCapture) {
        this(classifier, stackTraceCapture, System::nanoTime);
    }

    /**
     * @param stackTraceCapture {@code null} to skip stack traces
     * @param nanoClock         monotonic clock in nanoseconds
     */
    public QueryCollector(SqlClassifier classifier, StackTraceCapture stackTraceCapture, LongSupplier nanoClock) {
        this.classifier = classifier;
        this.stackTraceCapture = stackTraceCapture;
        this.nanoClock = nanoClock;
    }

    @Override
    public void queryStarted(String sql) {
        startNanos = nanoClock.getAsLong();
    }

    @Override
    public void queryEnded(String sql) {
        double duration = startNanos == NO_START ? 0 : (nanoClock.getAsLong() - startNanos) / 1_000_000_000.0;
        startNanos = NO_START;

        Query query = new Query(sql, classifier.classify(sql), duration,
                stackTraceCapture == null ? "" : stackTraceCapture.capture());
        if (!query.isClassified()) {
            log.warn("Could not attribute query to a table: {}", query.sql());
        }
        queries.add(query);
    }

    public List<Query> getQueries() {
        return List.copyOf(queries);
    }

    /**
     * Returns everything collected so far and starts over.
     */
    public List<Query> drain() {
        List<Query> drained = List.copyOf(queries);
        queries.clear();
        return drained;
    }
}
