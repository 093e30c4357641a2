package org.carball.expectedqueries.recorder;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.analyzer.ExpectationEvaluator;
import org.carball.expectedqueries.analyzer.StatisticsAggregator;
import org.carball.expectedqueries.assertion.AssertionSink;
import org.carball.expectedqueries.assertion.JUnitAssertionSink;
import org.carball.expectedqueries.config.RecorderConfig;
import org.carball.expectedqueries.model.expectation.ExpectationSpec;
import org.carball.expectedqueries.model.expectation.Violation;
import org.carball.expectedqueries.model.query.Query;
import org.carball.expectedqueries.model.statistics.StatSample;
import org.carball.expectedqueries.model.statistics.TableOperation;
import org.carball.expectedqueries.output.ExpectationReport;
import org.carball.expectedqueries.parser.SqlClassifier;
import org.carball.expectedqueries.trace.QueryCollector;
import org.carball.expectedqueries.trace.QueryTraceSource;
import org.carball.expectedqueries.trace.StackTraceCapture;
import org.carball.expectedqueries.trace.TraceRegistration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Collects the queries issued by one or more observed work units and tests them against
 * an expectation spec.
 * <pre>{@code
 * QueryRecorder queries = new QueryRecorder(tracingDataSource);
 * queries.run(() -> bookService.findAll());
 * queries.run(() -> authorService.create(author));
 * queries.test(ExpectationSpec.builder()
 *         .expect("book", "select", "<= 2")
 *         .dontCare("author", "insert")
 *         .build());
 * }</pre>
 * Not thread-safe; use one recorder per test.
 */
@Slf4j
public class QueryRecorder {

    private final QueryTraceSource traceSource;
    private final RecorderConfig config;
    private final AssertionSink assertionSink;
    private final SqlClassifier classifier;
    private final StackTraceCapture stackTraceCapture;

    private final List<Query> queries = new ArrayList<>();
    private SortedMap<TableOperation, StatSample> statistics;

    public QueryRecorder(QueryTraceSource traceSource) {
        this(traceSource, RecorderConfig.defaults(), new JUnitAssertionSink());
    }

    public QueryRecorder(QueryTraceSource traceSource, RecorderConfig config, AssertionSink assertionSink) {
        this.traceSource = traceSource;
        this.config = config;
        this.assertionSink = assertionSink;
        config.validate();
        this.classifier = SqlClassifier.forConfig(config);
        this.stackTraceCapture = config.isCaptureStackTraces()
                ? new StackTraceCapture(config.getStackTraceIgnore(), config.getMaxStackTraceFrames())
                : null;
    }

    /**
     * Runs {@code workUnit} while observing the trace source and returns its result. The
     * observation ends on every exit path; a failure of the work unit propagates as is and
     * the queries of that run are not kept.
     */
    public <T, E extends Exception> T run(WorkUnit<T, E> workUnit) throws E {
        QueryCollector collector = new QueryCollector(classifier, stackTraceCapture);

        T result;
        try (TraceRegistration ignored = traceSource.observe(collector)) {
            result = workUnit.run();
        }

        List<Query> collected = collector.drain();
        log.debug("Run collected {} queries", collected.size());
        addQueries(collected);
        return result;
    }

    /**
     * Appends queries observed elsewhere.
     */
    public void addQueries(List<Query> observed) {
        if (observed.isEmpty()) {
            return;
        }
        queries.addAll(observed);
        statistics = null;
    }

    public List<Query> getQueries() {
        return List.copyOf(queries);
    }

    public List<Query> getUnknownQueries() {
        return StatisticsAggregator.unknownQueries(queries);
    }

    /**
     * Statistics per table operation, recomputed after the query list changed.
     */
    public SortedMap<TableOperation, StatSample> getStatistics() {
        if (statistics == null) {
            statistics = StatisticsAggregator.aggregate(queries);
        }
        return statistics;
    }

    /**
     * Evaluates the collected queries without reporting or resetting anything.
     */
    public ExpectationReport check(ExpectationSpec expected) {
        List<Violation> violations = ExpectationEvaluator.evaluate(getStatistics(), expected);
        return new ExpectationReport(queries, violations);
    }

    /**
     * Tests the collected queries, reports the verdict to the assertion sink and starts
     * over with an empty query list.
     *
     * @return true if every expectation held
     * @throws org.carball.expectedqueries.model.expectation.InvalidExpectationException if
     *         {@code expected} is malformed; nothing is reported and nothing is reset
     */
    public boolean test(ExpectationSpec expected) {
        ExpectationReport report = check(expected);
        String message = report.toText();
        reset();

        if (report.isPassed()) {
            log.debug("Query expectations passed");
            assertionSink.pass(message);
            return true;
        }

        log.debug("Query expectations failed with {} violations", report.getViolations().size());
        assertionSink.fail(message);
        return false;
    }

    public boolean test(Map<String, ?> expected) {
        return test(ExpectationSpec.fromMap(expected));
    }

    public void reset() {
        queries.clear();
        statistics = null;
    }

    public RecorderConfig getConfig() {
        return config;
    }
}
