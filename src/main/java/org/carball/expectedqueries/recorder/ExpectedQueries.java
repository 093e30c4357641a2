package org.carball.expectedqueries.recorder;

import org.carball.expectedqueries.assertion.JUnitAssertionSink;
import org.carball.expectedqueries.config.ConfigurationLoader;
import org.carball.expectedqueries.config.RecorderConfig;
import org.carball.expectedqueries.model.expectation.ExpectationSpec;
import org.carball.expectedqueries.trace.QueryTraceSource;

import java.util.Map;

/**
 * One-call form of {@link QueryRecorder}: observe, test, return the work unit's result.
 * <pre>{@code
 * List<Book> books = expectedQueries(dataSource,
 *         () -> bookService.findAll(),
 *         Map.of("book", Map.of("select", "<= 2")));
 * }</pre>
 */
public final class ExpectedQueries {

    private ExpectedQueries() {
        // Utility class - prevent instantiation
    }

    /**
     * Uses configuration from system properties and environment; failures fail the JUnit test.
     */
    public static <T, E extends Exception> T expectedQueries(
            QueryTraceSource traceSource, WorkUnit<T, E> workUnit, ExpectationSpec expected) throws E {
        return expectedQueries(new QueryRecorder(traceSource, new ConfigurationLoader().loadConfiguration(),
                new JUnitAssertionSink()), workUnit, expected);
    }

    public static <T, E extends Exception> T expectedQueries(
            QueryTraceSource traceSource, WorkUnit<T, E> workUnit, Map<String, ?> expected) throws E {
        return expectedQueries(traceSource, workUnit, ExpectationSpec.fromMap(expected));
    }

    public static <T, E extends Exception> T expectedQueries(
            QueryTraceSource traceSource, RecorderConfig config, WorkUnit<T, E> workUnit,
            ExpectationSpec expected) throws E {
        return expectedQueries(new QueryRecorder(traceSource, config, new JUnitAssertionSink()), workUnit, expected);
    }

    /**
     * Runs and tests with an existing recorder, so callers can choose the assertion sink.
     */
    public static <T, E extends Exception> T expectedQueries(
            QueryRecorder recorder, WorkUnit<T, E> workUnit, ExpectationSpec expected) throws E {
        T result = recorder.run(workUnit);
        recorder.test(expected);
        return result;
    }
}
