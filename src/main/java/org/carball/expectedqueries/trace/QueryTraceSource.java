package org.carball.expectedqueries.trace;

/**
 * Something that can report the SQL statements executed while it is observed.
 */
public interface QueryTraceSource {

    /**
     * Starts delivering statements to {@code listener} until the returned registration is closed.
     */
    TraceRegistration observe(QueryListener listener);
}
