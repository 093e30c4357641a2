package org.carball.expectedqueries.trace;

/**
 * Receives synchronous notifications for every SQL statement a trace source observes.
 */
public interface QueryListener {

    /**
     * Called just before the statement executes.
     */
    void queryStarted(String sql);

    /**
     * Called once the statement has executed, whether or not it succeeded.
     */
    void queryEnded(String sql);
}
