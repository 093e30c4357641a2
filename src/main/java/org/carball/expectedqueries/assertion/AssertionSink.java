package org.carball.expectedqueries.assertion;

/**
 * Receives the verdict of one expectation check.
 */
public interface AssertionSink {

    void pass(String message);

    void fail(String message);
}
