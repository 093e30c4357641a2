package org.carball.expectedqueries.assertion;

import org.junit.jupiter.api.Assertions;

/**
 * Fails the running JUnit test with the report as its message.
 */
public class JUnitAssertionSink implements AssertionSink {

    @Override
    public void pass(String message) {
        // nothing to do
    }

    @Override
    public void fail(String message) {
        Assertions.fail(message);
    }
}
