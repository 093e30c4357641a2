package org.carball.expectedqueries.assertion;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs verdicts instead of failing, for callers that act on the returned boolean.
 */
@Slf4j
public class LoggingAssertionSink implements AssertionSink {

    @Override
    public void pass(String message) {
        log.info("{}", message);
    }

    @Override
    public void fail(String message) {
        log.error("{}", message);
    }
}
