package org.carball.expectedqueries.model.expectation;

/**
 * A malformed expectation. This is a configuration error in the calling test,
 * never a test failure, and aborts evaluation.
 */
public class InvalidExpectationException extends IllegalArgumentException {

    public InvalidExpectationException(String message) {
        super(message);
    }

    public InvalidExpectationException(String message, Throwable cause) {
        super(message, cause);
    }
}
