package org.carball.expectedqueries.trace;

/**
 * An active observation. Closing it stops delivery to the listener and restores whatever
 * listener was installed before. Closing more than once has no further effect.
 */
public interface TraceRegistration extends AutoCloseable {

    @Override
    void close();
}
