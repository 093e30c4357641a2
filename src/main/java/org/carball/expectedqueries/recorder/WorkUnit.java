package org.carball.expectedqueries.recorder;

/**
 * Code under observation. The checked exception type flows through
 * {@link QueryRecorder#run(WorkUnit)} unchanged.
 */
@FunctionalInterface
public interface WorkUnit<T, E extends Exception> {

    T run() throws E;
}
