package org.carball.expectedqueries.trace;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the currently installed listener. Installing a listener replaces the previous
 * one; closing the registration puts the previous one back, so observations nest.
 */
@Slf4j
public abstract class AbstractQueryTraceSource implements QueryTraceSource {

    private volatile QueryListener listener;

    @Override
    public TraceRegistration observe(QueryListener newListener) {
        if (newListener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        QueryListener previous = listener;
        listener = newListener;
        log.debug("Started observing queries on {}", this);
        return new Registration(newListener, previous);
    }

    public boolean isObserved() {
        return listener != null;
    }

    protected void fireStarted(String sql) {
        QueryListener current = listener;
        if (current != null) {
            current.queryStarted(sql);
        }
    }

    protected void fireEnded(String sql) {
        QueryListener current = listener;
        if (current != null) {
            current.queryEnded(sql);
        }
    }

    private final class Registration implements TraceRegistration {

        private final QueryListener installed;
        private final QueryListener previous;
        private boolean closed;

        private Registration(QueryListener installed, QueryListener previous) {
            this.installed = installed;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (listener != installed) {
                log.warn("Trace registrations on {} closed out of order", AbstractQueryTraceSource.this);
            }
            listener = previous;
            log.debug("Stopped observing queries on {}", AbstractQueryTraceSource.this);
        }
    }
}
