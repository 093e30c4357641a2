package org.carball.expectedqueries.trace;

/**
 * A trace source fed by hand, for data access layers that already expose a statement
 * callback (a Hibernate {@code StatementInspector}, a jOOQ {@code ExecuteListener}, ...).
 * Notifications arriving while nobody observes are dropped.
 */
public class CallbackTraceSource extends AbstractQueryTraceSource {

    public void queryStarted(String sql) {
        fireStarted(sql);
    }

    public void queryEnded(String sql) {
        fireEnded(sql);
    }

    /**
     * Reports a statement whose timing is unknown.
     */
    public void query(String sql) {
        fireStarted(sql);
        fireEnded(sql);
    }

    @Override
    public String toString() {
        return "CallbackTraceSource";
    }
}
