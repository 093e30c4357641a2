package org.carball.expectedqueries.trace;


import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Wraps a {@link DataSource} so that every statement executed through its connections is
 * reported to the observing listener.
 * <p>
 * Batches are reported one query per batched statement; the time of the whole batch is
 * attributed to the first of them.
 */
public class TracingDataSource extends AbstractQueryTraceSource implements DataSource {

    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate");

    private static final Set<String> BATCH_METHODS = Set.of("executeBatch", "executeLargeBatch");

    private final DataSource delegate;

    public TracingDataSource(DataSource delegate) {
        this.delegate = delegate;
    }

    public DataSource getDelegate() {
        return delegate;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return wrap(delegate.getConnection());
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return wrap(delegate.getConnection(username, password));
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return delegate.getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        delegate.setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        delegate.setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return delegate.getLoginTimeout();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return delegate.getParentLogger();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(delegate)) {
            return iface.cast(delegate);
        }
        return delegate.unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(delegate) || delegate.isWrapperFor(iface);
    }

    @Override
    public String toString() {
        return "TracingDataSource[" + delegate + "]";
    }

    private Connection wrap(Connection connection) {
        return proxy(Connection.class, new ConnectionHandler(connection));
    }

    private <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] {type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private final class ConnectionHandler implements InvocationHandler {

        private final Connection target;

        private ConnectionHandler(Connection target) {
            this.target = target;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            Object result = TracingDataSource.invoke(target, method, args);
            switch (method.getName()) {
                case "createStatement":
                    return proxy(Statement.class,
                            new StatementHandler((Statement) result, (Connection) proxy, null));
                case "prepareStatement":
                    return proxy(PreparedStatement.class,
                            new StatementHandler((Statement) result, (Connection) proxy, (String) args[0]));
                case "prepareCall":
                    return proxy(CallableStatement.class,
                            new StatementHandler((Statement) result, (Connection) proxy, (String) args[0]));
                default:
                    return result;
            }
        }
    }

    private final class StatementHandler implements InvocationHandler {

        private final Statement target;
        private final Connection connection;
        private final String preparedSql;
        private final List<String> batch = new ArrayList<>();

        private StatementHandler(Statement target, Connection connection, String preparedSql) {
            this.target = target;
            this.connection = connection;
            this.preparedSql = preparedSql;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();

            // statements handed out by this connection stay traced
            if ("getConnection".equals(name)) {
                return connection;
            }

            if (EXECUTE_METHODS.contains(name)) {
                String sql = args != null && args.length > 0 && args[0] instanceof String s ? s : preparedSql;
                fireStarted(sql);
                try {
                    return TracingDataSource.invoke(target, method, args);
                } finally {
                    fireEnded(sql);
                }
            }

            if (BATCH_METHODS.contains(name)) {
                List<String> executed = new ArrayList<>(batch);
                batch.clear();
                if (!executed.isEmpty()) {
                    fireStarted(executed.get(0));
                }
                try {
                    return TracingDataSource.invoke(target, method, args);
                } finally {
                    executed.forEach(TracingDataSource.this::fireEnded);
                }
            }

            if ("addBatch".equals(name)) {
                batch.add(args != null && args.length > 0 ? (String) args[0] : preparedSql);
            } else if ("clearBatch".equals(name)) {
                batch.clear();
            }
            return TracingDataSource.invoke(target, method, args);
        }
    }
}
