package org.carball.expectedqueries.trace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TracingDataSourceTest {

    private DataSource delegate;
    private Connection connection;
    private Statement statement;
    private PreparedStatement preparedStatement;
    private TracingDataSource dataSource;
    private RecordingListener listener;

    @BeforeEach
    void setUp() throws SQLException {
        delegate = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        preparedStatement = mock(PreparedStatement.class);

        when(delegate.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement("select * from book where id = ?")).thenReturn(preparedStatement);

        dataSource = new TracingDataSource(delegate);
        listener = new RecordingListener();
    }

    @Test
    void shouldReportPlainAndPreparedStatements() throws SQLException {
        // Given
        ResultSet resultSet = mock(ResultSet.class);
        when(statement.executeQuery("select * from author")).thenReturn(resultSet);

        // When
        try (TraceRegistration registration = dataSource.observe(listener)) {
            Connection traced = dataSource.getConnection();
            ResultSet result = traced.createStatement().executeQuery("select * from author");
            PreparedStatement prepared = traced.prepareStatement("select * from book where id = ?");
            prepared.setInt(1, 7);
            prepared.executeQuery();

            assertThat(result).isSameAs(resultSet);
        }

        // Then
        assertThat(listener.events).containsExactly(
                "start: select * from author", "end: select * from author",
                "start: select * from book where id = ?", "end: select * from book where id = ?");
        verify(preparedStatement).setInt(1, 7);
    }

    @Test
    void shouldTraceStatementsCreatedFromStatementConnection() throws SQLException {
        // Given
        Statement second = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement, second);

        // When
        try (TraceRegistration registration = dataSource.observe(listener)) {
            Connection traced = dataSource.getConnection();
            Statement first = traced.createStatement();

            assertThat(first.getConnection()).isSameAs(traced);
            first.getConnection().createStatement().executeUpdate("delete from author where id = 3");
        }

        // Then
        assertThat(listener.events).containsExactly(
                "start: delete from author where id = 3", "end: delete from author where id = 3");
        verify(second).executeUpdate("delete from author where id = 3");
    }

    @Test
    void shouldReportFailedStatementAndRethrowOriginalException() throws SQLException {
        // Given
        SQLException failure = new SQLException("boom");
        when(statement.executeUpdate("delete from book")).thenThrow(failure);

        // When
        try (TraceRegistration registration = dataSource.observe(listener)) {
            Statement traced = dataSource.getConnection().createStatement();
            assertThatThrownBy(() -> traced.executeUpdate("delete from book")).isSameAs(failure);
        }

        // Then
        assertThat(listener.events).containsExactly("start: delete from book", "end: delete from book");
    }

    @Test
    void shouldReportEachBatchedStatement() throws SQLException {
        try (TraceRegistration registration = dataSource.observe(listener)) {
            Statement traced = dataSource.getConnection().createStatement();
            traced.addBatch("insert into tag (name) values ('a')");
            traced.addBatch("insert into tag (name) values ('b')");
            traced.executeBatch();
        }

        assertThat(listener.events).containsExactly(
                "start: insert into tag (name) values ('a')",
                "end: insert into tag (name) values ('a')",
                "end: insert into tag (name) values ('b')");
        verify(statement).executeBatch();
    }

    @Test
    void shouldNotReportWhenNotObserved() throws SQLException {
        dataSource.getConnection().createStatement().execute("select * from book");

        assertThat(listener.events).isEmpty();
        verify(statement).execute("select * from book");
    }

    @Test
    void shouldDelegateDataSourceMethods() throws SQLException {
        when(delegate.getLoginTimeout()).thenReturn(30);

        assertThat(dataSource.getLoginTimeout()).isEqualTo(30);
        assertThat(dataSource.unwrap(DataSource.class)).isSameAs(delegate);
        assertThat(dataSource.isWrapperFor(DataSource.class)).isTrue();
        assertThat(dataSource.getDelegate()).isSameAs(delegate);
    }
}
