package com.neal.snowchange.jdbc;

import org.junit.Before;
import org.junit.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author Neal
 */
public class JdbcSqlExecutorTest {
    private ConnectionProvider connectionProvider;
    private Connection connection;
    private Statement statement;
    private JdbcSqlExecutor executor;

    @Before
    public void setUp() throws SQLException {
        connectionProvider = mock(ConnectionProvider.class);
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connectionProvider.open("")).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        executor = new JdbcSqlExecutor(connectionProvider);
    }

    @Test
    public void testExecuteWalksAllResults() throws SQLException {
        when(statement.execute("CREATE TABLE A (ID INT); SELECT 1")).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(0, -1);
        when(statement.getMoreResults()).thenReturn(true, false);

        executor.execute("", "CREATE TABLE A (ID INT); SELECT 1");

        verify(statement).close();
        verify(connection).close();
    }

    @Test
    public void testConnectionReleasedOnFailure() throws SQLException {
        when(statement.execute("SELEC 1")).thenThrow(new SQLException("syntax error"));

        try {
            executor.execute("", "SELEC 1");
            fail("expected failure");
        } catch (SQLException e) {
            assertEquals("syntax error", e.getMessage());
        }
        verify(connection).close();
    }
}
