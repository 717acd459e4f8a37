package com.neal.snowchange.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * @author Neal
 */
public class JdbcSqlExecutor implements SqlExecutor {
    private final Logger logger = LoggerFactory.getLogger(JdbcSqlExecutor.class);
    private final ConnectionProvider connectionProvider;

    public JdbcSqlExecutor(ConnectionProvider connectionProvider) {
        this.connectionProvider = connectionProvider;
    }

    @Override
    public void execute(String database, String sql) throws SQLException {
        logger.debug("SQL query: {}", sql);
        try (Connection connection = connectionProvider.open(database);
             Statement statement = connection.createStatement()) {
            boolean hasResultSet = statement.execute(sql);
            // walk every statement of a multi-statement script so a later failure surfaces here
            while (hasResultSet || statement.getUpdateCount() != -1) {
                hasResultSet = statement.getMoreResults();
            }
        }
    }
}
