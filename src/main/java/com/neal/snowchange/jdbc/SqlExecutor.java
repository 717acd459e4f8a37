package com.neal.snowchange.jdbc;

import java.sql.SQLException;

/**
 * @author Neal
 */
public interface SqlExecutor {

    /**
     * Run {@code sql} as one unit in its own session.
     *
     * @param database database to bind the session to, empty for none
     * @throws SQLException if the database rejects the statement
     */
    void execute(String database, String sql) throws SQLException;
}
