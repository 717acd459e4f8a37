package com.neal.snowchange.jdbc;

import java.sql.Connection;

/**
 * Opens a fresh session against the target account. Callers own the returned connection and
 * must close it.
 *
 * @author Neal
 */
public interface ConnectionProvider {

    /**
     * @param database database to bind the session to, empty for none
     * @throws com.neal.snowchange.exception.ConnectionException if the session can't be opened
     */
    Connection open(String database);
}
