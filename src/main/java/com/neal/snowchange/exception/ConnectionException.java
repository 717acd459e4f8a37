package com.neal.snowchange.exception;

/**
 * Opening a session against the target account failed (network, authentication).
 *
 * @author Neal
 */
public class ConnectionException extends MigrationException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
