package com.neal.snowchange.exception;

/**
 * Invalid or missing run configuration, raised before anything touches the target account.
 *
 * @author Neal
 */
public class ConfigurationException extends MigrationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
