package com.neal.snowchange.exception;

/**
 * Root of every failure a migration run can raise. Anything of this type aborts the run; scripts
 * applied before it stay applied and recorded.
 *
 * @author Neal
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

}
