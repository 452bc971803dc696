package com.reprise.exception;

/**
 * A legacy store cannot be upgraded to the current layout.
 */
public class CacheMigrationException extends CacheException {

    public CacheMigrationException(String message) {
        super(message);
    }

    public CacheMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
