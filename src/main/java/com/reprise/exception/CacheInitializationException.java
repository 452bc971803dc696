package com.reprise.exception;

/**
 * The default on-disk cache location cannot be opened or created.
 */
public class CacheInitializationException extends CacheException {

    public CacheInitializationException(String message) {
        super(message);
    }

    public CacheInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
