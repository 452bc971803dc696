package com.reprise.exception;

/**
 * Base type for every failure raised by the cache layer.
 * A cache miss is not an error and never surfaces as one of these.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
