package com.reprise.exception;

public class CacheFileNotFoundException extends CacheException {

    public CacheFileNotFoundException(String message) {
        super(message);
    }
}
