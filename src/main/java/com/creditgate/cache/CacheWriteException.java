package com.creditgate.cache;

/**
 * Thrown when a result could not be written to the cache.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
