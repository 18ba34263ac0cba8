package com.creditgate.ratelimit;

/**
 * The rate limit store could not be reached or answered with an unusable reply.
 */
public class RateLimitBackendException extends RuntimeException {

    public RateLimitBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    public RateLimitBackendException(String message) {
        super(message);
    }
}
