package com.creditgate.security;

/**
 * The presented credential is missing, malformed or unknown.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }
}
