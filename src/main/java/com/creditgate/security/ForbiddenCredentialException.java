package com.creditgate.security;

/**
 * The credential is known but may not perform the operation: it is disabled
 * or lacks the required scope.
 */
public class ForbiddenCredentialException extends RuntimeException {

    private final String requiredScope;

    public ForbiddenCredentialException(String message, String requiredScope) {
        super(message);
        this.requiredScope = requiredScope;
    }

    public String getRequiredScope() {
        return requiredScope;
    }
}
