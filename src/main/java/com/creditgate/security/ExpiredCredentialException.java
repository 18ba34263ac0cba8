package com.creditgate.security;

import java.time.Instant;

public class ExpiredCredentialException extends RuntimeException {

    private final Instant expiredAt;

    public ExpiredCredentialException(Instant expiredAt) {
        super("API key expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
