package com.creditgate.gate;

import com.creditgate.ratelimit.RateLimitDecision;
import com.creditgate.shared.model.ApiKey;

/**
 * A credential that passed the limiter and its state and scope checks.
 */
public class AuthorizedCredential {

    private final ApiKey apiKey;
    private final RateLimitDecision decision;

    public AuthorizedCredential(ApiKey apiKey, RateLimitDecision decision) {
        this.apiKey = apiKey;
        this.decision = decision;
    }

    public ApiKey getApiKey() {
        return apiKey;
    }

    public Long getTenantId() {
        return apiKey.getTenantId();
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
