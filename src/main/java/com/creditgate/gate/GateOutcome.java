package com.creditgate.gate;

import com.creditgate.ratelimit.RateLimitDecision;
import com.creditgate.shared.model.ResultState;

/**
 * Result of a gated operation that completed.
 */
public class GateOutcome {

    private final GateState state;
    private final String payload;
    private final int resultCount;
    private final ResultState resultState;
    private final long creditsUsed;
    private final boolean fromCache;
    private final Long balance;
    private final String operationRef;
    private final RateLimitDecision rateLimit;

    public GateOutcome(GateState state, String payload, int resultCount, ResultState resultState,
                       long creditsUsed, boolean fromCache, Long balance, String operationRef,
                       RateLimitDecision rateLimit) {
        this.state = state;
        this.payload = payload;
        this.resultCount = resultCount;
        this.resultState = resultState;
        this.creditsUsed = creditsUsed;
        this.fromCache = fromCache;
        this.balance = balance;
        this.operationRef = operationRef;
        this.rateLimit = rateLimit;
    }

    public GateState getState() {
        return state;
    }

    public String getPayload() {
        return payload;
    }

    public int getResultCount() {
        return resultCount;
    }

    public ResultState getResultState() {
        return resultState;
    }

    public long getCreditsUsed() {
        return creditsUsed;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    /**
     * @return balance after the charge, null when it was not read
     */
    public Long getBalance() {
        return balance;
    }

    public String getOperationRef() {
        return operationRef;
    }

    public RateLimitDecision getRateLimit() {
        return rateLimit;
    }
}
