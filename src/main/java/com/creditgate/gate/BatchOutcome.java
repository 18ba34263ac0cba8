package com.creditgate.gate;

import com.creditgate.ratelimit.RateLimitDecision;

import java.util.List;

/**
 * Result of a gated batch. Items keep the order of the submitted queries.
 */
public class BatchOutcome {

    private final GateState state;
    private final List<BatchItemResult> items;
    private final long creditsUsed;
    private final int cachedResults;
    private final Long balance;
    private final String operationRef;
    private final RateLimitDecision rateLimit;

    public BatchOutcome(GateState state, List<BatchItemResult> items, long creditsUsed, int cachedResults,
                        Long balance, String operationRef, RateLimitDecision rateLimit) {
        this.state = state;
        this.items = List.copyOf(items);
        this.creditsUsed = creditsUsed;
        this.cachedResults = cachedResults;
        this.balance = balance;
        this.operationRef = operationRef;
        this.rateLimit = rateLimit;
    }

    public GateState getState() {
        return state;
    }

    public List<BatchItemResult> getItems() {
        return items;
    }

    public int getTotalRequested() {
        return items.size();
    }

    public int getTotalSucceeded() {
        return (int) items.stream().filter(BatchItemResult::isSucceeded).count();
    }

    public int getTotalFailed() {
        return getTotalRequested() - getTotalSucceeded();
    }

    public long getCreditsUsed() {
        return creditsUsed;
    }

    public int getCachedResults() {
        return cachedResults;
    }

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
