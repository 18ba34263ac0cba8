package com.creditgate.gate;

import com.creditgate.shared.model.ResultState;

/**
 * Outcome of one query within a batch. A failed item carries an error and no payload.
 */
public class BatchItemResult {

    private final String query;
    private final String payload;
    private final int resultCount;
    private final ResultState resultState;
    private final boolean fromCache;
    private final long creditsUsed;
    private final String error;

    private BatchItemResult(String query, String payload, int resultCount, ResultState resultState,
                            boolean fromCache, long creditsUsed, String error) {
        this.query = query;
        this.payload = payload;
        this.resultCount = resultCount;
        this.resultState = resultState;
        this.fromCache = fromCache;
        this.creditsUsed = creditsUsed;
        this.error = error;
    }

    public static BatchItemResult completed(String query, SearchOutcome outcome, boolean fromCache, long creditsUsed) {
        return new BatchItemResult(query, outcome.getPayload(), outcome.getResultCount(), outcome.getState(),
                fromCache, creditsUsed, null);
    }

    public static BatchItemResult failed(String query, String error) {
        return new BatchItemResult(query, null, 0, null, false, 0, error);
    }

    public String getQuery() {
        return query;
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

    public boolean isFromCache() {
        return fromCache;
    }

    public long getCreditsUsed() {
        return creditsUsed;
    }

    public String getError() {
        return error;
    }

    public boolean isSucceeded() {
        return error == null && resultState != ResultState.ERROR;
    }
}
