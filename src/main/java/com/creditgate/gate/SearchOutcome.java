package com.creditgate.gate;

import com.creditgate.shared.model.ResultState;

/**
 * Result of the external operation, with the payload already serialized as JSON.
 */
public class SearchOutcome {

    private final String payload;
    private final int resultCount;
    private final ResultState state;

    public SearchOutcome(String payload, int resultCount, ResultState state) {
        this.payload = payload;
        this.resultCount = resultCount;
        this.state = state;
    }

    public String getPayload() {
        return payload;
    }

    public int getResultCount() {
        return resultCount;
    }

    public ResultState getState() {
        return state;
    }
}
