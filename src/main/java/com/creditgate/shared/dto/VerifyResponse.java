package com.creditgate.shared.dto;

import com.creditgate.shared.model.ResultState;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * DTO for a completed gated lookup. data is the cached or fresh result as raw JSON.
 */
public class VerifyResponse {

    private boolean success;
    @JsonRawValue
    private String data;
    private int resultCount;
    private ResultState resultState;
    private long creditsUsed;
    private boolean fromCache;
    private Long balance;

    public VerifyResponse() {
    }

    public VerifyResponse(String data, int resultCount, ResultState resultState,
                          long creditsUsed, boolean fromCache, Long balance) {
        this.success = true;
        this.data = data;
        this.resultCount = resultCount;
        this.resultState = resultState;
        this.creditsUsed = creditsUsed;
        this.fromCache = fromCache;
        this.balance = balance;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public int getResultCount() {
        return resultCount;
    }

    public void setResultCount(int resultCount) {
        this.resultCount = resultCount;
    }

    public ResultState getResultState() {
        return resultState;
    }

    public void setResultState(ResultState resultState) {
        this.resultState = resultState;
    }

    public long getCreditsUsed() {
        return creditsUsed;
    }

    public void setCreditsUsed(long creditsUsed) {
        this.creditsUsed = creditsUsed;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public void setFromCache(boolean fromCache) {
        this.fromCache = fromCache;
    }

    public Long getBalance() {
        return balance;
    }

    public void setBalance(Long balance) {
        this.balance = balance;
    }
}
