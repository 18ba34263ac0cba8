package com.creditgate.shared.dto;

import com.creditgate.gate.BatchItemResult;
import com.creditgate.gate.BatchOutcome;
import com.creditgate.shared.model.ResultState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.util.List;

/**
 * DTO for a completed gated batch.
 */
public class BatchVerifyResponse {

    private boolean success;
    private List<Item> results;
    private int totalRequested;
    private int totalSucceeded;
    private int totalFailed;
    private long creditsUsed;
    private int cachedResults;
    private Long balance;

    public BatchVerifyResponse() {
    }

    public static BatchVerifyResponse from(BatchOutcome outcome) {
        BatchVerifyResponse response = new BatchVerifyResponse();
        response.success = true;
        response.results = outcome.getItems().stream().map(Item::from).toList();
        response.totalRequested = outcome.getTotalRequested();
        response.totalSucceeded = outcome.getTotalSucceeded();
        response.totalFailed = outcome.getTotalFailed();
        response.creditsUsed = outcome.getCreditsUsed();
        response.cachedResults = outcome.getCachedResults();
        response.balance = outcome.getBalance();
        return response;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<Item> getResults() {
        return results;
    }

    public void setResults(List<Item> results) {
        this.results = results;
    }

    public int getTotalRequested() {
        return totalRequested;
    }

    public void setTotalRequested(int totalRequested) {
        this.totalRequested = totalRequested;
    }

    public int getTotalSucceeded() {
        return totalSucceeded;
    }

    public void setTotalSucceeded(int totalSucceeded) {
        this.totalSucceeded = totalSucceeded;
    }

    public int getTotalFailed() {
        return totalFailed;
    }

    public void setTotalFailed(int totalFailed) {
        this.totalFailed = totalFailed;
    }

    public long getCreditsUsed() {
        return creditsUsed;
    }

    public void setCreditsUsed(long creditsUsed) {
        this.creditsUsed = creditsUsed;
    }

    public int getCachedResults() {
        return cachedResults;
    }

    public void setCachedResults(int cachedResults) {
        this.cachedResults = cachedResults;
    }

    public Long getBalance() {
        return balance;
    }

    public void setBalance(Long balance) {
        this.balance = balance;
    }

    /**
     * One query's result; data is raw JSON, error is set only for failed items.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {

        private String query;
        private boolean success;
        @JsonRawValue
        private String data;
        private int resultCount;
        private ResultState resultState;
        private boolean fromCache;
        private long creditsUsed;
        private String error;

        public Item() {
        }

        static Item from(BatchItemResult result) {
            Item item = new Item();
            item.query = result.getQuery();
            item.success = result.isSucceeded();
            item.data = result.getPayload();
            item.resultCount = result.getResultCount();
            item.resultState = result.getResultState();
            item.fromCache = result.isFromCache();
            item.creditsUsed = result.getCreditsUsed();
            item.error = result.getError();
            return item;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
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

        public boolean isFromCache() {
            return fromCache;
        }

        public void setFromCache(boolean fromCache) {
            this.fromCache = fromCache;
        }

        public long getCreditsUsed() {
            return creditsUsed;
        }

        public void setCreditsUsed(long creditsUsed) {
            this.creditsUsed = creditsUsed;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }
    }
}
