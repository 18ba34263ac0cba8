package com.creditgate.shared.dto;

import com.creditgate.shared.model.QueryKind;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * DTO for a gated batch lookup. Blank entries are reported as failed items, not rejected.
 */
public class BatchVerifyRequest {

    @NotEmpty(message = "Queries cannot be empty")
    @Size(max = 100, message = "Maximum 100 queries allowed per batch request")
    private List<@NotNull(message = "Queries must be strings")
                 @Size(max = 500, message = "Query must not exceed 500 characters") String> queries;

    private QueryKind kind = QueryKind.SMART;

    public BatchVerifyRequest() {
    }

    public BatchVerifyRequest(List<String> queries, QueryKind kind) {
        this.queries = queries;
        this.kind = kind;
    }

    public List<String> getQueries() {
        return queries;
    }

    public void setQueries(List<String> queries) {
        this.queries = queries;
    }

    public QueryKind getKind() {
        return kind;
    }

    public void setKind(QueryKind kind) {
        this.kind = kind != null ? kind : QueryKind.SMART;
    }
}
