package com.creditgate.shared.dto;

import com.creditgate.shared.model.QueryKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for a gated lookup request.
 */
public class VerifyRequest {

    @NotBlank(message = "Query cannot be blank")
    @Size(max = 500, message = "Query must not exceed 500 characters")
    private String query;

    private QueryKind kind = QueryKind.SMART;

    public VerifyRequest() {
    }

    public VerifyRequest(String query, QueryKind kind) {
        this.query = query;
        this.kind = kind;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public QueryKind getKind() {
        return kind;
    }

    public void setKind(QueryKind kind) {
        this.kind = kind != null ? kind : QueryKind.SMART;
    }
}
