package com.creditgate.gate;

import com.creditgate.shared.model.QueryKind;

/**
 * The billable external operation behind the gate.
 */
public interface SearchProvider {

    /**
     * Runs a lookup for an already normalized query.
     * @throws SearchProviderException if the provider could not produce a result
     */
    SearchOutcome search(Long tenantId, String normalizedQuery, QueryKind kind);
}
