package com.creditgate.gate;

import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.ResultState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic provider for local runs and tests.
 * Queries starting with "no-match" yield no results; anything else yields
 * between one and three matches derived from the query text.
 */
@Component
@ConditionalOnProperty(prefix = "app.search", name = "provider", havingValue = "stub", matchIfMissing = true)
public class StubSearchProvider implements SearchProvider {

    private static final Logger logger = LoggerFactory.getLogger(StubSearchProvider.class);
    static final String NO_MATCH_PREFIX = "no-match";

    private final ObjectMapper objectMapper;

    public StubSearchProvider() {
        this.objectMapper = new ObjectMapper();
        logger.info("Using stub search provider");
    }

    @Override
    public SearchOutcome search(Long tenantId, String normalizedQuery, QueryKind kind) {
        int count = normalizedQuery.startsWith(NO_MATCH_PREFIX)
                ? 0
                : 1 + Math.floorMod(normalizedQuery.hashCode(), 3);

        ObjectNode root = objectMapper.createObjectNode();
        root.put("query", normalizedQuery);
        root.put("kind", kind.name());
        ArrayNode matches = root.putArray("matches");
        for (int i = 0; i < count; i++) {
            ObjectNode match = matches.addObject();
            match.put("id", normalizedQuery + "-" + (i + 1));
            match.put("displayName", normalizedQuery);
            match.put("score", 1.0 - i * 0.25);
        }

        try {
            return new SearchOutcome(objectMapper.writeValueAsString(root), count,
                    count == 0 ? ResultState.NO_RESULTS : ResultState.SUCCESS);
        } catch (JsonProcessingException e) {
            throw new SearchProviderException("Failed to serialize stub result", e);
        }
    }
}
