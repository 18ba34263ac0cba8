package com.creditgate.gate;

import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.ResultState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides what a gated operation costs.
 *
 * Every operation costs app.billing.credits-per-operation, except an EXACT lookup
 * that found nothing and a lookup the provider reported as failed, which are free. Cache hits are charged like fresh lookups
 * unless app.billing.charge-cache-hits is false.
 */
@Component
public class PricingPolicy {

    private static final Logger logger = LoggerFactory.getLogger(PricingPolicy.class);

    private final long creditsPerOperation;
    private final boolean chargeCacheHits;
    private final boolean recordFreeOperations;

    public PricingPolicy(@Value("${app.billing.credits-per-operation:1}") long creditsPerOperation,
                         @Value("${app.billing.charge-cache-hits:true}") boolean chargeCacheHits,
                         @Value("${app.billing.record-free-operations:true}") boolean recordFreeOperations) {
        if (creditsPerOperation <= 0) {
            throw new IllegalArgumentException("app.billing.credits-per-operation must be positive");
        }
        this.creditsPerOperation = creditsPerOperation;
        this.chargeCacheHits = chargeCacheHits;
        this.recordFreeOperations = recordFreeOperations;
        logger.info("Pricing: creditsPerOperation={}, chargeCacheHits={}, recordFreeOperations={}",
                creditsPerOperation, chargeCacheHits, recordFreeOperations);
    }

    /**
     * Upper bound of the price before the operation runs, used for the balance pre-check.
     */
    public long estimate() {
        return creditsPerOperation;
    }

    public long price(QueryKind kind, ResultState state, boolean fromCache) {
        if (fromCache && !chargeCacheHits) {
            return 0;
        }
        if (state == ResultState.ERROR) {
            return 0;
        }
        if (kind == QueryKind.EXACT && state == ResultState.NO_RESULTS) {
            return 0;
        }
        return creditsPerOperation;
    }

    public boolean isRecordFreeOperations() {
        return recordFreeOperations;
    }

    public boolean isChargeCacheHits() {
        return chargeCacheHits;
    }
}
