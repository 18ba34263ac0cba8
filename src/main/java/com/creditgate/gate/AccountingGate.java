package com.creditgate.gate;

import com.creditgate.cache.CacheWriteException;
import com.creditgate.cache.SearchResultCacheService;
import com.creditgate.ledger.AccountNotFoundException;
import com.creditgate.ledger.CreditLedgerService;
import com.creditgate.ledger.InsufficientCreditsException;
import com.creditgate.observability.MeteringMetrics;
import com.creditgate.ratelimit.RateLimitDecision;
import com.creditgate.ratelimit.RateLimitExceededException;
import com.creditgate.ratelimit.RateLimitService;
import com.creditgate.security.CredentialValidator;
import com.creditgate.security.ExpiredCredentialException;
import com.creditgate.security.ForbiddenCredentialException;
import com.creditgate.security.InvalidCredentialException;
import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.model.CreditAccount;
import com.creditgate.shared.model.CreditTransaction;
import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.ResultState;
import com.creditgate.shared.model.SearchCacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Puts the limiter, the ledger and the result cache in front of a billable operation.
 *
 * Order for every gated request:
 * <ol>
 *   <li>resolve the presented key (401 if unknown)</li>
 *   <li>admit on the limiter with the key's own quota (429)</li>
 *   <li>check expiry, active flag and scope (401 / 403)</li>
 *   <li>pre-check the balance (402), before the cache when hits are charged</li>
 *   <li>look up the cache, otherwise run the operation</li>
 *   <li>charge under the ledger lock, then cache the fresh result</li>
 *   <li>write the usage record, best effort</li>
 * </ol>
 * The balance is checked before the external operation runs, so an unfunded tenant
 * never triggers external work. The charge itself is re-validated under the row lock,
 * and a result whose charge failed is never cached.
 */
@Service
public class AccountingGate {

    private static final Logger logger = LoggerFactory.getLogger(AccountingGate.class);

    public static final String SEARCH_SCOPE = "search";
    public static final String CREDITS_READ_SCOPE = "credits:read";
    public static final String USAGE_READ_SCOPE = "usage:read";
    public static final int MAX_BATCH_SIZE = 100;

    private final CredentialValidator credentialValidator;
    private final RateLimitService rateLimitService;
    private final CreditLedgerService ledgerService;
    private final SearchResultCacheService cacheService;
    private final SearchProvider searchProvider;
    private final PricingPolicy pricingPolicy;
    private final UsageRecorder usageRecorder;
    private final MeteringMetrics metrics;
    private final int windowSeconds;

    public AccountingGate(CredentialValidator credentialValidator,
                          RateLimitService rateLimitService,
                          CreditLedgerService ledgerService,
                          SearchResultCacheService cacheService,
                          SearchProvider searchProvider,
                          PricingPolicy pricingPolicy,
                          UsageRecorder usageRecorder,
                          MeteringMetrics metrics,
                          @Value("${app.rate-limit.window-seconds:3600}") int windowSeconds) {
        this.credentialValidator = credentialValidator;
        this.rateLimitService = rateLimitService;
        this.ledgerService = ledgerService;
        this.cacheService = cacheService;
        this.searchProvider = searchProvider;
        this.pricingPolicy = pricingPolicy;
        this.usageRecorder = usageRecorder;
        this.metrics = metrics;
        this.windowSeconds = windowSeconds;
    }

    /**
     * Resolves, throttles and validates a presented key.
     *
     * @param rawKey the key from the Authorization header, may be null
     * @param requiredScope scope the operation needs
     * @throws InvalidCredentialException if the key is missing or unknown
     * @throws RateLimitExceededException if the key is over its quota
     * @throws ExpiredCredentialException if the key has expired
     * @throws ForbiddenCredentialException if the key is disabled or lacks the scope
     */
    public AuthorizedCredential authorize(String rawKey, String requiredScope, RequestMetadata request) {
        ApiKey key;
        try {
            key = credentialValidator.resolve(rawKey);
        } catch (InvalidCredentialException e) {
            finish(GateState.UNAUTHORIZED, request);
            throw e;
        }

        RateLimitDecision decision = rateLimitService.admit(
                String.valueOf(key.getId()), key.getRateLimit(), windowSeconds);
        if (!decision.isAllowed()) {
            reject(key, request, HttpStatus.TOO_MANY_REQUESTS, GateState.RATE_LIMITED);
            throw new RateLimitExceededException(decision);
        }

        try {
            credentialValidator.validate(key, requiredScope);
        } catch (ExpiredCredentialException e) {
            reject(key, request, HttpStatus.UNAUTHORIZED, GateState.UNAUTHORIZED);
            throw e;
        } catch (ForbiddenCredentialException e) {
            reject(key, request, HttpStatus.FORBIDDEN, GateState.FORBIDDEN);
            throw e;
        }
        return new AuthorizedCredential(key, decision);
    }

    /**
     * Runs one billable lookup for an authorized credential.
     *
     * @throws InsufficientCreditsException if the tenant cannot pay; nothing is charged or cached
     * @throws AccountNotFoundException if the tenant has no account at charge time
     * @throws SearchProviderException if the external operation failed; nothing is charged
     */
    public GateOutcome search(AuthorizedCredential credential, String query, QueryKind kind,
                              RequestMetadata request) {
        ApiKey key = credential.getApiKey();
        Long tenantId = credential.getTenantId();
        String normalized = SearchResultCacheService.normalize(query);
        String operationRef = "search:" + UUID.randomUUID();

        // A charged hit must not count as a hit when the tenant cannot pay for it
        boolean prechecked = pricingPolicy.isChargeCacheHits();
        if (prechecked) {
            requireSufficient(key, pricingPolicy.estimate(), request);
        }

        SearchOutcome result;
        boolean fromCache;
        Optional<SearchCacheEntry> cached = cacheService.lookup(tenantId, normalized, kind);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            SearchCacheEntry entry = cached.get();
            result = new SearchOutcome(entry.getResultPayload(), entry.getResultCount(), entry.getResultState());
            fromCache = true;
        } else {
            metrics.recordCacheMiss();
            if (!prechecked) {
                requireSufficient(key, pricingPolicy.estimate(), request);
            }
            try {
                result = searchProvider.search(tenantId, normalized, kind);
            } catch (SearchProviderException e) {
                reject(key, request, HttpStatus.BAD_GATEWAY, GateState.FAILED);
                throw e;
            }
            fromCache = false;
        }

        long price = pricingPolicy.price(kind, result.getState(), fromCache);
        String description = (fromCache ? "Cached " : "") + kind + " lookup: " + normalized;
        Long balance = price > 0
                ? charge(key, price, operationRef, description, request)
                : recordFree(tenantId, operationRef, description);

        if (!fromCache) {
            cacheFresh(tenantId, normalized, kind, result);
        }

        GateState state = price > 0 ? GateState.RECORDED : GateState.FREE;
        usageRecorder.record(key, request, HttpStatus.OK.value(), price);
        finish(state, request);

        logger.info("Gated lookup completed: tenant={}, kind={}, state={}, fromCache={}, credits={}, ref={}",
                tenantId, kind, result.getState(), fromCache, price, operationRef);
        return new GateOutcome(state, result.getPayload(), result.getResultCount(), result.getState(), price,
                fromCache, balance, operationRef, credential.getDecision());
    }

    /**
     * Runs up to {@value #MAX_BATCH_SIZE} lookups as one billed request.
     *
     * The balance is pre-checked for every non-blank query before any lookup runs.
     * Items served from the cache or repeated within the batch are priced as cache hits;
     * blank queries and lookups the provider failed are reported per item and never charged.
     * The total is deducted as a single ledger entry, and fresh results are cached only
     * after that charge succeeded.
     *
     * @throws IllegalArgumentException if queries is empty or larger than {@value #MAX_BATCH_SIZE}
     * @throws InsufficientCreditsException if the tenant cannot pay for the batch; nothing is charged or cached
     * @throws AccountNotFoundException if the tenant has no account at charge time
     */
    public BatchOutcome searchBatch(AuthorizedCredential credential, List<String> queries, QueryKind kind,
                                    RequestMetadata request) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("queries must not be empty");
        }
        if (queries.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                    "Maximum " + MAX_BATCH_SIZE + " queries allowed per batch, got " + queries.size());
        }
        ApiKey key = credential.getApiKey();
        Long tenantId = credential.getTenantId();
        String operationRef = "batch:" + UUID.randomUUID();

        long billable = queries.stream().filter(q -> q != null && !q.isBlank()).count();
        requireSufficient(key, billable * pricingPolicy.estimate(), request);

        List<BatchItemResult> items = new ArrayList<>(queries.size());
        Map<String, SearchOutcome> fresh = new LinkedHashMap<>();
        long total = 0;
        int cachedResults = 0;

        for (String query : queries) {
            if (query == null || query.isBlank()) {
                items.add(BatchItemResult.failed(query, "Query cannot be blank"));
                continue;
            }
            String normalized = SearchResultCacheService.normalize(query);

            SearchOutcome result = fresh.get(normalized);
            boolean fromCache = result != null;
            if (result == null) {
                Optional<SearchCacheEntry> cached = cacheService.lookup(tenantId, normalized, kind);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    SearchCacheEntry entry = cached.get();
                    result = new SearchOutcome(entry.getResultPayload(), entry.getResultCount(),
                            entry.getResultState());
                    fromCache = true;
                } else {
                    metrics.recordCacheMiss();
                    try {
                        result = searchProvider.search(tenantId, normalized, kind);
                    } catch (SearchProviderException e) {
                        logger.warn("Batch item failed: tenant={}, kind={}, ref={}", tenantId, kind, operationRef, e);
                        items.add(BatchItemResult.failed(normalized, e.getMessage()));
                        continue;
                    }
                    fresh.put(normalized, result);
                }
            }

            long price = pricingPolicy.price(kind, result.getState(), fromCache);
            total += price;
            if (fromCache) {
                cachedResults++;
            }
            items.add(BatchItemResult.completed(normalized, result, fromCache, price));
        }

        String description = "Batch " + kind + " lookup: " + queries.size() + " queries";
        Long balance = total > 0
                ? charge(key, total, operationRef, description, request)
                : recordFree(tenantId, operationRef, description);

        for (Map.Entry<String, SearchOutcome> entry : fresh.entrySet()) {
            cacheFresh(tenantId, entry.getKey(), kind, entry.getValue());
        }

        GateState state = total > 0 ? GateState.RECORDED : GateState.FREE;
        usageRecorder.record(key, request, HttpStatus.OK.value(), total);
        finish(state, request);

        logger.info("Gated batch completed: tenant={}, kind={}, queries={}, cached={}, credits={}, ref={}",
                tenantId, kind, queries.size(), cachedResults, total, operationRef);
        return new BatchOutcome(state, items, total, cachedResults, balance, operationRef, credential.getDecision());
    }

    private void cacheFresh(Long tenantId, String normalized, QueryKind kind, SearchOutcome result) {
        if (result.getState() == ResultState.ERROR) {
            return;
        }
        try {
            cacheService.store(tenantId, normalized, kind, result.getPayload(), result.getResultCount(),
                    result.getState());
        } catch (CacheWriteException e) {
            logger.warn("Continuing without caching result: tenant={}, kind={}", tenantId, kind, e);
        }
    }

    private void requireSufficient(ApiKey key, long required, RequestMetadata request) {
        if (required <= 0 || ledgerService.checkSufficient(key.getTenantId(), required)) {
            return;
        }
        long balance = ledgerService.getBalance(key.getTenantId()).map(CreditAccount::getBalance).orElse(0L);
        logger.info("Rejecting lookup before execution: tenant={}, required={}, balance={}",
                key.getTenantId(), required, balance);
        reject(key, request, HttpStatus.PAYMENT_REQUIRED, GateState.INSUFFICIENT_CREDITS);
        throw new InsufficientCreditsException(key.getTenantId(), required, balance);
    }

    private Long charge(ApiKey key, long price, String operationRef, String description, RequestMetadata request) {
        try {
            CreditTransaction transaction = ledgerService.deduct(
                    key.getTenantId(), null, price, operationRef, description);
            metrics.recordCreditsCharged(price);
            return transaction.getBalanceAfter();
        } catch (InsufficientCreditsException e) {
            // Balance drained by a concurrent request since the pre-check
            reject(key, request, HttpStatus.PAYMENT_REQUIRED, GateState.INSUFFICIENT_CREDITS);
            throw e;
        } catch (AccountNotFoundException e) {
            reject(key, request, HttpStatus.FORBIDDEN, GateState.FORBIDDEN);
            throw e;
        }
    }

    private Long recordFree(Long tenantId, String operationRef, String description) {
        if (pricingPolicy.isRecordFreeOperations()) {
            try {
                return ledgerService.recordFreeOperation(tenantId, null, operationRef, description)
                        .getBalanceAfter();
            } catch (AccountNotFoundException e) {
                logger.debug("No account to audit free operation: tenant={}", tenantId);
            }
        }
        return ledgerService.getBalance(tenantId).map(CreditAccount::getBalance).orElse(null);
    }

    private void reject(ApiKey key, RequestMetadata request, HttpStatus status, GateState state) {
        usageRecorder.record(key, request, status.value(), 0);
        finish(state, request);
    }

    private void finish(GateState state, RequestMetadata request) {
        metrics.recordGateLatency(Math.max(0, System.currentTimeMillis() - request.getStartedAtMs()), state.name());
    }
}
