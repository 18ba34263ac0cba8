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
import com.creditgate.security.ForbiddenCredentialException;
import com.creditgate.security.InvalidCredentialException;
import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.model.CreditTransaction;
import com.creditgate.shared.model.QueryKind;
import com.creditgate.shared.model.ResultState;
import com.creditgate.shared.model.SearchCacheEntry;
import com.creditgate.shared.model.TransactionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountingGateTest {

    private static final String RAW_KEY = "cg_live_testkey";
    private static final long TENANT_ID = 500L;
    private static final Instant RESET_AT = Instant.parse("2026-03-01T13:00:00Z");
    private static final String SEARCH_PAYLOAD = "{\"matches\":[{\"id\":\"alice-1\"}]}";
    private static final String BOB_PAYLOAD = "{\"matches\":[{\"id\":\"bob-1\"},{\"id\":\"bob-2\"}]}";

    @Mock
    private CredentialValidator credentialValidator;
    @Mock
    private RateLimitService rateLimitService;
    @Mock
    private CreditLedgerService ledgerService;
    @Mock
    private SearchResultCacheService cacheService;
    @Mock
    private SearchProvider searchProvider;
    @Mock
    private UsageRecorder usageRecorder;
    @Mock
    private MeteringMetrics metrics;

    private ApiKey apiKey;
    private RequestMetadata request;
    private RateLimitDecision admitted;

    @BeforeEach
    void setUp() {
        apiKey = mock(ApiKey.class);
        lenient().when(apiKey.getId()).thenReturn(11L);
        lenient().when(apiKey.getTenantId()).thenReturn(TENANT_ID);
        lenient().when(apiKey.getRateLimit()).thenReturn(1000);
        request = new RequestMetadata("/api/v1/verify", "POST", "10.0.0.1", "junit", System.currentTimeMillis());
        admitted = RateLimitDecision.allow(1000, 999, RESET_AT);
    }

    private AccountingGate gate(boolean chargeCacheHits) {
        return new AccountingGate(credentialValidator, rateLimitService, ledgerService, cacheService,
                searchProvider, new PricingPolicy(1, chargeCacheHits, true), usageRecorder, metrics, 3600);
    }

    private AuthorizedCredential authorized() {
        return new AuthorizedCredential(apiKey, admitted);
    }

    private static CreditTransaction usage(long balanceBefore, long amount) {
        return new CreditTransaction(TENANT_ID, null, TransactionKind.USAGE, -amount, balanceBefore, "ref", "lookup");
    }

    @Test
    void authorize_unknownKeyIsRejectedBeforeTheLimiter() {
        when(credentialValidator.resolve(RAW_KEY)).thenThrow(new InvalidCredentialException("Invalid API key"));

        assertThatThrownBy(() -> gate(true).authorize(RAW_KEY, AccountingGate.SEARCH_SCOPE, request))
                .isInstanceOf(InvalidCredentialException.class);

        verifyNoInteractions(rateLimitService, usageRecorder, ledgerService);
    }

    @Test
    void authorize_throttledKeyIsRejectedAndRecorded() {
        RateLimitDecision rejected = RateLimitDecision.reject(1000, RESET_AT, 30);
        when(credentialValidator.resolve(RAW_KEY)).thenReturn(apiKey);
        when(rateLimitService.admit("11", 1000, 3600)).thenReturn(rejected);

        assertThatThrownBy(() -> gate(true).authorize(RAW_KEY, AccountingGate.SEARCH_SCOPE, request))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        e -> assertThat(e.getDecision().getRetryAfterSeconds()).isEqualTo(30L));

        verify(usageRecorder).record(apiKey, request, 429, 0);
        verify(credentialValidator, never()).validate(any(), anyString());
        verifyNoInteractions(ledgerService);
    }

    @Test
    void authorize_checksScopeAfterAdmission() {
        when(credentialValidator.resolve(RAW_KEY)).thenReturn(apiKey);
        when(rateLimitService.admit("11", 1000, 3600)).thenReturn(admitted);
        doThrow(new ForbiddenCredentialException("API key lacks required scope: search", "search"))
                .when(credentialValidator).validate(apiKey, AccountingGate.SEARCH_SCOPE);

        assertThatThrownBy(() -> gate(true).authorize(RAW_KEY, AccountingGate.SEARCH_SCOPE, request))
                .isInstanceOf(ForbiddenCredentialException.class);

        InOrder order = inOrder(rateLimitService, credentialValidator, usageRecorder);
        order.verify(rateLimitService).admit("11", 1000, 3600);
        order.verify(credentialValidator).validate(apiKey, AccountingGate.SEARCH_SCOPE);
        order.verify(usageRecorder).record(apiKey, request, 403, 0);
    }

    @Test
    void authorize_returnsCredentialWithLimiterDecision() {
        when(credentialValidator.resolve(RAW_KEY)).thenReturn(apiKey);
        when(rateLimitService.admit("11", 1000, 3600)).thenReturn(admitted);

        AuthorizedCredential credential = gate(true).authorize(RAW_KEY, AccountingGate.SEARCH_SCOPE, request);

        assertThat(credential.getTenantId()).isEqualTo(TENANT_ID);
        assertThat(credential.getDecision()).isSameAs(admitted);
    }

    @Test
    void search_missRunsProviderChargesThenCaches() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), startsWith("search:"), anyString()))
                .thenReturn(usage(10, 1));

        GateOutcome outcome = gate(true).search(authorized(), "  Alice ", QueryKind.SMART, request);

        assertThat(outcome.getState()).isEqualTo(GateState.RECORDED);
        assertThat(outcome.getCreditsUsed()).isEqualTo(1);
        assertThat(outcome.isFromCache()).isFalse();
        assertThat(outcome.getBalance()).isEqualTo(9L);
        assertThat(outcome.getPayload()).isEqualTo(SEARCH_PAYLOAD);
        assertThat(outcome.getRateLimit()).isSameAs(admitted);

        InOrder order = inOrder(ledgerService, searchProvider, cacheService, usageRecorder);
        order.verify(ledgerService).checkSufficient(TENANT_ID, 1);
        order.verify(searchProvider).search(TENANT_ID, "alice", QueryKind.SMART);
        order.verify(ledgerService).deduct(eq(TENANT_ID), isNull(), eq(1L), startsWith("search:"), anyString());
        order.verify(cacheService).store(TENANT_ID, "alice", QueryKind.SMART, SEARCH_PAYLOAD, 1, ResultState.SUCCESS);
        order.verify(usageRecorder).record(apiKey, request, 200, 1);
        verify(metrics).recordCreditsCharged(1);
        verify(metrics).recordCacheMiss();
    }

    @Test
    void search_unfundedTenantNeverReachesProviderOrCache() {
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(false);
        when(ledgerService.getBalance(TENANT_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gate(true).search(authorized(), "alice", QueryKind.SMART, request))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(1);
                    assertThat(e.getBalance()).isZero();
                });

        verifyNoInteractions(searchProvider, cacheService);
        verify(metrics, never()).recordCacheHit();
        verify(ledgerService, never()).deduct(anyLong(), any(), anyLong(), any(), any());
        verify(usageRecorder).record(apiKey, request, 402, 0);
    }

    @Test
    void search_unfundedTenantStillReachesFreeCacheHits() {
        SearchCacheEntry entry = cachedEntry();
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.of(entry));
        when(ledgerService.recordFreeOperation(eq(TENANT_ID), isNull(), anyString(), anyString()))
                .thenReturn(usage(0, 0));

        GateOutcome outcome = gate(false).search(authorized(), "alice", QueryKind.SMART, request);

        assertThat(outcome.getState()).isEqualTo(GateState.FREE);
        assertThat(outcome.getBalance()).isZero();
        verify(ledgerService, never()).checkSufficient(anyLong(), anyLong());
    }

    @Test
    void search_exactLookupWithoutResultsIsFreeButAudited() {
        when(cacheService.lookup(TENANT_ID, "nobody", QueryKind.EXACT)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "nobody", QueryKind.EXACT))
                .thenReturn(new SearchOutcome("{\"matches\":[]}", 0, ResultState.NO_RESULTS));
        when(ledgerService.recordFreeOperation(eq(TENANT_ID), isNull(), startsWith("search:"), anyString()))
                .thenReturn(usage(10, 0));

        GateOutcome outcome = gate(true).search(authorized(), "nobody", QueryKind.EXACT, request);

        assertThat(outcome.getState()).isEqualTo(GateState.FREE);
        assertThat(outcome.getCreditsUsed()).isZero();
        assertThat(outcome.getBalance()).isEqualTo(10L);
        verify(ledgerService, never()).deduct(anyLong(), any(), anyLong(), any(), any());
        verify(usageRecorder).record(apiKey, request, 200, 0);
    }

    @Test
    void search_cacheHitIsChargedWhenConfigured() {
        SearchCacheEntry entry = cachedEntry();
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.of(entry));
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenReturn(usage(5, 1));

        GateOutcome outcome = gate(true).search(authorized(), "Alice", QueryKind.SMART, request);

        assertThat(outcome.isFromCache()).isTrue();
        assertThat(outcome.getCreditsUsed()).isEqualTo(1);
        assertThat(outcome.getBalance()).isEqualTo(4L);
        verifyNoInteractions(searchProvider);
        verify(cacheService, never()).store(anyLong(), anyString(), any(), anyString(), anyInt(), any());
        verify(metrics).recordCacheHit();
    }

    @Test
    void search_cacheHitIsFreeWhenConfigured() {
        SearchCacheEntry entry = cachedEntry();
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.of(entry));
        when(ledgerService.recordFreeOperation(eq(TENANT_ID), isNull(), anyString(), anyString()))
                .thenReturn(usage(5, 0));

        GateOutcome outcome = gate(false).search(authorized(), "alice", QueryKind.SMART, request);

        assertThat(outcome.isFromCache()).isTrue();
        assertThat(outcome.getCreditsUsed()).isZero();
        verify(ledgerService, never()).checkSufficient(anyLong(), anyLong());
        verify(ledgerService, never()).deduct(anyLong(), any(), anyLong(), any(), any());
    }

    @Test
    void search_cacheWriteFailureDoesNotFailTheRequest() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(cacheService.store(TENANT_ID, "alice", QueryKind.SMART, SEARCH_PAYLOAD, 1, ResultState.SUCCESS))
                .thenThrow(new CacheWriteException("db down", new RuntimeException()));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenReturn(usage(10, 1));

        GateOutcome outcome = gate(true).search(authorized(), "alice", QueryKind.SMART, request);

        assertThat(outcome.getState()).isEqualTo(GateState.RECORDED);
        assertThat(outcome.getPayload()).isEqualTo(SEARCH_PAYLOAD);
    }

    @Test
    void search_providerFailureIsNeverCharged() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenThrow(new SearchProviderException("timeout", new RuntimeException()));

        assertThatThrownBy(() -> gate(true).search(authorized(), "alice", QueryKind.SMART, request))
                .isInstanceOf(SearchProviderException.class);

        verify(ledgerService, never()).deduct(anyLong(), any(), anyLong(), any(), any());
        verify(usageRecorder).record(apiKey, request, 502, 0);
    }

    @Test
    void search_providerErrorResultIsFreeAndNotCached() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome("{\"error\":\"upstream\"}", 0, ResultState.ERROR));
        when(ledgerService.recordFreeOperation(eq(TENANT_ID), isNull(), anyString(), anyString()))
                .thenReturn(usage(10, 0));

        GateOutcome outcome = gate(true).search(authorized(), "alice", QueryKind.SMART, request);

        assertThat(outcome.getCreditsUsed()).isZero();
        verify(cacheService, never()).store(anyLong(), anyString(), any(), anyString(), anyInt(), any());
    }

    @Test
    void search_balanceDrainedConcurrentlySurfacesAsInsufficientCredits() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenThrow(new InsufficientCreditsException(TENANT_ID, 1, 0));

        assertThatThrownBy(() -> gate(true).search(authorized(), "alice", QueryKind.SMART, request))
                .isInstanceOf(InsufficientCreditsException.class);

        verify(usageRecorder).record(apiKey, request, 402, 0);
        verify(usageRecorder, never()).record(apiKey, request, 200, 1);
        verify(cacheService, never()).store(anyLong(), anyString(), any(), anyString(), anyInt(), any());
    }

    @Test
    void search_failedChargeLeavesNoFreeCacheEntryBehind() {
        // With cache hits free, a cached result the tenant never paid for would be served for nothing
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenThrow(new InsufficientCreditsException(TENANT_ID, 1, 0));

        assertThatThrownBy(() -> gate(false).search(authorized(), "alice", QueryKind.SMART, request))
                .isInstanceOf(InsufficientCreditsException.class);

        verify(cacheService, never()).store(anyLong(), anyString(), any(), anyString(), anyInt(), any());
        verify(usageRecorder).record(apiKey, request, 402, 0);
    }

    @Test
    void search_accountRemovedBeforeChargeIsForbidden() {
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenThrow(new AccountNotFoundException(TENANT_ID));

        assertThatThrownBy(() -> gate(true).search(authorized(), "alice", QueryKind.SMART, request))
                .isInstanceOf(AccountNotFoundException.class);

        verify(usageRecorder).record(apiKey, request, 403, 0);
    }

    @Test
    void searchBatch_chargesOnlyFreshResultsInOneEntryWhenHitsAreFree() {
        SearchCacheEntry entry = cachedEntry();
        when(ledgerService.checkSufficient(TENANT_ID, 3)).thenReturn(true);
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.of(entry));
        when(cacheService.lookup(TENANT_ID, "bob", QueryKind.SMART)).thenReturn(Optional.empty());
        when(searchProvider.search(TENANT_ID, "bob", QueryKind.SMART))
                .thenReturn(new SearchOutcome(BOB_PAYLOAD, 2, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), startsWith("batch:"), anyString()))
                .thenReturn(usage(10, 1));

        BatchOutcome outcome = gate(false).searchBatch(authorized(),
                List.of("Alice", "bob", " BOB", "  "), QueryKind.SMART, request);

        assertThat(outcome.getState()).isEqualTo(GateState.RECORDED);
        assertThat(outcome.getCreditsUsed()).isEqualTo(1);
        assertThat(outcome.getCachedResults()).isEqualTo(2);
        assertThat(outcome.getBalance()).isEqualTo(9L);
        assertThat(outcome.getTotalRequested()).isEqualTo(4);
        assertThat(outcome.getTotalSucceeded()).isEqualTo(3);
        assertThat(outcome.getTotalFailed()).isEqualTo(1);
        assertThat(outcome.getItems()).extracting(BatchItemResult::isFromCache)
                .containsExactly(true, false, true, false);
        assertThat(outcome.getItems()).extracting(BatchItemResult::getCreditsUsed)
                .containsExactly(0L, 1L, 0L, 0L);
        assertThat(outcome.getItems().get(2).getPayload()).isEqualTo(BOB_PAYLOAD);
        assertThat(outcome.getItems().get(3).getError()).isEqualTo("Query cannot be blank");

        InOrder order = inOrder(ledgerService, cacheService, usageRecorder);
        order.verify(ledgerService).checkSufficient(TENANT_ID, 3);
        order.verify(ledgerService).deduct(eq(TENANT_ID), isNull(), eq(1L), startsWith("batch:"), anyString());
        order.verify(cacheService).store(TENANT_ID, "bob", QueryKind.SMART, BOB_PAYLOAD, 2, ResultState.SUCCESS);
        order.verify(usageRecorder).record(apiKey, request, 200, 1);
        verify(searchProvider).search(TENANT_ID, "bob", QueryKind.SMART);
        verify(metrics).recordCreditsCharged(1);
    }

    @Test
    void searchBatch_chargesCacheHitsWhenConfigured() {
        SearchCacheEntry entry = cachedEntry();
        when(ledgerService.checkSufficient(TENANT_ID, 2)).thenReturn(true);
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.of(entry));
        when(cacheService.lookup(TENANT_ID, "bob", QueryKind.SMART)).thenReturn(Optional.empty());
        when(searchProvider.search(TENANT_ID, "bob", QueryKind.SMART))
                .thenReturn(new SearchOutcome(BOB_PAYLOAD, 2, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(2L), startsWith("batch:"), anyString()))
                .thenReturn(usage(10, 2));

        BatchOutcome outcome = gate(true).searchBatch(authorized(), List.of("alice", "bob"), QueryKind.SMART, request);

        assertThat(outcome.getCreditsUsed()).isEqualTo(2);
        assertThat(outcome.getCachedResults()).isEqualTo(1);
        assertThat(outcome.getBalance()).isEqualTo(8L);
    }

    @Test
    void searchBatch_unaffordableBatchIsRejectedBeforeAnyLookup() {
        when(ledgerService.checkSufficient(TENANT_ID, 2)).thenReturn(false);
        when(ledgerService.getBalance(TENANT_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gate(true).searchBatch(authorized(), List.of("alice", "bob", ""),
                QueryKind.SMART, request))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(2);
                    assertThat(e.getBalance()).isZero();
                });

        verifyNoInteractions(searchProvider, cacheService);
        verify(usageRecorder).record(apiKey, request, 402, 0);
    }

    @Test
    void searchBatch_providerFailureFailsOnlyThatItem() {
        when(ledgerService.checkSufficient(TENANT_ID, 2)).thenReturn(true);
        when(cacheService.lookup(eq(TENANT_ID), anyString(), eq(QueryKind.SMART))).thenReturn(Optional.empty());
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(searchProvider.search(TENANT_ID, "carol", QueryKind.SMART))
                .thenThrow(new SearchProviderException("timeout", new RuntimeException()));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenReturn(usage(10, 1));

        BatchOutcome outcome = gate(true).searchBatch(authorized(), List.of("alice", "carol"), QueryKind.SMART, request);

        assertThat(outcome.getCreditsUsed()).isEqualTo(1);
        assertThat(outcome.getTotalFailed()).isEqualTo(1);
        BatchItemResult failed = outcome.getItems().get(1);
        assertThat(failed.getQuery()).isEqualTo("carol");
        assertThat(failed.getError()).isEqualTo("timeout");
        assertThat(failed.getCreditsUsed()).isZero();
        verify(cacheService).store(TENANT_ID, "alice", QueryKind.SMART, SEARCH_PAYLOAD, 1, ResultState.SUCCESS);
        verify(cacheService, never()).store(anyLong(), eq("carol"), any(), anyString(), anyInt(), any());
    }

    @Test
    void searchBatch_failedChargeCachesNothing() {
        when(ledgerService.checkSufficient(TENANT_ID, 1)).thenReturn(true);
        when(cacheService.lookup(TENANT_ID, "alice", QueryKind.SMART)).thenReturn(Optional.empty());
        when(searchProvider.search(TENANT_ID, "alice", QueryKind.SMART))
                .thenReturn(new SearchOutcome(SEARCH_PAYLOAD, 1, ResultState.SUCCESS));
        when(ledgerService.deduct(eq(TENANT_ID), isNull(), eq(1L), anyString(), anyString()))
                .thenThrow(new InsufficientCreditsException(TENANT_ID, 1, 0));

        assertThatThrownBy(() -> gate(false).searchBatch(authorized(), List.of("alice"), QueryKind.SMART, request))
                .isInstanceOf(InsufficientCreditsException.class);

        verify(cacheService, never()).store(anyLong(), anyString(), any(), anyString(), anyInt(), any());
        verify(usageRecorder).record(apiKey, request, 402, 0);
    }

    @Test
    void searchBatch_rejectsEmptyAndOversizedBatches() {
        List<String> oversized = Collections.nCopies(AccountingGate.MAX_BATCH_SIZE + 1, "alice");

        assertThatThrownBy(() -> gate(true).searchBatch(authorized(), List.of(), QueryKind.SMART, request))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> gate(true).searchBatch(authorized(), oversized, QueryKind.SMART, request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("100");

        verifyNoInteractions(ledgerService, cacheService, searchProvider, usageRecorder);
    }

    private static SearchCacheEntry cachedEntry() {
        SearchCacheEntry entry = mock(SearchCacheEntry.class);
        when(entry.getResultPayload()).thenReturn(SEARCH_PAYLOAD);
        when(entry.getResultCount()).thenReturn(1);
        when(entry.getResultState()).thenReturn(ResultState.SUCCESS);
        return entry;
    }
}
