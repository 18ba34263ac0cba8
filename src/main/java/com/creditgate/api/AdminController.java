package com.creditgate.api;

import com.creditgate.cache.CacheStats;
import com.creditgate.cache.SearchResultCacheService;
import com.creditgate.ledger.CreditLedgerService;
import com.creditgate.ledger.CreditSummary;
import com.creditgate.ledger.LedgerIntegrityReport;
import com.creditgate.ratelimit.RateLimitService;
import com.creditgate.ratelimit.RateLimitStatus;
import com.creditgate.security.ApiKeyService;
import com.creditgate.security.InvalidCredentialException;
import com.creditgate.shared.dto.AddCreditsRequest;
import com.creditgate.shared.dto.IssueKeyRequest;
import com.creditgate.shared.dto.TransactionResponse;
import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.model.CreditTransaction;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator endpoints. Every call must carry the X-Admin-Token header; with no
 * app.security.admin-token configured all of them are refused.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Credit top-ups, key issuance and maintenance")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);
    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final CreditLedgerService ledgerService;
    private final RateLimitService rateLimitService;
    private final SearchResultCacheService cacheService;
    private final ApiKeyService apiKeyService;
    private final String adminToken;
    private final int defaultMaxAgeDays;
    private final int windowSeconds;
    private final long lowBalanceThreshold;

    public AdminController(CreditLedgerService ledgerService,
                           RateLimitService rateLimitService,
                           SearchResultCacheService cacheService,
                           ApiKeyService apiKeyService,
                           @Value("${app.security.admin-token:}") String adminToken,
                           @Value("${app.cache.max-age-days:30}") int defaultMaxAgeDays,
                           @Value("${app.rate-limit.window-seconds:3600}") int windowSeconds,
                           @Value("${app.billing.low-balance-threshold:10}") long lowBalanceThreshold) {
        this.ledgerService = ledgerService;
        this.rateLimitService = rateLimitService;
        this.cacheService = cacheService;
        this.apiKeyService = apiKeyService;
        this.adminToken = adminToken;
        this.defaultMaxAgeDays = defaultMaxAgeDays;
        this.windowSeconds = windowSeconds;
        this.lowBalanceThreshold = lowBalanceThreshold;

        if (adminToken == null || adminToken.isBlank()) {
            logger.warn("No admin token configured; admin endpoints are disabled. Set APP_ADMIN_TOKEN to enable them.");
        }
    }

    @PostMapping("/credits/add")
    @Operation(summary = "Credit a tenant after a settled payment, refund or adjustment")
    public ResponseEntity<TransactionResponse> addCredits(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody AddCreditsRequest body) {
        requireAdmin(token);
        CreditTransaction transaction = ledgerService.credit(body.getTenantId(), null, body.getAmount(),
                body.getKind(), body.getReference(), body.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @PostMapping("/keys")
    @Operation(summary = "Issue an API key", description = "The raw key is only returned by this call.")
    public ResponseEntity<Map<String, Object>> issueKey(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @Valid @RequestBody IssueKeyRequest body) {
        requireAdmin(token);
        ApiKeyService.IssuedApiKey issued = apiKeyService.issue(body.getTenantId(), body.getName(),
                body.getScopes(), body.getRateLimit(), body.getExpiresAt(), body.isLive());
        ApiKey key = issued.getApiKey();

        Map<String, Object> response = new HashMap<>();
        response.put("id", key.getId());
        response.put("tenantId", key.getTenantId());
        response.put("key", issued.getRawKey());
        response.put("prefix", key.getKeyPrefix());
        response.put("scopes", key.getScopeList());
        response.put("rateLimit", key.getRateLimit());
        response.put("expiresAt", key.getExpiresAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/rate-limit/reset")
    @Operation(summary = "Clear every limiter window of a credential")
    public ResponseEntity<Map<String, Object>> resetRateLimit(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @RequestParam("credentialId") String credentialId) {
        requireAdmin(token);
        rateLimitService.reset(credentialId);
        Map<String, Object> response = new HashMap<>();
        response.put("credentialId", credentialId);
        response.put("reset", true);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/rate-limit/{credentialId}")
    @Operation(summary = "Read a credential's limiter usage without consuming a slot")
    public ResponseEntity<RateLimitStatus> rateLimitStatus(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @PathVariable("credentialId") String credentialId,
            @RequestParam(value = "limit", defaultValue = "1000") int limit) {
        requireAdmin(token);
        return ResponseEntity.ok(rateLimitService.status(credentialId, limit, windowSeconds));
    }

    @PostMapping("/cache/sweep")
    @Operation(summary = "Remove cache entries idle for longer than maxAgeDays")
    public ResponseEntity<Map<String, Object>> sweepCache(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @RequestParam(value = "maxAgeDays", required = false) Integer maxAgeDays) {
        requireAdmin(token);
        int days = maxAgeDays != null ? maxAgeDays : defaultMaxAgeDays;
        Map<String, Object> response = new HashMap<>();
        response.put("maxAgeDays", days);
        response.put("deleted", cacheService.sweep(days));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cache/{tenantId}/stats")
    @Operation(summary = "Cache size and hit counts of a tenant")
    public ResponseEntity<CacheStats> cacheStats(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @PathVariable("tenantId") Long tenantId) {
        requireAdmin(token);
        return ResponseEntity.ok(cacheService.stats(tenantId));
    }

    @GetMapping("/ledger/{tenantId}/summary")
    @Operation(summary = "Balance, totals and recent entries of a tenant")
    public ResponseEntity<CreditSummary> ledgerSummary(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @PathVariable("tenantId") Long tenantId) {
        requireAdmin(token);
        return ResponseEntity.ok(ledgerService.getSummary(tenantId, lowBalanceThreshold));
    }

    @GetMapping("/ledger/{tenantId}/integrity")
    @Operation(summary = "Reconcile a tenant's balance against its transaction log")
    public ResponseEntity<LedgerIntegrityReport> ledgerIntegrity(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String token,
            @PathVariable("tenantId") Long tenantId) {
        requireAdmin(token);
        return ResponseEntity.ok(ledgerService.verifyIntegrity(tenantId));
    }

    private void requireAdmin(String token) {
        if (adminToken == null || adminToken.isBlank() || !apiKeyService.constantTimeEquals(adminToken, token)) {
            throw new InvalidCredentialException("Invalid admin token");
        }
    }
}
