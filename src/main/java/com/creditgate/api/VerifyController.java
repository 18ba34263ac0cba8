package com.creditgate.api;

import com.creditgate.gate.AccountingGate;
import com.creditgate.gate.AuthorizedCredential;
import com.creditgate.gate.BatchOutcome;
import com.creditgate.gate.GateOutcome;
import com.creditgate.gate.RequestMetadata;
import com.creditgate.shared.dto.BatchVerifyRequest;
import com.creditgate.shared.dto.BatchVerifyResponse;
import com.creditgate.shared.dto.VerifyRequest;
import com.creditgate.shared.dto.VerifyResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gated, billable lookup endpoint.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Verify", description = "Credential-authenticated, metered lookups")
public class VerifyController {

    private final AccountingGate accountingGate;

    public VerifyController(AccountingGate accountingGate) {
        this.accountingGate = accountingGate;
    }

    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run a metered lookup",
               description = "Charges the tenant's credits unless the lookup is free. "
                       + "Repeated queries are served from the tenant's result cache.")
    @ApiResponse(responseCode = "200", description = "Lookup completed")
    @ApiResponse(responseCode = "401", description = "Missing, unknown or expired API key")
    @ApiResponse(responseCode = "402", description = "Insufficient credits")
    @ApiResponse(responseCode = "403", description = "API key disabled or missing the search scope")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<VerifyResponse> verify(
            @Parameter(description = "Bearer API key")
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody VerifyRequest body,
            HttpServletRequest request,
            HttpServletResponse response) {

        RequestMetadata metadata = GatedRequests.metadata(request);
        AuthorizedCredential credential = accountingGate.authorize(
                GatedRequests.bearerToken(authorization), AccountingGate.SEARCH_SCOPE, metadata);
        GatedRequests.applyRateLimitHeaders(response, credential.getDecision());

        GateOutcome outcome = accountingGate.search(credential, body.getQuery(), body.getKind(), metadata);
        return ResponseEntity.ok(new VerifyResponse(
                outcome.getPayload(),
                outcome.getResultCount(),
                outcome.getResultState(),
                outcome.getCreditsUsed(),
                outcome.isFromCache(),
                outcome.getBalance()));
    }

    @PostMapping(value = "/verify/batch", consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run up to 100 metered lookups",
               description = "Pre-checks the balance for every query, then charges one ledger entry "
                       + "for the results that were not served from the cache.")
    @ApiResponse(responseCode = "200", description = "Batch completed; failed items are reported per query")
    @ApiResponse(responseCode = "400", description = "Empty batch or more than 100 queries")
    @ApiResponse(responseCode = "401", description = "Missing, unknown or expired API key")
    @ApiResponse(responseCode = "402", description = "Insufficient credits for the whole batch")
    @ApiResponse(responseCode = "403", description = "API key disabled or missing the search scope")
    @ApiResponse(responseCode = "429", description = "Rate limit exceeded")
    public ResponseEntity<BatchVerifyResponse> verifyBatch(
            @Parameter(description = "Bearer API key")
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody BatchVerifyRequest body,
            HttpServletRequest request,
            HttpServletResponse response) {

        RequestMetadata metadata = GatedRequests.metadata(request);
        AuthorizedCredential credential = accountingGate.authorize(
                GatedRequests.bearerToken(authorization), AccountingGate.SEARCH_SCOPE, metadata);
        GatedRequests.applyRateLimitHeaders(response, credential.getDecision());

        BatchOutcome outcome = accountingGate.searchBatch(credential, body.getQueries(), body.getKind(), metadata);
        return ResponseEntity.ok(BatchVerifyResponse.from(outcome));
    }
}
