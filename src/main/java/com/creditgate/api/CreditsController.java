package com.creditgate.api;

import com.creditgate.gate.AccountingGate;
import com.creditgate.gate.AuthorizedCredential;
import com.creditgate.ledger.CreditLedgerService;
import com.creditgate.shared.dto.BalanceResponse;
import com.creditgate.shared.dto.TransactionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only credit endpoints for the tenant behind the presented key. Not billed.
 */
@RestController
@RequestMapping("/api/v1/credits")
@Tag(name = "Credits", description = "Tenant balance and transaction history")
public class CreditsController {

    private final AccountingGate accountingGate;
    private final CreditLedgerService ledgerService;
    private final long lowBalanceThreshold;

    public CreditsController(AccountingGate accountingGate,
                             CreditLedgerService ledgerService,
                             @Value("${app.billing.low-balance-threshold:10}") long lowBalanceThreshold) {
        this.accountingGate = accountingGate;
        this.ledgerService = ledgerService;
        this.lowBalanceThreshold = lowBalanceThreshold;
    }

    @GetMapping("/balance")
    @Operation(summary = "Get the tenant's balance and totals")
    public ResponseEntity<BalanceResponse> balance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest request,
            HttpServletResponse response) {
        AuthorizedCredential credential = authorize(authorization, request, response);
        return ResponseEntity.ok(BalanceResponse.from(credential.getTenantId(),
                ledgerService.getSummary(credential.getTenantId(), lowBalanceThreshold)));
    }

    @GetMapping("/transactions")
    @Operation(summary = "List the tenant's ledger entries, newest first")
    public ResponseEntity<List<TransactionResponse>> transactions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "Page size, 1 to 100")
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            HttpServletRequest request,
            HttpServletResponse response) {
        AuthorizedCredential credential = authorize(authorization, request, response);
        return ResponseEntity.ok(ledgerService.getHistory(credential.getTenantId(), limit, offset).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    private AuthorizedCredential authorize(String authorization, HttpServletRequest request,
                                           HttpServletResponse response) {
        AuthorizedCredential credential = accountingGate.authorize(
                GatedRequests.bearerToken(authorization),
                AccountingGate.CREDITS_READ_SCOPE,
                GatedRequests.metadata(request));
        GatedRequests.applyRateLimitHeaders(response, credential.getDecision());
        return credential;
    }
}
