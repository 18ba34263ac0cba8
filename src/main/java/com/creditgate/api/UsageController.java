package com.creditgate.api;

import com.creditgate.gate.AccountingGate;
import com.creditgate.gate.AuthorizedCredential;
import com.creditgate.usage.UsageReport;
import com.creditgate.usage.UsageReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Request analytics for the tenant behind the presented key. Not billed.
 */
@RestController
@RequestMapping("/api/v1/usage")
@Tag(name = "Usage", description = "Request counts, credits and latency per endpoint and period")
public class UsageController {

    private final AccountingGate accountingGate;
    private final UsageReportService usageReportService;

    public UsageController(AccountingGate accountingGate, UsageReportService usageReportService) {
        this.accountingGate = accountingGate;
        this.usageReportService = usageReportService;
    }

    @GetMapping
    @Operation(summary = "Summarize the tenant's gated requests over a date range")
    @ApiResponse(responseCode = "200", description = "Report built")
    @ApiResponse(responseCode = "400", description = "startDate after endDate or unknown groupBy")
    @ApiResponse(responseCode = "403", description = "API key missing the usage:read scope")
    public ResponseEntity<UsageReport> usage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Parameter(description = "ISO-8601 instant, defaults to 30 days before endDate")
            @RequestParam(value = "startDate", required = false) Instant startDate,
            @Parameter(description = "ISO-8601 instant, defaults to now")
            @RequestParam(value = "endDate", required = false) Instant endDate,
            @Parameter(description = "day, week or month")
            @RequestParam(value = "groupBy", defaultValue = "day") String groupBy,
            HttpServletRequest request,
            HttpServletResponse response) {
        AuthorizedCredential credential = accountingGate.authorize(
                GatedRequests.bearerToken(authorization),
                AccountingGate.USAGE_READ_SCOPE,
                GatedRequests.metadata(request));
        GatedRequests.applyRateLimitHeaders(response, credential.getDecision());
        return ResponseEntity.ok(usageReportService.report(credential.getTenantId(), startDate, endDate, groupBy));
    }
}
