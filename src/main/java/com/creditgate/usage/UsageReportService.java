package com.creditgate.usage;

import com.creditgate.shared.repository.ApiUsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Aggregates a tenant's usage records for reporting.
 *
 * Periods are UTC calendar days (YYYY-MM-DD), ISO weeks (IYYY-IW) or months (YYYY-MM).
 */
@Service
public class UsageReportService {

    private static final Logger logger = LoggerFactory.getLogger(UsageReportService.class);

    static final Duration DEFAULT_RANGE = Duration.ofDays(30);

    private final ApiUsageRecordRepository usageRepository;
    private final Clock clock;

    public UsageReportService(ApiUsageRecordRepository usageRepository, Clock clock) {
        this.usageRepository = usageRepository;
        this.clock = clock;
    }

    /**
     * @param start inclusive, defaults to 30 days before end
     * @param end inclusive, defaults to now
     * @param groupBy day, week or month; defaults to day
     * @throws IllegalArgumentException if start is after end or groupBy is unknown
     */
    @Transactional(readOnly = true)
    public UsageReport report(Long tenantId, Instant start, Instant end, String groupBy) {
        Instant to = end != null ? end : Instant.now(clock);
        Instant from = start != null ? start : to.minus(DEFAULT_RANGE);
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("startDate must be before endDate");
        }
        String grouping = groupBy != null ? groupBy.toLowerCase(Locale.ROOT) : "day";
        String pattern = periodPattern(grouping);

        UsageReport report = new UsageReport(
                from,
                to,
                grouping,
                UsageReport.Summary.from(usageRepository.summarize(tenantId, from, to)),
                usageRepository.summarizeByEndpoint(tenantId, from, to).stream()
                        .map(UsageReport.EndpointUsage::new)
                        .toList(),
                usageRepository.summarizeByPeriod(tenantId, from, to, pattern).stream()
                        .map(UsageReport.PeriodUsage::new)
                        .toList(),
                usageRepository.findTop10ByTenantIdOrderByCreatedAtDescIdDesc(tenantId).stream()
                        .map(UsageReport.RecentActivity::new)
                        .toList());
        logger.debug("Usage report built: tenant={}, from={}, to={}, groupBy={}, requests={}",
                tenantId, from, to, grouping, report.getSummary().getTotalRequests());
        return report;
    }

    private static String periodPattern(String groupBy) {
        switch (groupBy) {
            case "day":
                return "YYYY-MM-DD";
            case "week":
                return "IYYY-IW";
            case "month":
                return "YYYY-MM";
            default:
                throw new IllegalArgumentException("groupBy must be day, week or month, got " + groupBy);
        }
    }
}
