package com.creditgate.usage;

import com.creditgate.shared.model.ApiUsageRecord;
import com.creditgate.shared.repository.ApiUsageRecordRepository.EndpointTotals;
import com.creditgate.shared.repository.ApiUsageRecordRepository.PeriodTotals;
import com.creditgate.shared.repository.ApiUsageRecordRepository.UsageTotals;

import java.time.Instant;
import java.util.List;

/**
 * A tenant's request analytics over a date range.
 */
public class UsageReport {

    private final Instant start;
    private final Instant end;
    private final String groupBy;
    private final Summary summary;
    private final List<EndpointUsage> byEndpoint;
    private final List<PeriodUsage> byPeriod;
    private final List<RecentActivity> recentActivity;

    public UsageReport(Instant start, Instant end, String groupBy, Summary summary,
                       List<EndpointUsage> byEndpoint, List<PeriodUsage> byPeriod,
                       List<RecentActivity> recentActivity) {
        this.start = start;
        this.end = end;
        this.groupBy = groupBy;
        this.summary = summary;
        this.byEndpoint = byEndpoint;
        this.byPeriod = byPeriod;
        this.recentActivity = recentActivity;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public Summary getSummary() {
        return summary;
    }

    public List<EndpointUsage> getByEndpoint() {
        return byEndpoint;
    }

    public List<PeriodUsage> getByPeriod() {
        return byPeriod;
    }

    public List<RecentActivity> getRecentActivity() {
        return recentActivity;
    }

    /**
     * Totals for a set of requests. successRate is the share of 2xx responses, 0 when there were none.
     */
    public static class Summary {

        private final long totalRequests;
        private final long totalCreditsUsed;
        private final long averageResponseTimeMs;
        private final double successRate;

        public Summary(long totalRequests, long totalCreditsUsed, long averageResponseTimeMs, double successRate) {
            this.totalRequests = totalRequests;
            this.totalCreditsUsed = totalCreditsUsed;
            this.averageResponseTimeMs = averageResponseTimeMs;
            this.successRate = successRate;
        }

        static Summary from(UsageTotals totals) {
            long requests = orZero(totals.getRequestCount());
            long successful = orZero(totals.getSuccessfulRequests());
            Double average = totals.getAverageResponseTimeMs();
            return new Summary(
                    requests,
                    orZero(totals.getCreditsUsed()),
                    average != null ? Math.round(average) : 0L,
                    requests > 0 ? (double) successful / requests : 0.0);
        }

        private static long orZero(Long value) {
            return value != null ? value : 0L;
        }

        public long getTotalRequests() {
            return totalRequests;
        }

        public long getTotalCreditsUsed() {
            return totalCreditsUsed;
        }

        public long getAverageResponseTimeMs() {
            return averageResponseTimeMs;
        }

        public double getSuccessRate() {
            return successRate;
        }
    }

    public static class EndpointUsage extends Summary {

        private final String endpoint;
        private final String method;

        EndpointUsage(EndpointTotals totals) {
            this(totals.getEndpoint(), totals.getMethod(), Summary.from(totals));
        }

        private EndpointUsage(String endpoint, String method, Summary totals) {
            super(totals.getTotalRequests(), totals.getTotalCreditsUsed(), totals.getAverageResponseTimeMs(),
                    totals.getSuccessRate());
            this.endpoint = endpoint;
            this.method = method;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public String getMethod() {
            return method;
        }
    }

    public static class PeriodUsage extends Summary {

        private final String period;

        PeriodUsage(PeriodTotals totals) {
            this(totals.getPeriod(), Summary.from(totals));
        }

        private PeriodUsage(String period, Summary totals) {
            super(totals.getTotalRequests(), totals.getTotalCreditsUsed(), totals.getAverageResponseTimeMs(),
                    totals.getSuccessRate());
            this.period = period;
        }

        public String getPeriod() {
            return period;
        }
    }

    public static class RecentActivity {

        private final Long apiKeyId;
        private final String endpoint;
        private final String method;
        private final int statusCode;
        private final long responseTimeMs;
        private final long creditsUsed;
        private final Instant timestamp;

        RecentActivity(ApiUsageRecord record) {
            this.apiKeyId = record.getApiKeyId();
            this.endpoint = record.getEndpoint();
            this.method = record.getMethod();
            this.statusCode = record.getStatusCode();
            this.responseTimeMs = record.getResponseTimeMs();
            this.creditsUsed = record.getCreditsUsed();
            this.timestamp = record.getCreatedAt();
        }

        public Long getApiKeyId() {
            return apiKeyId;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public String getMethod() {
            return method;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public long getResponseTimeMs() {
            return responseTimeMs;
        }

        public long getCreditsUsed() {
            return creditsUsed;
        }

        public Instant getTimestamp() {
            return timestamp;
        }
    }
}
