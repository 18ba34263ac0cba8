package com.creditgate.shared.repository;

import com.creditgate.shared.model.ApiUsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for API usage analytics records.
 */
@Repository
public interface ApiUsageRecordRepository extends JpaRepository<ApiUsageRecord, Long> {

    List<ApiUsageRecord> findByApiKeyIdOrderByCreatedAtDesc(Long apiKeyId);

    long countByTenantId(Long tenantId);

    List<ApiUsageRecord> findTop10ByTenantIdOrderByCreatedAtDescIdDesc(Long tenantId);

    /**
     * Totals over a tenant's requests in [start, end].
     */
    @Query(value = """
        SELECT COUNT(*) AS "requestCount",
               CAST(COALESCE(SUM(credits_used), 0) AS BIGINT) AS "creditsUsed",
               CAST(COALESCE(AVG(response_time_ms), 0) AS DOUBLE PRECISION) AS "averageResponseTimeMs",
               COUNT(CASE WHEN status_code >= 200 AND status_code < 300 THEN 1 END) AS "successfulRequests"
        FROM api_usage
        WHERE tenant_id = :tenantId
          AND created_at BETWEEN :start AND :end
        """, nativeQuery = true)
    UsageTotals summarize(@Param("tenantId") Long tenantId,
                          @Param("start") Instant start,
                          @Param("end") Instant end);

    @Query(value = """
        SELECT endpoint AS "endpoint",
               method AS "method",
               COUNT(*) AS "requestCount",
               CAST(COALESCE(SUM(credits_used), 0) AS BIGINT) AS "creditsUsed",
               CAST(COALESCE(AVG(response_time_ms), 0) AS DOUBLE PRECISION) AS "averageResponseTimeMs",
               COUNT(CASE WHEN status_code >= 200 AND status_code < 300 THEN 1 END) AS "successfulRequests"
        FROM api_usage
        WHERE tenant_id = :tenantId
          AND created_at BETWEEN :start AND :end
        GROUP BY endpoint, method
        ORDER BY "requestCount" DESC, endpoint
        LIMIT 50
        """, nativeQuery = true)
    List<EndpointTotals> summarizeByEndpoint(@Param("tenantId") Long tenantId,
                                             @Param("start") Instant start,
                                             @Param("end") Instant end);

    /**
     * Totals per period; pattern is a PostgreSQL TO_CHAR format such as YYYY-MM-DD.
     */
    @Query(value = """
        SELECT TO_CHAR(created_at AT TIME ZONE 'UTC', :pattern) AS "period",
               COUNT(*) AS "requestCount",
               CAST(COALESCE(SUM(credits_used), 0) AS BIGINT) AS "creditsUsed",
               CAST(COALESCE(AVG(response_time_ms), 0) AS DOUBLE PRECISION) AS "averageResponseTimeMs",
               COUNT(CASE WHEN status_code >= 200 AND status_code < 300 THEN 1 END) AS "successfulRequests"
        FROM api_usage
        WHERE tenant_id = :tenantId
          AND created_at BETWEEN :start AND :end
        GROUP BY 1
        ORDER BY 1
        """, nativeQuery = true)
    List<PeriodTotals> summarizeByPeriod(@Param("tenantId") Long tenantId,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end,
                                         @Param("pattern") String pattern);

    interface UsageTotals {
        Long getRequestCount();

        Long getCreditsUsed();

        Double getAverageResponseTimeMs();

        Long getSuccessfulRequests();
    }

    interface EndpointTotals extends UsageTotals {
        String getEndpoint();

        String getMethod();
    }

    interface PeriodTotals extends UsageTotals {
        String getPeriod();
    }
}
