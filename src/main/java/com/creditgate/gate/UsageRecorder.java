package com.creditgate.gate;

import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.model.ApiUsageRecord;
import com.creditgate.shared.repository.ApiKeyRepository;
import com.creditgate.shared.repository.ApiUsageRecordRepository;
import com.creditgate.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Best-effort usage analytics. Each record is written in its own transaction
 * and a failure never reaches the caller.
 */
@Component
public class UsageRecorder {

    private static final Logger logger = LoggerFactory.getLogger(UsageRecorder.class);
    private static final int MAX_USER_AGENT = 500;

    private final ApiUsageRecordRepository usageRepository;
    private final ApiKeyRepository apiKeyRepository;
    private final TransactionTemplate recordTx;
    private final Clock clock;

    public UsageRecorder(ApiUsageRecordRepository usageRepository,
                         ApiKeyRepository apiKeyRepository,
                         PlatformTransactionManager txManager,
                         Clock clock) {
        this.usageRepository = usageRepository;
        this.apiKeyRepository = apiKeyRepository;
        this.clock = clock;
        this.recordTx = new TransactionTemplate(txManager);
        this.recordTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Records one request against a credential and touches its lastUsedAt.
     * @return true if the record was written
     */
    public boolean record(ApiKey credential, RequestMetadata request, int statusCode, long creditsUsed) {
        try {
            recordTx.executeWithoutResult(status -> {
                ApiUsageRecord record = new ApiUsageRecord();
                record.setApiKeyId(credential.getId());
                record.setTenantId(credential.getTenantId());
                record.setEndpoint(request.getEndpoint());
                record.setMethod(request.getMethod());
                record.setStatusCode(statusCode);
                record.setResponseTimeMs(Math.max(0, System.currentTimeMillis() - request.getStartedAtMs()));
                record.setCreditsUsed(creditsUsed);
                record.setIpAddress(request.getClientIp());
                record.setUserAgent(Strings.truncate(request.getUserAgent(), MAX_USER_AGENT));
                record.setCreatedAt(Instant.now(clock));
                usageRepository.save(record);
                apiKeyRepository.touchLastUsed(credential.getId(), Instant.now(clock));
            });
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to record API usage: keyId={}, endpoint={}, status={}",
                    credential.getId(), request.getEndpoint(), statusCode, e);
            return false;
        }
    }
}
