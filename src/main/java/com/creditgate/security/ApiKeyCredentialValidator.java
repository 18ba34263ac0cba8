package com.creditgate.security;

import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.repository.ApiKeyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Validates API keys by HMAC lookup.
 */
@Component
public class ApiKeyCredentialValidator implements CredentialValidator {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyCredentialValidator.class);

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyService apiKeyService;
    private final Clock clock;

    public ApiKeyCredentialValidator(ApiKeyRepository apiKeyRepository, ApiKeyService apiKeyService, Clock clock) {
        this.apiKeyRepository = apiKeyRepository;
        this.apiKeyService = apiKeyService;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public ApiKey resolve(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new InvalidCredentialException("Missing API key");
        }
        if (!ApiKeyService.hasKnownPrefix(rawKey)) {
            throw new InvalidCredentialException("Invalid API key format");
        }

        String hmac = apiKeyService.computeHmac(rawKey);
        ApiKey key = apiKeyRepository.findByKeyHmac(hmac)
                .orElseThrow(() -> {
                    logger.debug("Unknown API key presented (prefix {})", ApiKeyService.displayPrefix(rawKey));
                    return new InvalidCredentialException("Invalid API key");
                });

        // Index lookup already matched; compare again without leaking timing
        if (!apiKeyService.constantTimeEquals(hmac, key.getKeyHmac())) {
            throw new InvalidCredentialException("Invalid API key");
        }
        return key;
    }

    @Override
    public void validate(ApiKey credential, String requiredScope) {
        Instant now = Instant.now(clock);
        if (credential.isExpired(now)) {
            throw new ExpiredCredentialException(credential.getExpiresAt());
        }
        if (!credential.isActive()) {
            throw new ForbiddenCredentialException("API key is disabled", requiredScope);
        }
        if (requiredScope != null && !credential.hasScope(requiredScope)) {
            throw new ForbiddenCredentialException(
                    "API key lacks required scope: " + requiredScope, requiredScope);
        }
    }
}
