package com.creditgate.security;

import com.creditgate.shared.model.ApiKey;
import com.creditgate.shared.repository.ApiKeyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;

/**
 * Issues API keys and hashes presented keys for lookup.
 * Raw keys are "cg_live_" or "cg_test_" followed by 32 random bytes as base64url
 * (without padding). Only the HMAC-SHA256 of a raw key is stored.
 */
@Service
public class ApiKeyService {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyService.class);

    public static final String LIVE_PREFIX = "cg_live_";
    public static final String TEST_PREFIX = "cg_test_";
    private static final int KEY_BYTES = 32;
    private static final int DISPLAY_PREFIX_LENGTH = 12;
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final ApiKeyRepository apiKeyRepository;
    private final String tokenSecret;
    private final SecureRandom secureRandom;

    public ApiKeyService(ApiKeyRepository apiKeyRepository,
                         @Value("${app.security.token-secret:change-me-in-production}") String tokenSecret) {
        this.apiKeyRepository = apiKeyRepository;
        this.tokenSecret = tokenSecret;
        this.secureRandom = new SecureRandom();

        if ("change-me-in-production".equals(tokenSecret)) {
            logger.warn("Using default token secret! Set APP_TOKEN_SECRET environment variable in production.");
        }
    }

    /**
     * Generates a new raw key.
     * @param live true for a production key, false for a test key
     */
    public String generateRawKey(boolean live) {
        byte[] keyBytes = new byte[KEY_BYTES];
        secureRandom.nextBytes(keyBytes);
        return (live ? LIVE_PREFIX : TEST_PREFIX)
                + Base64.getUrlEncoder().withoutPadding().encodeToString(keyBytes);
    }

    public static boolean hasKnownPrefix(String rawKey) {
        return rawKey != null && (rawKey.startsWith(LIVE_PREFIX) || rawKey.startsWith(TEST_PREFIX));
    }

    /**
     * First characters of a key, safe to show in listings and logs.
     */
    public static String displayPrefix(String rawKey) {
        return rawKey.length() <= DISPLAY_PREFIX_LENGTH ? rawKey : rawKey.substring(0, DISPLAY_PREFIX_LENGTH);
    }

    /**
     * Computes the base64 HMAC-SHA256 of a raw key with the app secret.
     */
    public String computeHmac(String rawKey) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(tokenSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] hmacBytes = mac.doFinal(rawKey.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hmacBytes);
        } catch (GeneralSecurityException e) {
            logger.error("Failed to compute HMAC for API key", e);
            throw new IllegalStateException("Failed to compute API key HMAC", e);
        }
    }

    /**
     * Constant-time string comparison via MessageDigest.isEqual.
     */
    public boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates and persists a key for a tenant. The raw key is only available in the result.
     */
    @Transactional
    public IssuedApiKey issue(Long tenantId, String name, String scopes, Integer rateLimit,
                              Instant expiresAt, boolean live) {
        String rawKey = generateRawKey(live);
        ApiKey key = new ApiKey(tenantId, displayPrefix(rawKey), computeHmac(rawKey), name);
        key.setScopes(scopes != null ? scopes.trim() : "");
        if (rateLimit != null) {
            key.setRateLimit(rateLimit);
        }
        key.setExpiresAt(expiresAt);
        ApiKey saved = apiKeyRepository.save(key);
        logger.info("Issued API key {} for tenant {} (prefix {})", saved.getId(), tenantId, saved.getKeyPrefix());
        return new IssuedApiKey(saved, rawKey);
    }

    /**
     * A freshly issued key together with its raw value.
     */
    public static class IssuedApiKey {
        private final ApiKey apiKey;
        private final String rawKey;

        public IssuedApiKey(ApiKey apiKey, String rawKey) {
            this.apiKey = apiKey;
            this.rawKey = rawKey;
        }

        public ApiKey getApiKey() {
            return apiKey;
        }

        public String getRawKey() {
            return rawKey;
        }
    }
}
