package com.creditgate.api;

import com.creditgate.gate.RequestMetadata;
import com.creditgate.ratelimit.RateLimitDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Helpers shared by the credential-authenticated controllers.
 */
final class GatedRequests {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_RETRY_AFTER = "Retry-After";
    private static final String BEARER_PREFIX = "Bearer ";

    private GatedRequests() {
    }

    /**
     * Extracts the key from an "Authorization: Bearer ..." header.
     * @return the raw key, or null if the header is missing or not a bearer header
     */
    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    static RequestMetadata metadata(HttpServletRequest request) {
        return new RequestMetadata(
                request.getRequestURI(),
                request.getMethod(),
                clientIp(request),
                request.getHeader("User-Agent"),
                System.currentTimeMillis());
    }

    static void applyRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(HEADER_LIMIT, String.valueOf(decision.getLimit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.getRemaining()));
        response.setHeader(HEADER_RESET, String.valueOf(decision.getResetAt().getEpochSecond()));
        if (decision.getRetryAfterSeconds() != null) {
            response.setHeader(HEADER_RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        }
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
