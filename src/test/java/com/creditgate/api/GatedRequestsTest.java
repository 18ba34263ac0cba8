package com.creditgate.api;

import com.creditgate.gate.RequestMetadata;
import com.creditgate.ratelimit.RateLimitDecision;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GatedRequestsTest {

    @Test
    void bearerToken_extractsKeyCaseInsensitively() {
        assertThat(GatedRequests.bearerToken("Bearer cg_live_abc")).isEqualTo("cg_live_abc");
        assertThat(GatedRequests.bearerToken("bearer   cg_live_abc ")).isEqualTo("cg_live_abc");
    }

    @Test
    void bearerToken_rejectsOtherSchemes() {
        assertThat(GatedRequests.bearerToken(null)).isNull();
        assertThat(GatedRequests.bearerToken("Basic dXNlcjpwYXNz")).isNull();
        assertThat(GatedRequests.bearerToken("Bearer ")).isNull();
    }

    @Test
    void metadata_prefersFirstForwardedAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/verify");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.2");
        request.addHeader("User-Agent", "curl/8.0");
        request.setRemoteAddr("10.0.0.2");

        RequestMetadata metadata = GatedRequests.metadata(request);

        assertThat(metadata.getClientIp()).isEqualTo("203.0.113.7");
        assertThat(metadata.getEndpoint()).isEqualTo("/api/v1/verify");
        assertThat(metadata.getMethod()).isEqualTo("POST");
        assertThat(metadata.getUserAgent()).isEqualTo("curl/8.0");
    }

    @Test
    void applyRateLimitHeaders_addsRetryAfterOnlyWhenPresent() {
        Instant resetAt = Instant.ofEpochSecond(1_760_000_000L);
        MockHttpServletResponse allowed = new MockHttpServletResponse();
        GatedRequests.applyRateLimitHeaders(allowed, RateLimitDecision.allow(10, 7, resetAt));

        assertThat(allowed.getHeader("X-RateLimit-Limit")).isEqualTo("10");
        assertThat(allowed.getHeader("X-RateLimit-Remaining")).isEqualTo("7");
        assertThat(allowed.getHeader("X-RateLimit-Reset")).isEqualTo("1760000000");
        assertThat(allowed.getHeader("Retry-After")).isNull();

        MockHttpServletResponse rejected = new MockHttpServletResponse();
        GatedRequests.applyRateLimitHeaders(rejected, RateLimitDecision.reject(10, resetAt, 42));
        assertThat(rejected.getHeader("Retry-After")).isEqualTo("42");
    }
}
