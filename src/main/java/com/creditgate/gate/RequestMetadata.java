package com.creditgate.gate;

/**
 * Transport details of an incoming request, kept for usage records.
 */
public class RequestMetadata {

    private final String endpoint;
    private final String method;
    private final String clientIp;
    private final String userAgent;
    private final long startedAtMs;

    public RequestMetadata(String endpoint, String method, String clientIp, String userAgent, long startedAtMs) {
        this.endpoint = endpoint;
        this.method = method;
        this.clientIp = clientIp;
        this.userAgent = userAgent;
        this.startedAtMs = startedAtMs;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getMethod() {
        return method;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }
}
