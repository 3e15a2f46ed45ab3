package com.ecvi.riskengine.verify.http;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String TLS_ERROR = "tls_error";

    static HttpFetchResult failure(String url, Instant startedAt, String code, String message) {
        Instant now = Instant.now();
        return new HttpFetchResult(url, 0, null, null, now, Duration.between(startedAt, now), code, message);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    /** True once the server answered with any status, which implies the TLS handshake (if any) succeeded. */
    public boolean isAnswered() {
        return statusCode > 0 && errorCode == null;
    }

    /** Timeouts, I/O failures, 408, 429 and 5xx are worth another attempt. */
    public boolean isRetryable() {
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url")
                && !errorCode.equals("invalid_request")
                && !errorCode.equals("interrupted")
                && !errorCode.equals("rate_limited")
                && !errorCode.equals(TLS_ERROR);
        }
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public String describe() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        return "http_" + statusCode;
    }
}
