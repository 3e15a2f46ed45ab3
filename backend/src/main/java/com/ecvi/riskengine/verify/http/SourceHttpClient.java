package com.ecvi.riskengine.verify.http;

import com.ecvi.riskengine.config.VerificationProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP client shared by the outbound lookups. A global semaphore caps in-flight
 * calls, and a host that answered 429 is held back until its {@code Retry-After} (or a default
 * cool-down) has elapsed. No call waits or runs past the caller's deadline. Retrying is left
 * to {@link BackoffRetrier}.
 */
@Service
public class SourceHttpClient {
    static final Duration DEFAULT_RATE_LIMIT_COOLDOWN = Duration.ofSeconds(30);

    private final VerificationProperties properties;
    private final HttpClient client;
    private final Semaphore inFlight;
    private final Map<String, Instant> coolingDownUntil = new ConcurrentHashMap<>();

    public SourceHttpClient(
        VerificationProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.inFlight = new Semaphore(properties.getAdapterPoolSize());
    }

    public HttpFetchResult get(String url, String acceptHeader, Instant deadline) {
        String accept = acceptHeader == null || acceptHeader.isBlank() ? "*/*" : acceptHeader;
        return exchange(url, deadline, builder -> builder.header("Accept", accept).GET());
    }

    /** HEAD request; the body is always {@code null}. Used where only the handshake and status matter. */
    public HttpFetchResult head(String url, Instant deadline) {
        return exchange(url, deadline, builder -> builder.method("HEAD", HttpRequest.BodyPublishers.noBody()));
    }

    private HttpFetchResult exchange(String url, Instant deadline, RequestShape shape) {
        Instant startedAt = Instant.now();
        URI uri = parseUri(url);
        if (uri == null) {
            return HttpFetchResult.failure(url, startedAt, "invalid_url", "expected an absolute http(s) URL");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, startedAt, "interrupted", e.getMessage());
        }
        try {
            if (!awaitCooldown(host, deadline)) {
                return HttpFetchResult.failure(url, startedAt, "rate_limited", host + " cooling down past deadline");
            }
            Duration timeout = requestTimeout(deadline);
            if (timeout.isZero()) {
                return HttpFetchResult.failure(url, startedAt, "timeout", "deadline reached before request");
            }
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", properties.getUserAgent());
            HttpResponse<byte[]> response = client.send(shape.apply(builder).build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 429) {
                startCooldown(host, retryAfter(response));
            }
            byte[] body = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                body == null || body.length == 0 ? null : new String(body, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            if (isTlsFailure(e)) {
                return HttpFetchResult.failure(url, startedAt, HttpFetchResult.TLS_ERROR, e.getMessage());
            }
            return HttpFetchResult.failure(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return HttpFetchResult.failure(url, startedAt, "invalid_request", e.getMessage());
        } finally {
            inFlight.release();
        }
    }

    /** False when the host stays in its cool-down beyond the deadline. */
    private boolean awaitCooldown(String host, Instant deadline) throws InterruptedException {
        Instant until = coolingDownUntil.get(host);
        if (until == null) {
            return true;
        }
        Instant now = Instant.now();
        if (!until.isAfter(now)) {
            coolingDownUntil.remove(host, until);
            return true;
        }
        if (deadline != null && until.isAfter(deadline)) {
            return false;
        }
        Thread.sleep(Duration.between(now, until).toMillis());
        return true;
    }

    private void startCooldown(String host, Duration cooldown) {
        Instant until = Instant.now().plus(cooldown);
        coolingDownUntil.merge(host, until, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    private Duration requestTimeout(Instant deadline) {
        Duration configured = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        if (deadline == null) {
            return configured;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(configured) < 0 ? remaining : configured;
    }

    static Duration retryAfter(HttpResponse<?> response) {
        String value = response.headers().firstValue("Retry-After").orElse(null);
        if (value != null) {
            try {
                long seconds = Long.parseLong(value.trim());
                if (seconds > 0) {
                    return Duration.ofSeconds(seconds);
                }
            } catch (NumberFormatException ignored) {
                // HTTP-date form falls back to the default cool-down
            }
        }
        return DEFAULT_RATE_LIMIT_COOLDOWN;
    }

    private static boolean isTlsFailure(IOException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SSLException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    static URI parseUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            return lower.equals("http") || lower.equals("https") ? uri : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @FunctionalInterface
    private interface RequestShape {
        HttpRequest.Builder apply(HttpRequest.Builder builder);
    }
}
