package com.ecvi.riskengine.verify.http;

import com.ecvi.riskengine.config.VerificationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

@Component
public class BackoffRetrier {
    private static final Logger log = LoggerFactory.getLogger(BackoffRetrier.class);

    private final VerificationProperties properties;

    public BackoffRetrier(VerificationProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs {@code attempt} until it succeeds, throws something other than
     * {@link AdapterTransientException}, runs out of attempts, or the deadline passes.
     *
     * @param operation short name used in logs and in the unavailable message
     * @param deadline  adapter budget; {@code null} means attempts alone bound the loop
     */
    public <T> T call(String operation, Instant deadline, Supplier<T> attempt) {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        AdapterTransientException last = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            if (deadlinePassed(deadline)) {
                break;
            }
            try {
                return attempt.get();
            } catch (AdapterTransientException e) {
                last = e;
                log.debug("{} attempt {}/{} failed: {}", operation, attemptNumber, maxAttempts, e.getMessage());
                if (attemptNumber >= maxAttempts) {
                    break;
                }
                if (!sleepBackoff(attemptNumber, deadline)) {
                    throw new AdapterUnavailableException(operation + " interrupted", e);
                }
            }
        }
        String reason = last == null ? "budget_exhausted" : last.getMessage();
        throw new AdapterUnavailableException(operation + " unavailable after retries: " + reason, last);
    }

    private boolean sleepBackoff(int attempt, Instant deadline) {
        int baseDelayMs = properties.getRetry().getBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRetry().getMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        if (deadline != null) {
            long remaining = Duration.between(Instant.now(), deadline).toMillis();
            sleepMs = Math.min(sleepMs, Math.max(0, remaining));
        }
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean deadlinePassed(Instant deadline) {
        return deadline != null && !Instant.now().isBefore(deadline);
    }
}
