package com.ecvi.riskengine.verify.http;

import com.ecvi.riskengine.config.VerificationProperties;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Checks that a host serves HTTPS with a certificate the platform trust store accepts. A HEAD
 * request that gets any HTTP answer means the handshake (chain, validity dates and host name)
 * passed; a TLS failure means it did not.
 */
@Service
public class TlsCertificateChecker {
    private final VerificationProperties properties;
    private final SourceHttpClient httpClient;
    private final BackoffRetrier retrier;

    public TlsCertificateChecker(VerificationProperties properties, SourceHttpClient httpClient, BackoffRetrier retrier) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.retrier = retrier;
    }

    /**
     * @return empty when the check is switched off
     * @throws AdapterUnavailableException when the host cannot be reached at all
     */
    public Optional<Boolean> check(String host, Instant deadline) {
        if (!properties.getDns().isTlsCheckEnabled()) {
            return Optional.empty();
        }
        String url = "https://" + host + "/";
        return retrier.call("tls_check", deadline, () -> {
            HttpFetchResult result = httpClient.head(url, deadline);
            if (result.isAnswered()) {
                return Optional.of(Boolean.TRUE);
            }
            if (HttpFetchResult.TLS_ERROR.equals(result.errorCode())) {
                return Optional.of(Boolean.FALSE);
            }
            if (result.isRetryable()) {
                throw new AdapterTransientException("tls_" + result.describe());
            }
            throw new AdapterUnavailableException("tls_" + result.describe());
        });
    }
}
