package com.ecvi.riskengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "verification")
public class VerificationProperties {
    private static final String DEFAULT_USER_AGENT = "ecvi-risk-engine/0.1 (+compliance)";

    private String userAgent;
    private long timeoutSeconds = 7200;
    private long adapterTimeoutSeconds = 900;
    private int adapterPoolSize = 8;
    private int runConcurrency = 4;
    private int requestTimeoutSeconds = 10;
    private int staleRunMinutes = 180;
    private Retry retry = new Retry();
    private Registry registry = new Registry();
    private Dns dns = new Dns();
    private History history = new History();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public long getTimeoutSeconds() {
        return Math.max(1, timeoutSeconds);
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    public long getAdapterTimeoutSeconds() {
        return Math.max(0, adapterTimeoutSeconds);
    }

    public void setAdapterTimeoutSeconds(long adapterTimeoutSeconds) {
        this.adapterTimeoutSeconds = Math.max(0, adapterTimeoutSeconds);
    }

    public Duration timeout() {
        return Duration.ofSeconds(getTimeoutSeconds());
    }

    /**
     * Budget granted to a single adapter. Always strictly shorter than the overall
     * timeout; {@code null} when per-adapter budgets are disabled.
     */
    public Duration adapterTimeout() {
        long adapterSeconds = getAdapterTimeoutSeconds();
        if (adapterSeconds <= 0) {
            return null;
        }
        Duration overall = timeout();
        Duration adapter = Duration.ofSeconds(adapterSeconds);
        if (adapter.compareTo(overall) >= 0) {
            return overall.multipliedBy(9).dividedBy(10);
        }
        return adapter;
    }

    public int getAdapterPoolSize() {
        return Math.max(1, adapterPoolSize);
    }

    public void setAdapterPoolSize(int adapterPoolSize) {
        this.adapterPoolSize = Math.max(1, adapterPoolSize);
    }

    public int getRunConcurrency() {
        return Math.max(1, runConcurrency);
    }

    public void setRunConcurrency(int runConcurrency) {
        this.runConcurrency = Math.max(1, runConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getStaleRunMinutes() {
        return Math.max(1, staleRunMinutes);
    }

    public void setStaleRunMinutes(int staleRunMinutes) {
        this.staleRunMinutes = Math.max(1, staleRunMinutes);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Dns getDns() {
        return dns;
    }

    public void setDns(Dns dns) {
        this.dns = dns;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 500;
        private int maxDelayMs = 8000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Registry {
        private String baseUrl = "";
        private String apiToken = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken == null ? "" : apiToken.trim();
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    public static class Dns {
        private String dohEndpoint = "https://dns.google/resolve";
        private String rdapEndpoint = "https://rdap.org";
        private boolean tlsCheckEnabled = true;

        public String getDohEndpoint() {
            return dohEndpoint;
        }

        public void setDohEndpoint(String dohEndpoint) {
            this.dohEndpoint = dohEndpoint;
        }

        public String getRdapEndpoint() {
            return rdapEndpoint;
        }

        public void setRdapEndpoint(String rdapEndpoint) {
            this.rdapEndpoint = rdapEndpoint == null ? "" : rdapEndpoint.trim();
        }

        /** Empty endpoint turns domain-age lookups off. */
        public boolean isRdapConfigured() {
            return rdapEndpoint != null && !rdapEndpoint.isBlank();
        }

        public boolean isTlsCheckEnabled() {
            return tlsCheckEnabled;
        }

        public void setTlsCheckEnabled(boolean tlsCheckEnabled) {
            this.tlsCheckEnabled = tlsCheckEnabled;
        }
    }

    public static class History {
        private int trendWindow = 10;
        private int defaultLimit = 20;
        private int maxLimit = 200;

        public int getTrendWindow() {
            return Math.max(2, trendWindow);
        }

        public void setTrendWindow(int trendWindow) {
            this.trendWindow = Math.max(2, trendWindow);
        }

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }
}
