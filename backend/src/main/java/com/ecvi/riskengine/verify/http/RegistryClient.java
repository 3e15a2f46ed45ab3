package com.ecvi.riskengine.verify.http;

import com.ecvi.riskengine.config.VerificationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;

/**
 * Company registry lookups against an OpenCorporates-style API:
 * {@code GET {base}/companies/{jurisdiction}/{number}}.
 */
@Service
public class RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(RegistryClient.class);

    private final VerificationProperties properties;
    private final SourceHttpClient httpClient;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;

    public RegistryClient(
        VerificationProperties properties,
        SourceHttpClient httpClient,
        BackoffRetrier retrier,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.retrier = retrier;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return properties.getRegistry().isConfigured();
    }

    /**
     * @throws AdapterUnavailableException when the registry is not configured or cannot be reached
     */
    public RegistryLookupResult lookup(String jurisdiction, String companyNumber, Instant deadline) {
        if (!isConfigured()) {
            throw new AdapterUnavailableException("registry_not_configured");
        }
        String url = buildUrl(jurisdiction, companyNumber);
        return retrier.call("registry_lookup", deadline, () -> {
            HttpFetchResult result = httpClient.get(url, "application/json", deadline);
            if (result.statusCode() == 404) {
                return RegistryLookupResult.notFound();
            }
            if (result.isSuccessful()) {
                return parse(result.body());
            }
            if (result.isRetryable()) {
                throw new AdapterTransientException("registry_" + result.describe());
            }
            log.warn("Registry lookup for {}/{} failed: {}", jurisdiction, companyNumber, result.describe());
            throw new AdapterUnavailableException("registry_" + result.describe());
        });
    }

    private String buildUrl(String jurisdiction, String companyNumber) {
        String base = properties.getRegistry().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringBuilder url = new StringBuilder(base)
            .append("/companies/")
            .append(URLEncoder.encode(jurisdiction.trim().toLowerCase(Locale.ROOT), StandardCharsets.UTF_8))
            .append('/')
            .append(URLEncoder.encode(companyNumber.trim(), StandardCharsets.UTF_8));
        String token = properties.getRegistry().getApiToken();
        if (token != null && !token.isBlank()) {
            url.append("?api_token=").append(URLEncoder.encode(token, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    RegistryLookupResult parse(String body) {
        JsonNode company;
        try {
            company = objectMapper.readTree(body == null ? "" : body).path("results").path("company");
        } catch (Exception e) {
            throw new AdapterUnavailableException("registry_invalid_json", e);
        }
        if (company.isMissingNode() || company.isNull()) {
            return RegistryLookupResult.notFound();
        }
        return new RegistryLookupResult(
            true,
            text(company, "name"),
            text(company, "company_number"),
            text(company, "jurisdiction_code"),
            text(company, "current_status")
        );
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }
}
