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
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Domain registration dates from RDAP ({@code GET {base}/domain/{name}}, RFC 9083). The
 * {@code registration} event of the response is the creation date WHOIS used to report.
 */
@Service
public class RdapClient {
    private static final Logger log = LoggerFactory.getLogger(RdapClient.class);
    private static final String RDAP_JSON = "application/rdap+json, application/json";

    private final VerificationProperties properties;
    private final SourceHttpClient httpClient;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;

    public RdapClient(
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

    /**
     * @return empty when lookups are not configured, the domain is unknown to RDAP, or the
     *     response carries no registration event
     * @throws AdapterUnavailableException when the service cannot be reached
     */
    public Optional<Instant> registeredAt(String domain, Instant deadline) {
        if (!properties.getDns().isRdapConfigured()) {
            return Optional.empty();
        }
        String base = properties.getDns().getRdapEndpoint();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String url = base + "/domain/" + URLEncoder.encode(domain, StandardCharsets.UTF_8);
        return retrier.call("rdap_lookup", deadline, () -> {
            HttpFetchResult result = httpClient.get(url, RDAP_JSON, deadline);
            if (result.statusCode() == 404) {
                return Optional.<Instant>empty();
            }
            if (result.isSuccessful()) {
                return registrationEvent(domain, result.body());
            }
            if (result.isRetryable()) {
                throw new AdapterTransientException("rdap_" + result.describe());
            }
            throw new AdapterUnavailableException("rdap_" + result.describe());
        });
    }

    Optional<Instant> registrationEvent(String domain, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (Exception e) {
            throw new AdapterUnavailableException("rdap_invalid_json", e);
        }
        if (root == null || !root.isObject()) {
            throw new AdapterUnavailableException("rdap_invalid_json");
        }
        for (JsonNode event : root.path("events")) {
            if (!"registration".equalsIgnoreCase(event.path("eventAction").asText())) {
                continue;
            }
            String date = event.path("eventDate").asText("");
            try {
                return Optional.of(OffsetDateTime.parse(date).toInstant());
            } catch (DateTimeParseException e) {
                log.debug("Unparseable RDAP registration date for {}: {}", domain, date);
            }
        }
        return Optional.empty();
    }
}
