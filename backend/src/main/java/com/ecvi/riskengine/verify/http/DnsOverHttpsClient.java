package com.ecvi.riskengine.verify.http;

import com.ecvi.riskengine.config.VerificationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * MX and NS lookups over a JSON DNS-over-HTTPS endpoint (Google / Cloudflare {@code application/dns-json}).
 */
@Service
public class DnsOverHttpsClient {
    private static final String DNS_JSON = "application/dns-json";
    private static final int NS_TYPE = 2;
    private static final int MX_TYPE = 15;
    private static final int RCODE_NOERROR = 0;
    private static final int RCODE_NXDOMAIN = 3;

    private final VerificationProperties properties;
    private final SourceHttpClient httpClient;
    private final BackoffRetrier retrier;
    private final ObjectMapper objectMapper;

    public DnsOverHttpsClient(
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

    public MxLookupResult lookupMx(String domain, Instant deadline) {
        String url = queryUrl(domain, "MX");
        return retrier.call("mx_lookup", deadline, () -> {
            JsonNode root = answer(fetch(url, deadline));
            if (root == null) {
                return new MxLookupResult(domain, false, List.of());
            }
            return new MxLookupResult(domain, true, records(root, MX_TYPE));
        });
    }

    /**
     * Authoritative name servers of the domain, lower-cased without the trailing dot. Empty when
     * the domain does not exist or publishes none.
     */
    public List<String> lookupNs(String domain, Instant deadline) {
        String url = queryUrl(domain, "NS");
        return retrier.call("ns_lookup", deadline, () -> {
            JsonNode root = answer(fetch(url, deadline));
            return root == null ? List.of() : records(root, NS_TYPE);
        });
    }

    private String queryUrl(String domain, String type) {
        return properties.getDns().getDohEndpoint()
            + "?name=" + URLEncoder.encode(domain, StandardCharsets.UTF_8)
            + "&type=" + type;
    }

    private HttpFetchResult fetch(String url, Instant deadline) {
        HttpFetchResult result = httpClient.get(url, DNS_JSON, deadline);
        if (result.isSuccessful()) {
            return result;
        }
        if (result.isRetryable()) {
            throw new AdapterTransientException("doh_" + result.describe());
        }
        throw new AdapterUnavailableException("doh_" + result.describe());
    }

    /** The parsed response, or {@code null} for NXDOMAIN. */
    JsonNode answer(HttpFetchResult result) {
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body() == null ? "" : result.body());
        } catch (Exception e) {
            throw new AdapterUnavailableException("doh_invalid_json", e);
        }
        if (root == null || !root.has("Status")) {
            throw new AdapterUnavailableException("doh_invalid_json");
        }
        int status = root.path("Status").asInt(-1);
        if (status == RCODE_NXDOMAIN) {
            return null;
        }
        if (status != RCODE_NOERROR) {
            throw new AdapterTransientException("doh_rcode_" + status);
        }
        return root;
    }

    private List<String> records(JsonNode root, int type) {
        List<String> hosts = new ArrayList<>();
        for (JsonNode answer : root.path("Answer")) {
            if (answer.path("type").asInt() != type) {
                continue;
            }
            String host = targetHost(answer.path("data").asText(""));
            if (host != null) {
                hosts.add(host);
            }
        }
        return hosts;
    }

    private String targetHost(String data) {
        String[] parts = data.trim().split("\\s+");
        String host = parts[parts.length - 1];
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        // a null MX ("0 .") means the domain accepts no mail
        if (host.isBlank()) {
            return null;
        }
        return host.toLowerCase(Locale.ROOT);
    }
}
