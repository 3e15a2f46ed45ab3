package com.ecvi.riskengine.verify.adapter;

import com.ecvi.riskengine.verify.http.AdapterUnavailableException;
import com.ecvi.riskengine.verify.http.BackoffRetrier;
import com.ecvi.riskengine.verify.http.DnsOverHttpsClient;
import com.ecvi.riskengine.verify.http.HostResolution;
import com.ecvi.riskengine.verify.http.HostResolver;
import com.ecvi.riskengine.verify.http.MxLookupResult;
import com.ecvi.riskengine.verify.http.RdapClient;
import com.ecvi.riskengine.verify.http.TlsCertificateChecker;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import com.ecvi.riskengine.verify.util.CompanyNames;
import com.ecvi.riskengine.verify.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class DnsAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(DnsAdapter.class);

    static final double RESOLVABLE_SIGNAL = 0.6;
    static final double MX_SIGNAL = 0.4;

    private final HostResolver hostResolver;
    private final DnsOverHttpsClient dohClient;
    private final TlsCertificateChecker tlsChecker;
    private final RdapClient rdapClient;
    private final BackoffRetrier retrier;

    public DnsAdapter(
        HostResolver hostResolver,
        DnsOverHttpsClient dohClient,
        TlsCertificateChecker tlsChecker,
        RdapClient rdapClient,
        BackoffRetrier retrier
    ) {
        this.hostResolver = hostResolver;
        this.dohClient = dohClient;
        this.tlsChecker = tlsChecker;
        this.rdapClient = rdapClient;
        this.retrier = retrier;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.DNS;
    }

    @Override
    public Set<CompanyField> inputFields() {
        return Set.of(CompanyField.DOMAIN);
    }

    @Override
    public SourceResult evaluate(CompanySnapshot snapshot, Instant deadline) {
        String host = DomainNames.normalizeHost(snapshot.domain());
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Double> fieldConfidence = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        if (host == null || !DomainNames.isValidSyntax(host)) {
            notes.add("invalid_domain_syntax");
            if (host != null) {
                fields.put(ReportedFields.DOMAIN, host);
                fieldConfidence.put(ReportedFields.DOMAIN, 0.0);
            }
            return SourceResult.evaluated(category(), fields, fieldConfidence, 0.0, 0, List.of(), notes);
        }
        fields.put(ReportedFields.DOMAIN, host);
        fields.put(ReportedFields.DOMAIN_MATCHES_NAME, String.valueOf(domainMatchesName(host, snapshot.legalName())));

        HostResolution resolution;
        try {
            resolution = retrier.call("dns_resolve", deadline, () -> hostResolver.resolve(host));
        } catch (AdapterUnavailableException e) {
            log.warn("DNS resolution unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            return SourceResult.unavailable(category(), "resolver_unavailable: " + e.getMessage());
        }

        if (!resolution.resolvable()) {
            notes.add("domain_unresolvable");
            fieldConfidence.put(ReportedFields.DOMAIN, 0.0);
            return SourceResult.evaluated(category(), fields, fieldConfidence, 0.0, 0, List.of(), notes);
        }
        fields.put(ReportedFields.RESOLVED_ADDRESSES, String.join(",", resolution.addresses()));

        double signal = RESOLVABLE_SIGNAL;
        int corroborating = 1;
        try {
            MxLookupResult mx = dohClient.lookupMx(host, deadline);
            if (mx.hasMx()) {
                signal += MX_SIGNAL;
                corroborating++;
                fields.put(ReportedFields.MX_HOSTS, String.join(",", mx.exchanges()));
            } else {
                notes.add("no_mx_record");
            }
        } catch (AdapterUnavailableException e) {
            log.warn("MX lookup unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            notes.add("mx_unavailable");
        }
        fieldConfidence.put(ReportedFields.DOMAIN, signal);
        recordNameServers(snapshot, host, deadline, fields, notes);
        recordCertificate(snapshot, host, deadline, fields, notes);
        recordDomainAge(snapshot, host, deadline, fields, notes);
        return SourceResult.evaluated(category(), fields, fieldConfidence, signal, corroborating, List.of(), notes);
    }

    private void recordNameServers(
        CompanySnapshot snapshot, String host, Instant deadline, Map<String, String> fields, List<String> notes
    ) {
        try {
            List<String> nameServers = dohClient.lookupNs(DomainNames.registrableDomain(host), deadline);
            if (!nameServers.isEmpty()) {
                fields.put(ReportedFields.NS_HOSTS, String.join(",", nameServers));
            }
        } catch (AdapterUnavailableException e) {
            log.debug("NS lookup unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            notes.add("ns_unavailable");
        }
    }

    private void recordCertificate(
        CompanySnapshot snapshot, String host, Instant deadline, Map<String, String> fields, List<String> notes
    ) {
        try {
            Optional<Boolean> valid = tlsChecker.check(host, deadline);
            if (valid.isPresent()) {
                fields.put(ReportedFields.SSL_VALID, String.valueOf(valid.get()));
                if (!valid.get()) {
                    notes.add("ssl_invalid");
                }
            }
        } catch (AdapterUnavailableException e) {
            log.debug("TLS check unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            notes.add("ssl_check_unavailable");
        }
    }

    private void recordDomainAge(
        CompanySnapshot snapshot, String host, Instant deadline, Map<String, String> fields, List<String> notes
    ) {
        try {
            Optional<Instant> registeredAt = rdapClient.registeredAt(DomainNames.registrableDomain(host), deadline);
            if (registeredAt.isPresent()) {
                long days = Math.max(0, Duration.between(registeredAt.get(), Instant.now()).toDays());
                fields.put(ReportedFields.DOMAIN_AGE_DAYS, String.valueOf(days));
            }
        } catch (AdapterUnavailableException e) {
            log.debug("Domain age lookup unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
            notes.add("domain_age_unavailable");
        }
    }

    /**
     * True when at least half of the significant words of the legal name appear in the
     * domain label, the label appears in the name, or the label is the name's acronym.
     */
    static boolean domainMatchesName(String host, String legalName) {
        String label = DomainNames.primaryLabel(host);
        List<String> words = CompanyNames.significantWords(legalName);
        if (label == null || label.isBlank() || words.isEmpty()) {
            return false;
        }
        String compactLabel = label.replace("-", "");
        int matched = 0;
        StringBuilder acronym = new StringBuilder();
        for (String word : words) {
            if (compactLabel.contains(word)) {
                matched++;
            }
            acronym.append(word.charAt(0));
        }
        if (matched * 2 >= words.size()) {
            return true;
        }
        String compactName = String.join("", words);
        if (compactLabel.length() >= 3 && compactName.contains(compactLabel)) {
            return true;
        }
        return words.size() > 1 && compactLabel.equals(acronym.toString());
    }
}
