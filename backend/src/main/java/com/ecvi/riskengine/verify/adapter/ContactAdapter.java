package com.ecvi.riskengine.verify.adapter;

import com.ecvi.riskengine.verify.http.AdapterUnavailableException;
import com.ecvi.riskengine.verify.http.BackoffRetrier;
import com.ecvi.riskengine.verify.http.DnsOverHttpsClient;
import com.ecvi.riskengine.verify.http.HostResolution;
import com.ecvi.riskengine.verify.http.HostResolver;
import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import com.ecvi.riskengine.verify.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on the contact email and phone. The email host is checked for
 * existence and MX only; deliverability is never asserted.
 */
@Component
public class ContactAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ContactAdapter.class);

    static final double EMAIL_FORMAT_SIGNAL = 0.4;
    static final double EMAIL_HOST_SIGNAL = 0.2;
    static final double EMAIL_MX_SIGNAL = 0.1;
    static final double PHONE_SIGNAL = 0.6;

    private static final Pattern EMAIL_FORMAT =
        Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_FORMATTING = Pattern.compile("[\\s\\-()+.]");
    private static final Pattern DIGITS = Pattern.compile("^\\d{7,15}$");

    private final HostResolver hostResolver;
    private final DnsOverHttpsClient dohClient;
    private final BackoffRetrier retrier;

    public ContactAdapter(HostResolver hostResolver, DnsOverHttpsClient dohClient, BackoffRetrier retrier) {
        this.hostResolver = hostResolver;
        this.dohClient = dohClient;
        this.retrier = retrier;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.CONTACT;
    }

    @Override
    public Set<CompanyField> inputFields() {
        return Set.of(CompanyField.EMAIL, CompanyField.PHONE);
    }

    @Override
    public SourceResult evaluate(CompanySnapshot snapshot, Instant deadline) {
        Map<String, String> fields = new LinkedHashMap<>();
        Map<String, Double> fieldConfidence = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        double signalTotal = 0.0;
        int channels = 0;
        int corroborating = 0;

        if (snapshot.hasValue(CompanyField.EMAIL)) {
            channels++;
            String email = snapshot.email().trim();
            double emailSignal = 0.0;
            if (EMAIL_FORMAT.matcher(email).matches()) {
                emailSignal += EMAIL_FORMAT_SIGNAL;
                corroborating++;
                fields.put(ReportedFields.EMAIL_VALID, "true");
                String host = DomainNames.normalizeHost(email.substring(email.lastIndexOf('@') + 1));
                fields.put(ReportedFields.DOMAIN, host);
                try {
                    HostResolution resolution = retrier.call("email_host_resolve", deadline, () -> hostResolver.resolve(host));
                    if (resolution.resolvable()) {
                        emailSignal += EMAIL_HOST_SIGNAL;
                        corroborating++;
                    } else {
                        notes.add("email_host_unresolvable");
                    }
                    if (dohClient.lookupMx(host, deadline).hasMx()) {
                        emailSignal += EMAIL_MX_SIGNAL;
                    } else {
                        notes.add("email_host_no_mx");
                    }
                } catch (AdapterUnavailableException e) {
                    log.warn("Email host checks unavailable for company {}: {}", snapshot.companyId(), e.getMessage());
                    notes.add("email_host_check_unavailable");
                }
            } else {
                fields.put(ReportedFields.EMAIL_VALID, "false");
                notes.add("invalid_email_format");
            }
            fieldConfidence.put(CompanyField.EMAIL.key(), emailSignal);
            signalTotal += emailSignal;
        }

        if (snapshot.hasValue(CompanyField.PHONE)) {
            channels++;
            double phoneSignal = 0.0;
            String phoneDigits = normalizePhone(snapshot.phone());
            if (isValidPhone(phoneDigits)) {
                phoneSignal = PHONE_SIGNAL;
                fields.put(ReportedFields.PHONE_VALID, "true");
                if (corroborating == 0) {
                    corroborating = 1;
                }
            } else {
                fields.put(ReportedFields.PHONE_VALID, "false");
                notes.add("invalid_phone_format");
            }
            fieldConfidence.put(CompanyField.PHONE.key(), phoneSignal);
            signalTotal += phoneSignal;
        }

        double signal = channels == 0 ? 0.0 : signalTotal / channels;
        return SourceResult.evaluated(category(), fields, fieldConfidence, signal, corroborating, List.of(), notes);
    }

    static String normalizePhone(String raw) {
        if (raw == null) {
            return "";
        }
        return PHONE_FORMATTING.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /** 7 to 15 digits, not a single repeated digit and not a palindrome. */
    static boolean isValidPhone(String digits) {
        if (digits == null || !DIGITS.matcher(digits).matches()) {
            return false;
        }
        if (digits.chars().distinct().count() == 1) {
            return false;
        }
        return !new StringBuilder(digits).reverse().toString().equals(digits);
    }
}
