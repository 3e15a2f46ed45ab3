package com.ecvi.riskengine.verify.adapter;

/** Keys under which adapters report observed values in {@code SourceResult.fields}. */
public final class ReportedFields {
    public static final String LEGAL_NAME = "legal_name";
    public static final String REGISTRATION_NUMBER = "registration_number";
    public static final String JURISDICTION = "jurisdiction";
    public static final String COUNTRY = "country";
    public static final String DOMAIN = "domain";
    public static final String DOMAIN_MATCHES_NAME = "domain_matches_name";
    public static final String RESOLVED_ADDRESSES = "resolved_addresses";
    public static final String MX_HOSTS = "mx_hosts";
    public static final String NS_HOSTS = "ns_hosts";
    public static final String SSL_VALID = "ssl_valid";
    public static final String DOMAIN_AGE_DAYS = "domain_age_days";
    public static final String EMAIL_VALID = "email_format_valid";
    public static final String PHONE_VALID = "phone_format_valid";
    public static final String REGISTRY_STATUS = "registry_status";
    public static final String ADDRESS_COMPLETENESS = "address_completeness";

    private ReportedFields() {
    }
}
