package com.ecvi.riskengine.verify.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainNamesTest {

    @Test
    void normalizeHostStripsSchemePathAndWww() {
        assertThat(DomainNames.normalizeHost("https://WWW.Acme.com/about?x=1")).isEqualTo("acme.com");
        assertThat(DomainNames.normalizeHost("acme.com.")).isEqualTo("acme.com");
        assertThat(DomainNames.normalizeHost("  ")).isNull();
    }

    @Test
    void syntaxCheckRejectsBareLabelsAndLeadingHyphen() {
        assertThat(DomainNames.isValidSyntax("acme.com")).isTrue();
        assertThat(DomainNames.isValidSyntax("shop.acme.co.uk")).isTrue();
        assertThat(DomainNames.isValidSyntax("acme")).isFalse();
        assertThat(DomainNames.isValidSyntax("-acme.com")).isFalse();
        assertThat(DomainNames.isValidSyntax("not a domain")).isFalse();
    }

    @Test
    void registrableDomainHonoursSecondLevelSuffixes() {
        assertThat(DomainNames.registrableDomain("shop.acme.co.uk")).isEqualTo("acme.co.uk");
        assertThat(DomainNames.registrableDomain("mail.acme.com")).isEqualTo("acme.com");
        assertThat(DomainNames.primaryLabel("www.acme.co.uk")).isEqualTo("acme");
    }
}
