package com.delta.mailverify.verify.smtp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EmailAddressTest {

    @Test
    void splitsAtLastAtSignAndLowercasesDomain() {
        EmailAddress address = EmailAddress.parse("  \"odd@local\"@Example.COM ").orElseThrow();

        assertEquals("\"odd@local\"", address.localPart());
        assertEquals("example.com", address.domain());
    }

    @Test
    void keepsLocalPartCase() {
        assertEquals("Jane.Doe@example.com", EmailAddress.parse("Jane.Doe@EXAMPLE.com").orElseThrow().address());
    }

    @Test
    void encodesInternationalDomain() {
        assertEquals("xn--bcher-kva.de", EmailAddress.parse("info@bücher.de").orElseThrow().domain());
    }

    @Test
    void rejectsMalformedInput() {
        assertThat(EmailAddress.parse(null)).isEmpty();
        assertThat(EmailAddress.parse("")).isEmpty();
        assertThat(EmailAddress.parse("@example.com")).isEmpty();
        assertThat(EmailAddress.parse("jane@")).isEmpty();
        assertThat(EmailAddress.parse("jane doe@example.com")).isEmpty();
        assertThat(EmailAddress.parse("jane@localhost")).isEmpty();
    }

    @Test
    void normalizeDomainStripsTrailingDot() {
        assertEquals("example.com", EmailAddress.normalizeDomain(" Example.com. "));
        assertThat(EmailAddress.normalizeDomain("  ")).isNull();
    }
}
