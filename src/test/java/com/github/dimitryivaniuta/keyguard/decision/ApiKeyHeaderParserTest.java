package com.github.dimitryivaniuta.keyguard.decision;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyHeaderParserTest {

    @Test
    void splitsOnFirstDot() {
        assertThat(ApiKeyHeaderParser.parse(" ak_abc.sk_def "))
                .hasValueSatisfying(c -> {
                    assertThat(c.keyId()).isEqualTo("ak_abc");
                    assertThat(c.secret()).isEqualTo("sk_def");
                    assertThat(c.toString()).doesNotContain("sk_def");
                });
    }

    @Test
    void rejectsValuesWithoutBothParts() {
        assertThat(ApiKeyHeaderParser.parse(null)).isEmpty();
        assertThat(ApiKeyHeaderParser.parse("sk_only")).isEmpty();
        assertThat(ApiKeyHeaderParser.parse(".sk_def")).isEmpty();
        assertThat(ApiKeyHeaderParser.parse("ak_abc.")).isEmpty();
    }
}
