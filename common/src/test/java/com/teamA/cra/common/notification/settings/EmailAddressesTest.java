package com.teamA.cra.common.notification.settings;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class EmailAddressesTest {

    @Test
    void shouldSplitOnCommaSemicolonAndNewline() {
        assertThat(EmailAddresses.parse("a@x.com, b@x.com;c@x.com\n d@x.com ;;"))
                .containsExactly("a@x.com", "b@x.com", "c@x.com", "d@x.com");
    }

    @Test
    void shouldDedupeCaseInsensitivelyKeepingFirstSpelling() {
        assertThat(EmailAddresses.dedupe(Arrays.asList("Ann@X.com", null, " ann@x.com", "", "bob@x.com")))
                .containsExactly("Ann@X.com", "bob@x.com");
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(EmailAddresses.parse(null)).isEmpty();
        assertThat(EmailAddresses.parse("   ")).isEmpty();
    }
}
