package com.example.autolist.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureUtilTest {

    private static final String SALT = "$2a$10$7EqJtq98hPqEX7fNZaFWoO";

    @Test
    void signatureVerifiesForSameClientAndTimestamp() {
        String signature = SignatureUtil.generateSignature("client-1", 1_700_000_000_000L, SALT);

        assertThat(SignatureUtil.verifySignature("client-1", 1_700_000_000_000L, signature)).isTrue();
        assertThat(SignatureUtil.verifySignature("client-1", 1_700_000_000_001L, signature)).isFalse();
    }

    @Test
    void missingCredentialsAreRejected() {
        assertThatThrownBy(() -> SignatureUtil.generateSignature("", 1L, SALT))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SignatureUtil.generateSignature("client-1", 1L, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
