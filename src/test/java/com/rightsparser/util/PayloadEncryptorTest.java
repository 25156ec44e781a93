package com.rightsparser.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PayloadEncryptor.
 */
class PayloadEncryptorTest {

    private static final String PAYLOAD = "{\"territory\":\"India\"}";

    @Test
    void encrypt_ProducesNonceCiphertextAndFreshKey() throws Exception {
        PayloadEncryptor.Encrypted first = PayloadEncryptor.encrypt(PAYLOAD);
        PayloadEncryptor.Encrypted second = PayloadEncryptor.encrypt(PAYLOAD);

        assertThat(Base64.getDecoder().decode(first.getKey())).hasSize(32);
        // 12-byte nonce + plaintext + 16-byte tag
        assertThat(first.getData()).hasSize(12 + PAYLOAD.getBytes(StandardCharsets.UTF_8).length + 16);
        assertThat(new String(first.getData(), StandardCharsets.UTF_8)).doesNotContain("India");
        assertThat(first.getKey()).isNotEqualTo(second.getKey());
    }

    @Test
    void decrypt_WithMatchingKey_RestoresPayload() throws Exception {
        PayloadEncryptor.Encrypted encrypted = PayloadEncryptor.encrypt(PAYLOAD);

        assertThat(PayloadEncryptor.decrypt(encrypted.getData(), encrypted.getKey())).isEqualTo(PAYLOAD);
    }

    @Test
    void decrypt_WithWrongKey_Fails() throws Exception {
        PayloadEncryptor.Encrypted encrypted = PayloadEncryptor.encrypt(PAYLOAD);
        String otherKey = PayloadEncryptor.encrypt(PAYLOAD).getKey();

        assertThatThrownBy(() -> PayloadEncryptor.decrypt(encrypted.getData(), otherKey))
                .isInstanceOf(GeneralSecurityException.class);
    }

    @Test
    void decrypt_WithShortKey_Fails() throws Exception {
        PayloadEncryptor.Encrypted encrypted = PayloadEncryptor.encrypt(PAYLOAD);
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> PayloadEncryptor.decrypt(encrypted.getData(), shortKey))
                .isInstanceOf(GeneralSecurityException.class)
                .hasMessageContaining("Invalid key length");
    }
}
