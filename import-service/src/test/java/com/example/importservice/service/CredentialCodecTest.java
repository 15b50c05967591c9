package com.example.importservice.service;

import com.example.importservice.exception.EncryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialCodecTest {

    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

    private CredentialCodec codec;

    @BeforeEach
    void setUp() {
        codec = new CredentialCodec(KEY, new MockEnvironment());
    }

    @Test
    void encryptThenDecrypt_ReturnsOriginal() {
        String secret = "ATATT3xFfGF0-api-token";

        String encrypted = codec.encrypt(secret);

        assertThat(encrypted).contains(":").doesNotContain(secret);
        assertThat(codec.decrypt(encrypted)).isEqualTo(secret);
    }

    @Test
    void encrypt_SamePlaintextTwice_ProducesDifferentCiphertexts() {
        assertThat(codec.encrypt("cookie=1")).isNotEqualTo(codec.encrypt("cookie=1"));
    }

    @Test
    void decrypt_TamperedCiphertext_Throws() {
        String encrypted = codec.encrypt("refresh-token");
        String[] parts = encrypted.split(":");
        char last = parts[1].charAt(parts[1].length() - 3);
        String tampered = parts[0] + ":" + parts[1].substring(0, parts[1].length() - 3)
                + (last == 'A' ? 'B' : 'A') + parts[1].substring(parts[1].length() - 2);

        assertThatThrownBy(() -> codec.decrypt(tampered)).isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> codec.decrypt("not-encrypted")).isInstanceOf(EncryptionException.class);
    }

    @Test
    void decrypt_WithDifferentKey_Throws() {
        String encrypted = codec.encrypt("secret");
        CredentialCodec other = new CredentialCodec(CredentialCodec.generateKey(), new MockEnvironment());

        assertThatThrownBy(() -> other.decrypt(encrypted)).isInstanceOf(EncryptionException.class);
    }

    @Test
    void nullableVariants_PassNullThrough() {
        assertThat(codec.encryptNullable(null)).isNull();
        assertThat(codec.decryptNullable(null)).isNull();
        assertThat(codec.decryptNullable(codec.encryptNullable("x"))).isEqualTo("x");
    }

    @Test
    void missingKey_OutsideProd_UsesRandomKey() {
        CredentialCodec ephemeral = new CredentialCodec("", new MockEnvironment());

        assertThat(ephemeral.decrypt(ephemeral.encrypt("value"))).isEqualTo("value");
    }

    @Test
    void missingKey_InProd_RefusesToStart() {
        MockEnvironment prod = new MockEnvironment();
        prod.setActiveProfiles("prod");

        assertThatThrownBy(() -> new CredentialCodec(" ", prod))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("encryption.secret-key");
    }

    @Test
    void wrongKeyLength_RefusesToStart() {
        assertThatThrownBy(() -> new CredentialCodec("0011223344", new MockEnvironment()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void generateKey_Returns64HexCharacters() {
        assertThat(CredentialCodec.generateKey()).matches("[0-9a-f]{64}");
    }
}
