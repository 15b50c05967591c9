package com.example.importservice.service;

import com.example.importservice.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encrypts stored credentials (OAuth tokens, API tokens, cookies) using AES-256-GCM.
 *
 * Format: {iv_base64}:{ciphertext_base64}, the GCM auth tag is appended to the ciphertext.
 *
 * Key: encryption.secret-key, 64 hex characters. Without a key the service refuses to
 * start under the prod profile; elsewhere it uses a random per-process key and stored
 * secrets become unreadable after restart.
 */
@Service
@Slf4j
public class CredentialCodec {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 128; // 128 bits
    private static final int KEY_LENGTH = 32;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialCodec(@Value("${encryption.secret-key:}") String secretKeyHex, Environment environment) {
        if (secretKeyHex == null || secretKeyHex.isBlank()) {
            if (environment.acceptsProfiles(Profiles.of("prod"))) {
                log.error("encryption.secret-key is not set in production! Stored credentials cannot be encrypted.");
                throw new IllegalStateException("encryption.secret-key is required in production");
            }
            log.warn("⚠️ encryption.secret-key not set, using a random key. Stored credentials will be lost on restart!");
            this.secretKey = new SecretKeySpec(hexStringToByteArray(generateKey()), "AES");
        } else {
            byte[] keyBytes = hexStringToByteArray(secretKeyHex);
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalStateException(
                        "Encryption key must be 32 bytes (256 bits), got " + keyBytes.length);
            }
            this.secretKey = new SecretKeySpec(keyBytes, "AES");
        }
        log.info("Credential codec initialized with AES-256-GCM");
    }

    /**
     * @return {iv}:{ciphertext}, with a fresh IV per call
     * @throws EncryptionException if encryption fails
     */
    public String encrypt(String plaintext) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(ciphertext);

        } catch (Exception e) {
            log.error("Encryption failed", e);
            throw new EncryptionException("Failed to encrypt credential", e);
        }
    }

    /**
     * @throws EncryptionException on malformed input, wrong key or tampered ciphertext
     */
    public String decrypt(String encrypted) {
        try {
            String[] parts = encrypted.split(":", 2);
            if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid encrypted format");
            }

            byte[] iv = Base64.getDecoder().decode(parts[0]);
            byte[] ciphertext = Base64.getDecoder().decode(parts[1]);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);

        } catch (Exception e) {
            log.error("Decryption failed: {}", e.getMessage());
            throw new EncryptionException("Failed to decrypt credential", e);
        }
    }

    /**
     * Null-tolerant variants for optional columns.
     */
    public String encryptNullable(String plaintext) {
        return plaintext == null ? null : encrypt(plaintext);
    }

    public String decryptNullable(String encrypted) {
        return encrypted == null ? null : decrypt(encrypted);
    }

    /**
     * Generate a random 256-bit key as 64 hex characters.
     */
    public static String generateKey() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(256);
            return byteArrayToHexString(keyGen.generateKey().getEncoded());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("AES not available", e);
        }
    }

    private static byte[] hexStringToByteArray(String hex) {
        hex = hex.replaceAll("[\\s-]", "");
        if (hex.length() % 2 != 0) {
            throw new IllegalStateException("Hex string must have even length");
        }

        byte[] data = new byte[hex.length() / 2];
        for (int i = 0; i < hex.length(); i += 2) {
            int high = Character.digit(hex.charAt(i), 16);
            int low = Character.digit(hex.charAt(i + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalStateException("Encryption key is not valid hex");
            }
            data[i / 2] = (byte) ((high << 4) + low);
        }
        return data;
    }

    private static String byteArrayToHexString(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
