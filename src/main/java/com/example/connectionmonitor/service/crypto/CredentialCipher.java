package com.example.connectionmonitor.service.crypto;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.exception.CredentialCipherException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Symmetric encryption of credentials at rest.
 * <p>
 * Format: Base64(IV || ciphertext+tag), AES-256/GCM with a fresh 12-byte IV per call,
 * so encrypting the same plaintext twice yields different blobs.
 * <p>
 * The key is the configured secret, space-padded or truncated to 32 characters,
 * taken as UTF-8 and cut to exactly 32 bytes. The key is immutable after
 * construction and a new {@link Cipher} is created per call, so the component is
 * safe for concurrent use.
 */
@Slf4j
@Component
public class CredentialCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH_BYTES = TAG_LENGTH_BITS / 8;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey secretKey;

    @Autowired
    public CredentialCipher(ConnectionMonitorProperties properties) {
        this(properties.getEncryptionSecret());
    }

    public CredentialCipher(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("connection-monitor.encryption-secret must be configured");
        }
        this.secretKey = deriveKey(secret);
    }

    static SecretKey deriveKey(String secret) {
        var padded = secret.length() >= KEY_LENGTH
                ? secret.substring(0, KEY_LENGTH)
                : secret + " ".repeat(KEY_LENGTH - secret.length());
        var keyBytes = Arrays.copyOf(padded.getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
        return new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Encrypt a plaintext credential.
     *
     * @return Base64 blob, or an empty string for null/empty input
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return "";
        }

        try {
            var iv = new byte[IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            var encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            var buffer = ByteBuffer.allocate(iv.length + encrypted.length);
            buffer.put(iv);
            buffer.put(encrypted);

            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new CredentialCipherException("Failed to encrypt credential", e);
        }
    }

    /**
     * Decrypt a blob produced by {@link #encrypt(String)}.
     *
     * @return the plaintext, or an empty string for null/empty input
     * @throws CredentialCipherException if the input is not a valid blob for this key
     */
    public String decrypt(String blob) {
        if (blob == null || blob.isEmpty()) {
            return "";
        }

        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException e) {
            throw new CredentialCipherException("Credential is not valid Base64", e);
        }

        if (raw.length < IV_LENGTH + TAG_LENGTH_BYTES) {
            throw new CredentialCipherException("Credential blob is too short");
        }

        try {
            var buffer = ByteBuffer.wrap(raw);
            var iv = new byte[IV_LENGTH];
            buffer.get(iv);
            var encrypted = new byte[buffer.remaining()];
            buffer.get(encrypted);

            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CredentialCipherException("Failed to decrypt credential", e);
        }
    }

    /**
     * Decrypt, or return the input unchanged when it is not a blob for this key.
     * Covers legacy rows stored before encryption was introduced.
     */
    public String decryptOrPlaintext(String value) {
        try {
            return decrypt(value);
        } catch (CredentialCipherException e) {
            log.debug("Stored credential is not encrypted, using it as plaintext: {}", e.getMessage());
            return value;
        }
    }
}
