package com.securebank.crypto;

import com.securebank.common.exception.DecryptionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Field-level encryption for sensitive values (transaction descriptions, counterparty
 * account numbers) using AES-256-GCM.
 *
 * <p>The key is loaded once before the application serves requests and held for the life of the
 * process. There is no runtime rotation path: rotating the key means re-encrypting stored
 * ciphertext as an offline maintenance procedure.</p>
 *
 * <p>Ciphertext format: base64( IV(12 bytes) || ciphertext || tag(16 bytes) ).</p>
 */
@Service
@Slf4j
public class EncryptionService {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final int PASSPHRASE_ITERATIONS = 100_000;

    private final String configuredKey;
    private final String passphrase;
    private final String salt;
    private final SecureRandom secureRandom;

    private volatile SecretKey secretKey;

    public EncryptionService(
            @Value("${secure-bank.encryption.key:}") String configuredKey,
            @Value("${secure-bank.encryption.passphrase:}") String passphrase,
            @Value("${secure-bank.encryption.salt:}") String salt,
            SecureRandom secureRandom) {
        this.configuredKey = configuredKey;
        this.passphrase = passphrase;
        this.salt = salt;
        this.secureRandom = secureRandom;
    }

    @PostConstruct
    void loadKey() {
        if (!configuredKey.isBlank()) {
            byte[] raw;
            try {
                raw = Base64.getDecoder().decode(configuredKey.trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("secure-bank.encryption.key is not valid base64", e);
            }
            if (raw.length != KEY_LENGTH_BYTES) {
                throw new IllegalStateException(
                    "secure-bank.encryption.key must decode to " + KEY_LENGTH_BYTES + " bytes");
            }
            secretKey = new SecretKeySpec(raw, ALGORITHM);
            log.info("Encryption key loaded from configured key material");
            return;
        }
        if (!passphrase.isBlank()) {
            if (salt.isBlank()) {
                throw new IllegalStateException("secure-bank.encryption.salt is required with a passphrase");
            }
            secretKey = deriveKey(passphrase, salt);
            log.info("Encryption key derived from configured passphrase");
            return;
        }
        throw new IllegalStateException(
            "No encryption key configured: set secure-bank.encryption.key or secure-bank.encryption.passphrase");
    }

    /**
     * Encrypt a plaintext value. Null and empty values are returned unchanged.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return plaintext;
        }
        SecretKey key = requireKey();
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(ciphertext, 0, combined, iv.length, ciphertext.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * Decrypt a value produced by {@link #encrypt(String)}. Null and empty values are returned unchanged.
     *
     * @throws DecryptionException if the value is malformed, was tampered with or was
     *                             encrypted under a different key
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            return ciphertext;
        }
        SecretKey key = requireKey();

        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid base64", e);
        }
        if (combined.length < IV_LENGTH + GCM_TAG_LENGTH_BITS / 8) {
            throw new DecryptionException("Ciphertext is truncated", null);
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, combined, 0, IV_LENGTH));
            byte[] plaintext = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    private SecretKey requireKey() {
        SecretKey key = secretKey;
        if (key == null) {
            throw new IllegalStateException("Encryption service used before the key was loaded");
        }
        return key;
    }

    private static SecretKey deriveKey(String passphrase, String salt) {
        try {
            PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8), PASSPHRASE_ITERATIONS, KEY_LENGTH_BYTES * 8);
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] raw = factory.generateSecret(spec).getEncoded();
            spec.clearPassword();
            return new SecretKeySpec(raw, ALGORITHM);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive encryption key", e);
        }
    }
}
