package com.securebank.crypto;

import com.securebank.common.exception.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EncryptionService.
 */
class EncryptionServiceTest {

    private static final String KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    private static final String OTHER_KEY = "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=";

    private EncryptionService service;

    @BeforeEach
    void setUp() {
        service = withKey(KEY);
    }

    @Test
    void testRoundTripReturnsOriginal() {
        String description = "Rent for März - Zürich flat éè 🏠 #42";

        String ciphertext = service.encrypt(description);

        assertNotEquals(description, ciphertext);
        assertEquals(description, service.decrypt(ciphertext));
    }

    @Test
    void testSamePlaintextEncryptsDifferently() {
        String first = service.encrypt("payroll");
        String second = service.encrypt("payroll");

        assertNotEquals(first, second);
        assertEquals("payroll", service.decrypt(first));
        assertEquals("payroll", service.decrypt(second));
    }

    @Test
    void testNullAndEmptyPassThrough() {
        assertNull(service.encrypt(null));
        assertEquals("", service.encrypt(""));
        assertNull(service.decrypt(null));
        assertEquals("", service.decrypt(""));
    }

    @Test
    void testTamperedCiphertextFails() {
        byte[] raw = Base64.getDecoder().decode(service.encrypt("transfer to savings"));
        raw[raw.length - 5] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(raw);

        assertThrows(DecryptionException.class, () -> service.decrypt(tampered));
    }

    @Test
    void testWrongKeyFails() {
        String ciphertext = service.encrypt("secret memo");
        EncryptionService other = withKey(OTHER_KEY);

        assertThrows(DecryptionException.class, () -> other.decrypt(ciphertext));
    }

    @Test
    void testTruncatedAndMalformedCiphertextFails() {
        assertThrows(DecryptionException.class, () -> service.decrypt(Base64.getEncoder().encodeToString(new byte[10])));
        assertThrows(DecryptionException.class, () -> service.decrypt("not base64 !!"));
    }

    @Test
    void testPassphraseDerivedKeyIsStable() {
        EncryptionService first = new EncryptionService("", "correct horse battery", "bank-salt", new SecureRandom());
        first.loadKey();
        EncryptionService second = new EncryptionService("", "correct horse battery", "bank-salt", new SecureRandom());
        second.loadKey();

        assertEquals("memo", second.decrypt(first.encrypt("memo")));
    }

    @Test
    void testStartupFailsWithoutKeyMaterial() {
        EncryptionService unconfigured = new EncryptionService("", "", "", new SecureRandom());
        assertThrows(IllegalStateException.class, unconfigured::loadKey);

        EncryptionService shortKey = new EncryptionService(
            Base64.getEncoder().encodeToString(new byte[16]), "", "", new SecureRandom());
        assertThrows(IllegalStateException.class, shortKey::loadKey);

        EncryptionService noSalt = new EncryptionService("", "passphrase", "", new SecureRandom());
        assertThrows(IllegalStateException.class, noSalt::loadKey);
    }

    @Test
    void testUseBeforeKeyLoadedFails() {
        EncryptionService notLoaded = new EncryptionService(KEY, "", "", new SecureRandom());
        assertThrows(IllegalStateException.class, () -> notLoaded.encrypt("x"));
    }

    private static EncryptionService withKey(String key) {
        EncryptionService encryptionService = new EncryptionService(key, "", "", new SecureRandom());
        encryptionService.loadKey();
        return encryptionService;
    }
}
