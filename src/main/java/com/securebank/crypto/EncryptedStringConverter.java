package com.securebank.crypto;

import com.securebank.common.exception.DecryptionException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JPA AttributeConverter for transparent field-level encryption.
 *
 * <pre>
 * {@code
 * @Convert(converter = EncryptedStringConverter.class)
 * private String description;
 * }
 * </pre>
 *
 * Only for fields that are never used for lookups or uniqueness checks.
 */
@Converter
@Component
@Slf4j
public class EncryptedStringConverter implements AttributeConverter<String, String> {

    @Autowired
    private EncryptionService encryptionService;

    @Override
    public String convertToDatabaseColumn(String attribute) {
        return encryptionService.encrypt(attribute);
    }

    @Override
    public String convertToEntityAttribute(String dbData) {
        try {
            return encryptionService.decrypt(dbData);
        } catch (DecryptionException e) {
            log.error("Failed to decrypt stored field; ciphertext may be corrupted or the key is wrong", e);
            throw e;
        }
    }
}
