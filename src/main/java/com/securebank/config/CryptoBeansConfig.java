package com.securebank.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

import java.security.SecureRandom;

/**
 * Shared cryptographic primitives.
 */
@Configuration
@Slf4j
public class CryptoBeansConfig {

    private static final int SALT_LENGTH_BYTES = 16;

    /**
     * Salted PBKDF2-HMAC-SHA256 password hashing. No application-wide pepper is used.
     */
    @Bean
    public PasswordEncoder passwordEncoder(
            @Value("${secure-bank.password.pbkdf2-iterations:310000}") int iterations) {
        log.info("Password hashing: PBKDF2WithHmacSHA256, {} iterations", iterations);
        return new Pbkdf2PasswordEncoder("", SALT_LENGTH_BYTES, iterations,
            Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
