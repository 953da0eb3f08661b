package com.securebank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Secure Bank core.
 *
 * The core is the security layer every request passes through: credential verification with
 * progressive lockout, rate limiting, CSRF defense, encrypted-at-rest sensitive fields and
 * atomic, auditable fund transfers between accounts.
 */
@SpringBootApplication
@EnableScheduling
public class SecureBankApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureBankApplication.class, args);
    }
}
