package com.securebank.admin;

import com.securebank.guard.Role;
import com.securebank.users.CredentialStore;
import com.securebank.users.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Creates the initial administrator on startup.
 *
 * Runs only when {@code secure-bank.bootstrap.admin-password} is set, and does nothing when the
 * username is already taken.
 */
@Slf4j
@Component
@Order(1)
public class AdminBootstrapRunner implements ApplicationRunner {

    private final CredentialStore credentialStore;
    private final UserRepository userRepository;
    private final String username;
    private final String email;
    private final String password;

    public AdminBootstrapRunner(CredentialStore credentialStore,
                                UserRepository userRepository,
                                @Value("${secure-bank.bootstrap.admin-username:admin}") String username,
                                @Value("${secure-bank.bootstrap.admin-email:admin@securebank.local}") String email,
                                @Value("${secure-bank.bootstrap.admin-password:}") String password) {
        this.credentialStore = credentialStore;
        this.userRepository = userRepository;
        this.username = username;
        this.email = email;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (password.isBlank()) {
            log.info("No bootstrap administrator password configured, skipping administrator creation");
            return;
        }
        if (userRepository.existsByUsername(username)) {
            log.debug("Administrator '{}' already exists", username);
            return;
        }
        credentialStore.createUser(username, email, password, "System Administrator", null, Role.ADMIN);
        log.info("Bootstrap administrator '{}' created", username);
    }
}
