package com.securebank.lockout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the login attempt log.
 */
@Repository
public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, Long> {

    List<LoginAttempt> findByUsernameAndAttemptedAtAfterOrderByAttemptedAtAscAttemptIdAsc(String username, Instant after);

    List<LoginAttempt> findTop10ByUsernameOrderByAttemptedAtDescAttemptIdDesc(String username);

    long countByOutcomeAndAttemptedAtAfter(LoginOutcome outcome, Instant after);
}
