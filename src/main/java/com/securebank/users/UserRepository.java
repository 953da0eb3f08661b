package com.securebank.users;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for user persistence.
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByUsername(String username);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Lock the user row for the duration of the current transaction.
     * Serializes lockout decisions for one account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.username = :username")
    Optional<User> findByUsernameForUpdate(@Param("username") String username);

    long countByActiveTrue();

    long countByLockedUntilAfter(Instant now);

    @Query("SELECT u FROM User u WHERE lower(u.username) LIKE lower(concat('%', :term, '%')) "
        + "OR lower(u.email) LIKE lower(concat('%', :term, '%')) "
        + "OR lower(u.fullName) LIKE lower(concat('%', :term, '%'))")
    Page<User> search(@Param("term") String term, Pageable pageable);
}
