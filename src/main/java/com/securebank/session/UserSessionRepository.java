package com.securebank.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for server-side sessions.
 */
@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    long countByUserId(String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM UserSession s WHERE s.userId = :userId")
    int deleteAllForUser(@Param("userId") String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM UserSession s WHERE s.userId = :userId AND s.sessionId <> :keepSessionId")
    int deleteAllForUserExcept(@Param("userId") String userId, @Param("keepSessionId") String keepSessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM UserSession s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
