package com.securebank.ratelimit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for rate-limit hits.
 */
@Repository
public interface RateLimitHitRepository extends JpaRepository<RateLimitHit, Long> {

    long countByBucketKeyAndHitAtAfter(String bucketKey, Instant after);

    Optional<RateLimitHit> findFirstByBucketKeyAndHitAtAfterOrderByHitAtAsc(String bucketKey, Instant after);

    @Modifying
    @Query("DELETE FROM RateLimitHit h WHERE h.hitAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
