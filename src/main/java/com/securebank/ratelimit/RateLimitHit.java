package com.securebank.ratelimit;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One admitted request, stored by the JDBC rate-limit store.
 */
@Entity
@Table(name = "rate_limit_hits", indexes = {
    @Index(name = "idx_rate_limit_hits_key_time", columnList = "bucket_key, hit_at"),
    @Index(name = "idx_rate_limit_hits_time", columnList = "hit_at")
})
@Data
@NoArgsConstructor
public class RateLimitHit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long hitId;

    @Column(name = "bucket_key", nullable = false, length = 200)
    private String bucketKey;

    @Column(name = "hit_at", nullable = false)
    private Instant hitAt;

    public RateLimitHit(String bucketKey, Instant hitAt) {
        this.bucketKey = bucketKey;
        this.hitAt = hitAt;
    }
}
