package com.claude.budgetoptimizer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 광고주별 job lock
 *
 * lock_key 유니크 제약으로 여러 인스턴스 사이의 상호 배제를 보장한다.
 * expires_at 이 지난 lease 는 버려진 것으로 보고 다른 실행이 가져갈 수 있다.
 */
@Entity
@Table(name = "job_leases",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_job_lease_key", columnNames = {"lock_key"})
       })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobLease {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lock_key", nullable = false)
    private String lockKey;

    @Column(name = "owner_token", nullable = false, length = 64)
    private String ownerToken;

    @Column(name = "acquired_at", nullable = false)
    private LocalDateTime acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public static JobLease acquire(String lockKey, String ownerToken, LocalDateTime now, LocalDateTime expiresAt) {
        JobLease lease = new JobLease();
        lease.lockKey = lockKey;
        lease.ownerToken = ownerToken;
        lease.acquiredAt = now;
        lease.expiresAt = expiresAt;
        return lease;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
