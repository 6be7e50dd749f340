package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.LockHandle;
import com.claude.budgetoptimizer.entity.JobLease;
import com.claude.budgetoptimizer.repository.JobLeaseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * job_leases 테이블 기반 lock
 *
 * 여러 인스턴스가 같은 DB 를 볼 때 사용한다. 획득은 INSERT (유니크 제약) 또는
 * 만료 lease 에 대한 조건부 UPDATE 로만 일어난다. 호출자의 트랜잭션에 참여하지 않도록
 * 각 레포지토리 호출이 자기 트랜잭션으로 바로 커밋된다.
 */
@Slf4j
public class DatabaseJobLock implements JobLock {

    private final JobLeaseRepository leaseRepository;
    private final Clock clock;

    public DatabaseJobLock(JobLeaseRepository leaseRepository, Clock clock) {
        this.leaseRepository = leaseRepository;
        this.clock = clock;
    }

    @Override
    public Optional<LockHandle> tryAcquire(String lockKey, Duration timeout) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plus(timeout);
        String ownerToken = UUID.randomUUID().toString();

        Optional<JobLease> existing = leaseRepository.findByLockKey(lockKey);
        if (existing.isPresent()) {
            JobLease lease = existing.get();
            if (!lease.isExpiredAt(now)) {
                log.debug("lock {} 보유 중 (expires {})", lockKey, lease.getExpiresAt());
                return Optional.empty();
            }
            int updated = leaseRepository.takeOverExpired(lockKey, ownerToken, now, expiresAt);
            if (updated != 1) {
                return Optional.empty();
            }
            log.warn("만료된 lock 인수: {} (acquired {}, expired {})", lockKey, lease.getAcquiredAt(), lease.getExpiresAt());
            return Optional.of(new LockHandle(lockKey, ownerToken, now, expiresAt));
        }

        try {
            leaseRepository.saveAndFlush(JobLease.acquire(lockKey, ownerToken, now, expiresAt));
            return Optional.of(new LockHandle(lockKey, ownerToken, now, expiresAt));
        } catch (DataIntegrityViolationException e) {
            // 동시에 INSERT 한 다른 실행이 먼저 커밋함
            log.debug("lock {} 동시 획득 경쟁에서 밀림", lockKey);
            return Optional.empty();
        }
    }

    @Override
    public void release(LockHandle handle) {
        int deleted = leaseRepository.release(handle.getLockKey(), handle.getOwnerToken());
        if (deleted == 0) {
            log.warn("lock {} 은 이미 다른 실행이 가져갔거나 해제됨", handle.getLockKey());
        }
    }

    @Override
    public int purgeExpired() {
        return leaseRepository.deleteExpired(LocalDateTime.now(clock));
    }
}
