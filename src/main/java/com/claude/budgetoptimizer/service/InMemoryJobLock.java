package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.LockHandle;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 인스턴스 배포용 lock. 프로세스가 재시작되면 보유 중인 lock 은 사라진다.
 */
@Slf4j
public class InMemoryJobLock implements JobLock {

    private final ConcurrentHashMap<String, LockHandle> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobLock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<LockHandle> tryAcquire(String lockKey, Duration timeout) {
        LocalDateTime now = LocalDateTime.now(clock);
        LockHandle candidate = new LockHandle(lockKey, UUID.randomUUID().toString(), now, now.plus(timeout));
        LockHandle holder = leases.compute(lockKey, (key, current) -> {
            if (current == null) {
                return candidate;
            }
            if (!current.getExpiresAt().isAfter(now)) {
                log.warn("만료된 lock 인수: {} (acquired {}, expired {})", key, current.getAcquiredAt(), current.getExpiresAt());
                return candidate;
            }
            return current;
        });
        return holder == candidate ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public void release(LockHandle handle) {
        boolean removed = leases.remove(handle.getLockKey(), handle);
        if (!removed) {
            log.warn("lock {} 은 이미 다른 실행이 가져갔거나 해제됨", handle.getLockKey());
        }
    }

    @Override
    public int purgeExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        int before = leases.size();
        leases.values().removeIf(h -> !h.getExpiresAt().isAfter(now));
        return before - leases.size();
    }
}
