package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.LockHandle;

import java.time.Duration;
import java.util.Optional;

/**
 * 광고주 단위 상호 배제. 만료 시간이 지난 lock 은 다음 획득 시도가 가져간다.
 */
public interface JobLock {

    /**
     * @return 획득하면 handle, 다른 실행이 보유 중이면 empty
     */
    Optional<LockHandle> tryAcquire(String lockKey, Duration timeout);

    void release(LockHandle handle);

    /**
     * 만료된 lock 을 정리하고 정리한 개수를 돌려준다.
     */
    int purgeExpired();
}
