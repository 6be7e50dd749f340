package com.claude.budgetoptimizer.domain;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * 획득한 job lock. 해제는 lockKey 와 ownerToken 이 모두 일치할 때만 된다.
 */
@Value
public class LockHandle {

    String lockKey;
    String ownerToken;
    LocalDateTime acquiredAt;
    LocalDateTime expiresAt;
}
