package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.RunStatus;

import java.time.LocalDateTime;
import java.util.List;

public interface AdvertiserDirectory {

    /**
     * @throws com.claude.budgetoptimizer.exception.AdvertiserConfigurationException 광고주, 소구, 토큰 중 하나라도 없을 때
     */
    OptimizationTarget loadTarget(String advertiserId);

    List<String> findTargetAdvertiserIds();

    void recordRunOutcome(String advertiserId, RunStatus status, LocalDateTime runAt);
}
