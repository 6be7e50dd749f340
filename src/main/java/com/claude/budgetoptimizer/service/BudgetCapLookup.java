package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.ManagedAd;

import java.time.LocalDate;
import java.util.Optional;

public interface BudgetCapLookup {

    /**
     * 광고의 예산 풀(광고그룹 또는 CBO 캠페인)에서 오늘 유효한 가장 작은 캡.
     */
    Optional<BudgetCapLimit> findEffectiveCap(ManagedAd ad, LocalDate date);
}
