package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.CapResolution;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 증액안에 상한을 적용한다.
 *
 * 상한은 전역 ceiling(40,000)과 광고별 override 캡 중 작은 값이다.
 * 이벤트(CAP_APPLIED / CAP_REACHED)는 override 캡이 실제로 묶였을 때만 나온다.
 */
@Component
public class BudgetCapResolver {

    public static final BigDecimal GLOBAL_CEILING = BudgetDecisionEngine.HIGH_TIER_MAX;

    public CapResolution resolve(BigDecimal currentBudget, BigDecimal proposedBudget, Optional<BudgetCapLimit> cap) {
        boolean overrideBinds = cap.isPresent() && cap.get().getMaxDailyBudget().compareTo(GLOBAL_CEILING) < 0;
        BigDecimal limit = overrideBinds ? cap.get().getMaxDailyBudget() : GLOBAL_CEILING;

        if (currentBudget.compareTo(limit) >= 0) {
            return new CapResolution(overrideBinds ? CapResolution.Outcome.CAP_REACHED : CapResolution.Outcome.CEILING_REACHED,
                    currentBudget, limit);
        }
        if (proposedBudget.compareTo(limit) > 0) {
            return new CapResolution(overrideBinds ? CapResolution.Outcome.CAP_APPLIED : CapResolution.Outcome.CLAMPED_TO_CEILING,
                    limit, limit);
        }
        return new CapResolution(CapResolution.Outcome.UNCHANGED, proposedBudget, limit);
    }
}
