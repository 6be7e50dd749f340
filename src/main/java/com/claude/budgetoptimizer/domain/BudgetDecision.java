package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 증액 판정 결과. applier 를 거치면 적용 결과(applied / failed)가 채워진 사본이 만들어진다.
 */
@Value
@Builder(toBuilder = true)
public class BudgetDecision {

    String adId;
    String adName;
    BudgetEntityLevel budgetEntityLevel;
    String budgetEntityId;
    BudgetAction action;
    BigDecimal currentBudget;
    BigDecimal newBudget;
    String reason;
    BigDecimal todaySpend;
    Integer todayConversions;
    BigDecimal todayCpa;
    boolean applied;
    boolean failed;
    String failureReason;

    public static BudgetDecision skip(ManagedAd ad, String reason) {
        return BudgetDecision.builder()
                .adId(ad.getAdId())
                .adName(ad.getAdName())
                .budgetEntityLevel(ad.getBudgetEntityLevel())
                .budgetEntityId(ad.getBudgetEntityId())
                .action(BudgetAction.SKIP)
                .currentBudget(ad.getDailyBudget())
                .reason(reason)
                .build();
    }

    public BudgetDecision toContinue(String reason) {
        return toBuilder()
                .action(BudgetAction.CONTINUE)
                .newBudget(null)
                .reason(reason)
                .build();
    }

    public BudgetDecision markFailed(String failureReason) {
        return toBuilder().failed(true).failureReason(failureReason).build();
    }
}
