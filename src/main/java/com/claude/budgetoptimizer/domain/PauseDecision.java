package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class PauseDecision {

    String adId;
    String adName;
    FunnelCategory funnelCategory;
    PauseAction action;
    String reason;
    BigDecimal sevenDaySpend;
    long sevenDayImpressions;
    int sevenDayConversions;
    int sevenDayFrontSales;
    BigDecimal sevenDayCpa;
    BigDecimal sevenDayFrontCpo;
    Integer sevenDayReservations;
    BigDecimal sevenDayReservationCpo;
    BigDecimal currentBudget;
    // REDUCE_BUDGET 일 때만 값이 있다
    BigDecimal reducedBudget;
    boolean applied;
    boolean failed;
    String failureReason;

    public static PauseDecision skip(ManagedAd ad, PauseAction action, String reason) {
        return PauseDecision.builder()
                .adId(ad.getAdId())
                .adName(ad.getAdName())
                .action(action)
                .currentBudget(ad.getDailyBudget())
                .reason(reason)
                .build();
    }

    public PauseDecision markFailed(String failureReason) {
        return toBuilder().failed(true).failureReason(failureReason).build();
    }
}
