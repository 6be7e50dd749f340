package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetAction;
import com.claude.budgetoptimizer.domain.BudgetDecision;
import com.claude.budgetoptimizer.domain.FunnelCategory;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.PauseAction;
import com.claude.budgetoptimizer.domain.PauseDecision;
import com.claude.budgetoptimizer.domain.PlatformBudgetLimits;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;
import com.claude.budgetoptimizer.exception.DataQualityException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 증액 / 정지 판정 규칙
 *
 * I/O 가 없는 순수 함수 모음. 같은 입력이면 항상 같은 판정을 낸다.
 *
 * 증액 tier (현재 일예산 기준):
 * - 8,000 미만: 오늘 CPA 가 목표 이하이면 증액
 * - 20,000 이하: 추가로 오늘 전환 2건 이상
 * - 40,000 이하: 추가로 오늘 전환 3건 이상
 * - 40,000 초과: 증액하지 않음
 */
@Component
public class BudgetDecisionEngine {

    public static final BigDecimal INCREASE_RATE = new BigDecimal("1.3");
    public static final BigDecimal DECREASE_RATE = new BigDecimal("0.8");
    public static final BigDecimal LOW_TIER_MAX = new BigDecimal("8000");
    public static final BigDecimal MID_TIER_MAX = new BigDecimal("20000");
    public static final BigDecimal HIGH_TIER_MAX = new BigDecimal("40000");
    public static final int MID_TIER_MIN_CONVERSIONS = 2;
    public static final int HIGH_TIER_MIN_CONVERSIONS = 3;
    public static final long MIN_IMPRESSIONS_FOR_PAUSE = 5000L;

    public BudgetDecision evaluateIncrease(ManagedAd ad, BigDecimal currentBudget, TodayMetrics today,
                                           BigDecimal targetCpa) {
        BudgetDecision.BudgetDecisionBuilder base = BudgetDecision.builder()
                .adId(ad.getAdId())
                .adName(ad.getAdName())
                .budgetEntityLevel(ad.getBudgetEntityLevel())
                .budgetEntityId(ad.getBudgetEntityId())
                .currentBudget(currentBudget)
                .todaySpend(today.getSpend())
                .todayConversions(today.getConversions())
                .todayCpa(today.getCpa());

        if (targetCpa == null) {
            throw new DataQualityException(DataQualityException.TARGET_MISSING, "target CPA is not configured");
        }
        BigDecimal cpa = today.getCpa();
        if (cpa == null) {
            return base.action(BudgetAction.CONTINUE)
                    .reason("no conversions today, CPA undefined: no change")
                    .build();
        }
        if (cpa.compareTo(targetCpa) > 0) {
            return base.action(BudgetAction.CONTINUE)
                    .reason(String.format("today CPA %s > target CPA %s: above target, no change", yen(cpa), yen(targetCpa)))
                    .build();
        }

        int conversions = today.getConversions();
        String tierRule;
        if (currentBudget.compareTo(LOW_TIER_MAX) < 0) {
            tierRule = "budget under " + yen(LOW_TIER_MAX);
        } else if (currentBudget.compareTo(MID_TIER_MAX) <= 0) {
            if (conversions < MID_TIER_MIN_CONVERSIONS) {
                return base.action(BudgetAction.CONTINUE)
                        .reason(String.format("budget %s needs %d+ conversions today, has %d: no change",
                                yen(currentBudget), MID_TIER_MIN_CONVERSIONS, conversions))
                        .build();
            }
            tierRule = "budget up to " + yen(MID_TIER_MAX) + " with " + conversions + " conversions";
        } else if (currentBudget.compareTo(HIGH_TIER_MAX) <= 0) {
            if (conversions < HIGH_TIER_MIN_CONVERSIONS) {
                return base.action(BudgetAction.CONTINUE)
                        .reason(String.format("budget %s needs %d+ conversions today, has %d: no change",
                                yen(currentBudget), HIGH_TIER_MIN_CONVERSIONS, conversions))
                        .build();
            }
            tierRule = "budget up to " + yen(HIGH_TIER_MAX) + " with " + conversions + " conversions";
        } else {
            return base.action(BudgetAction.CONTINUE)
                    .reason(String.format("budget %s is above %s: no further increase", yen(currentBudget), yen(HIGH_TIER_MAX)))
                    .build();
        }

        BigDecimal proposed = currentBudget.multiply(INCREASE_RATE);
        return base.action(BudgetAction.INCREASE)
                .newBudget(proposed)
                .reason(String.format("today CPA %s <= target CPA %s, %s: increase x%s",
                        yen(cpa), yen(targetCpa), tierRule, INCREASE_RATE))
                .build();
    }

    /**
     * 7일 성과 기반 정지 판정. 예약 CPO 판정은 CPA / front CPO 판정이 CONTINUE 일 때만 이어진다.
     */
    public PauseDecision evaluatePause(ManagedAd ad, OptimizationTarget target, SevenDayMetrics metrics,
                                       BigDecimal currentBudget) {
        BigDecimal allowableCpa = target.getAllowableCpa();
        if (allowableCpa == null) {
            throw new DataQualityException(DataQualityException.TARGET_MISSING, "allowable CPA is not configured");
        }
        FunnelCategory category = target.getFunnelCategory();
        PauseDecision.PauseDecisionBuilder base = PauseDecision.builder()
                .adId(ad.getAdId())
                .adName(ad.getAdName())
                .funnelCategory(category)
                .currentBudget(currentBudget)
                .sevenDaySpend(metrics.getSpend())
                .sevenDayImpressions(metrics.getImpressions())
                .sevenDayConversions(metrics.getConversions())
                .sevenDayFrontSales(metrics.getFrontSales())
                .sevenDayCpa(metrics.getCpa())
                .sevenDayFrontCpo(metrics.getFrontCpo())
                .sevenDayReservations(metrics.getReservations())
                .sevenDayReservationCpo(metrics.getReservationCpo());

        if (metrics.getSpend().compareTo(allowableCpa) < 0 && metrics.getImpressions() < MIN_IMPRESSIONS_FOR_PAUSE) {
            return base.action(PauseAction.SKIP_NEW_CREATIVE)
                    .reason(String.format("7-day spend %s < allowable CPA %s and impressions %d < %d: new creative, not judged yet",
                            yen(metrics.getSpend()), yen(allowableCpa), metrics.getImpressions(), MIN_IMPRESSIONS_FOR_PAUSE))
                    .build();
        }

        PauseDecision verdict = category.hasPaidFrontOffer()
                ? judgeFrontOfferFunnel(base, target, metrics)
                : judgeLeadFunnel(base, allowableCpa, metrics);

        if (verdict.getAction() == PauseAction.CONTINUE && target.checksReservations() && metrics.getReservations() != null) {
            return evaluateReservation(verdict, target.getAllowableReservationCpo(), metrics, currentBudget);
        }
        return verdict;
    }

    /**
     * 개별 예약 CPO 판정. 예약 0건이면 지출이 허용 CPO 이상일 때 정지,
     * 예약 CPO 가 허용치를 넘으면 일예산을 20% 줄인다.
     */
    public PauseDecision evaluateReservation(PauseDecision continueVerdict, BigDecimal allowableReservationCpo,
                                             SevenDayMetrics metrics, BigDecimal currentBudget) {
        int reservations = metrics.getReservations() == null ? 0 : metrics.getReservations();
        if (reservations == 0) {
            if (metrics.getSpend().compareTo(allowableReservationCpo) >= 0) {
                return continueVerdict.toBuilder()
                        .action(PauseAction.PAUSE)
                        .reason(String.format("0 individual reservations with 7-day spend %s >= allowable reservation CPO %s",
                                yen(metrics.getSpend()), yen(allowableReservationCpo)))
                        .build();
            }
            return continueVerdict;
        }

        BigDecimal reservationCpo = metrics.getReservationCpo();
        if (reservationCpo.compareTo(allowableReservationCpo) > 0) {
            BigDecimal reduced = currentBudget.multiply(DECREASE_RATE).setScale(0, RoundingMode.FLOOR)
                    .max(PlatformBudgetLimits.MIN_DAILY_BUDGET);
            return continueVerdict.toBuilder()
                    .action(PauseAction.REDUCE_BUDGET)
                    .reducedBudget(reduced)
                    .reason(String.format("reservation CPO %s > allowable %s: reduce budget %s -> %s",
                            yen(reservationCpo), yen(allowableReservationCpo), yen(currentBudget), yen(reduced)))
                    .build();
        }
        return continueVerdict;
    }

    private PauseDecision judgeFrontOfferFunnel(PauseDecision.PauseDecisionBuilder base, OptimizationTarget target,
                                                SevenDayMetrics metrics) {
        if (metrics.getFrontSales() >= 1) {
            BigDecimal allowableFrontCpo = target.getAllowableFrontCpo();
            if (allowableFrontCpo == null) {
                throw new DataQualityException(DataQualityException.TARGET_MISSING, "allowable front CPO is not configured");
            }
            BigDecimal frontCpo = metrics.getFrontCpo();
            if (frontCpo.compareTo(allowableFrontCpo) > 0) {
                return base.action(PauseAction.PAUSE)
                        .reason(String.format("7-day front CPO %s > allowable %s", yen(frontCpo), yen(allowableFrontCpo)))
                        .build();
            }
            return base.action(PauseAction.CONTINUE)
                    .reason(String.format("7-day front CPO %s <= allowable %s", yen(frontCpo), yen(allowableFrontCpo)))
                    .build();
        }
        if (metrics.getConversions() == 0) {
            return base.action(PauseAction.PAUSE)
                    .reason("zero conversions in trailing 7 days (no front-offer sales)")
                    .build();
        }
        return compareCpa(base, target.getAllowableCpa(), metrics, " (no front-offer sales)");
    }

    private PauseDecision judgeLeadFunnel(PauseDecision.PauseDecisionBuilder base, BigDecimal allowableCpa,
                                          SevenDayMetrics metrics) {
        if (metrics.getConversions() == 0) {
            return base.action(PauseAction.PAUSE)
                    .reason("zero conversions in trailing 7 days")
                    .build();
        }
        return compareCpa(base, allowableCpa, metrics, "");
    }

    private PauseDecision compareCpa(PauseDecision.PauseDecisionBuilder base, BigDecimal allowableCpa,
                                     SevenDayMetrics metrics, String note) {
        BigDecimal cpa = metrics.getCpa();
        if (cpa.compareTo(allowableCpa) > 0) {
            return base.action(PauseAction.PAUSE)
                    .reason(String.format("7-day CPA %s > allowable %s%s", yen(cpa), yen(allowableCpa), note))
                    .build();
        }
        return base.action(PauseAction.CONTINUE)
                .reason(String.format("7-day CPA %s <= allowable %s%s", yen(cpa), yen(allowableCpa), note))
                .build();
    }

    static String yen(BigDecimal amount) {
        return "¥" + amount.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
