package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetAction;
import com.claude.budgetoptimizer.domain.BudgetDecision;
import com.claude.budgetoptimizer.domain.DeliveryStatus;
import com.claude.budgetoptimizer.domain.FunnelCategory;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.PauseAction;
import com.claude.budgetoptimizer.domain.PauseDecision;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;
import com.claude.budgetoptimizer.exception.DataQualityException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BudgetDecisionEngineTest {

    private static final BigDecimal TARGET_CPA = new BigDecimal("5000");

    private final BudgetDecisionEngine engine = new BudgetDecisionEngine();

    @Test
    void lowTierIncreasesWithSingleConversionUnderTarget() {
        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(5000), today(3000, 1), TARGET_CPA);

        assertEquals(BudgetAction.INCREASE, decision.getAction());
        assertEquals(0, bd(6500).compareTo(decision.getNewBudget()));
        assertTrue(decision.getReason().contains("increase x1.3"));
    }

    @Test
    void cpaEqualToTargetStillIncreases() {
        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(5000), today(5000, 1), TARGET_CPA);

        assertEquals(BudgetAction.INCREASE, decision.getAction());
    }

    @Test
    void cpaAboveTargetContinues() {
        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(5000), today(5001, 1), TARGET_CPA);

        assertEquals(BudgetAction.CONTINUE, decision.getAction());
        assertNull(decision.getNewBudget());
        assertTrue(decision.getReason().contains("above target"));
    }

    @Test
    void zeroConversionsContinueWithoutCpa() {
        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(5000), today(3000, 0), TARGET_CPA);

        assertEquals(BudgetAction.CONTINUE, decision.getAction());
        assertNull(decision.getTodayCpa());
    }

    @Test
    void midTierNeedsTwoConversions() {
        assertEquals(BudgetAction.CONTINUE,
                engine.evaluateIncrease(ad(), bd(8000), today(3000, 1), TARGET_CPA).getAction());
        assertEquals(BudgetAction.INCREASE,
                engine.evaluateIncrease(ad(), bd(8000), today(6000, 2), TARGET_CPA).getAction());
        assertEquals(BudgetAction.INCREASE,
                engine.evaluateIncrease(ad(), bd(20000), today(6000, 2), TARGET_CPA).getAction());
    }

    @Test
    void highTierNeedsThreeConversions() {
        assertEquals(BudgetAction.CONTINUE,
                engine.evaluateIncrease(ad(), bd(20001), today(6000, 2), TARGET_CPA).getAction());

        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(40000), today(9000, 3), TARGET_CPA);
        assertEquals(BudgetAction.INCREASE, decision.getAction());
        assertEquals(0, bd(52000).compareTo(decision.getNewBudget()));
    }

    @Test
    void fractionalBudgetJustAboveMidTierTakesHighTier() {
        BigDecimal budget = new BigDecimal("20000.01");

        BudgetDecision twoConversions = engine.evaluateIncrease(ad(), budget, today(6000, 2), TARGET_CPA);
        assertEquals(BudgetAction.CONTINUE, twoConversions.getAction());
        assertTrue(twoConversions.getReason().contains("needs 3+ conversions"));

        assertEquals(BudgetAction.INCREASE,
                engine.evaluateIncrease(ad(), budget, today(9000, 3), TARGET_CPA).getAction());
    }

    @Test
    void budgetAboveHighestTierIsNeverIncreased() {
        BudgetDecision decision = engine.evaluateIncrease(ad(), bd(40001), today(1000, 10), TARGET_CPA);

        assertEquals(BudgetAction.CONTINUE, decision.getAction());
        assertTrue(decision.getReason().contains("no further increase"));
    }

    @Test
    void missingTargetCpaIsDataQualityError() {
        DataQualityException e = assertThrows(DataQualityException.class,
                () -> engine.evaluateIncrease(ad(), bd(5000), today(3000, 1), null));

        assertEquals(DataQualityException.TARGET_MISSING, e.getCode());
    }

    @Test
    void lowSpendAndImpressionsSkipAsNewCreative() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(null), seven(1000, 1000, 0, 0, null), bd(5000));

        assertEquals(PauseAction.SKIP_NEW_CREATIVE, decision.getAction());
    }

    @Test
    void enoughImpressionsAreJudgedEvenWithLowSpend() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(null), seven(1000, 5000, 0, 0, null), bd(5000));

        assertEquals(PauseAction.PAUSE, decision.getAction());
        assertEquals("zero conversions in trailing 7 days", decision.getReason());
    }

    @Test
    void spendEqualToAllowableCpaIsJudgedDespiteFewImpressions() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(null), seven(5000, 1000, 0, 0, null), bd(5000));

        assertEquals(PauseAction.PAUSE, decision.getAction());
    }

    @Test
    void leadOnlyAdWithoutConversionsPausesOnceSpendPassesAllowableCpa() {
        OptimizationTarget leadOnly = OptimizationTarget.builder()
                .advertiserId("adv-1")
                .appealName("セミナー")
                .funnelCategory(FunnelCategory.SEMINAR)
                .targetCpa(bd(2000))
                .allowableCpa(bd(2500))
                .build();

        PauseDecision decision = engine.evaluatePause(ad(), leadOnly, seven(3000, 1000, 0, 0, null), bd(5000));

        assertEquals(PauseAction.PAUSE, decision.getAction());
        assertEquals("zero conversions in trailing 7 days", decision.getReason());
    }

    @Test
    void leadFunnelComparesSevenDayCpa() {
        assertEquals(PauseAction.PAUSE,
                engine.evaluatePause(ad(), seminar(null), seven(30000, 9000, 5, 0, null), bd(5000)).getAction());
        assertEquals(PauseAction.CONTINUE,
                engine.evaluatePause(ad(), seminar(null), seven(25000, 9000, 5, 0, null), bd(5000)).getAction());
    }

    @Test
    void frontOfferFunnelUsesFrontCpoWhenSalesExist() {
        OptimizationTarget sns = sns();

        // front CPO 15,000 <= 20,000
        assertEquals(PauseAction.CONTINUE,
                engine.evaluatePause(ad(), sns, seven(30000, 9000, 1, 2, null), bd(5000)).getAction());
        // front CPO 30,000 > 20,000
        assertEquals(PauseAction.PAUSE,
                engine.evaluatePause(ad(), sns, seven(30000, 9000, 20, 1, null), bd(5000)).getAction());
    }

    @Test
    void frontOfferFunnelWithoutSalesFallsBackToCpa() {
        OptimizationTarget sns = sns();

        PauseDecision paused = engine.evaluatePause(ad(), sns, seven(10000, 9000, 0, 0, null), bd(5000));
        assertEquals(PauseAction.PAUSE, paused.getAction());
        assertEquals("zero conversions in trailing 7 days (no front-offer sales)", paused.getReason());

        PauseDecision kept = engine.evaluatePause(ad(), sns, seven(10000, 9000, 5, 0, null), bd(5000));
        assertEquals(PauseAction.CONTINUE, kept.getAction());
    }

    @Test
    void zeroReservationsPauseOnceSpendReachesAllowableCpo() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(bd(10000)),
                seven(20000, 9000, 5, 0, 0), bd(5000));

        assertEquals(PauseAction.PAUSE, decision.getAction());
        assertTrue(decision.getReason().startsWith("0 individual reservations"));
    }

    @Test
    void highReservationCpoReducesBudgetByTwentyPercent() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(bd(10000)),
                seven(20000, 9000, 5, 0, 1), bd(10000));

        assertEquals(PauseAction.REDUCE_BUDGET, decision.getAction());
        assertEquals(0, bd(8000).compareTo(decision.getReducedBudget()));
    }

    @Test
    void reducedBudgetNeverGoesBelowPlatformMinimum() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(bd(10000)),
                seven(20000, 9000, 5, 0, 1), bd(2100));

        assertEquals(0, bd(2000).compareTo(decision.getReducedBudget()));
    }

    @Test
    void unknownReservationCountKeepsCpaVerdict() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(bd(10000)),
                seven(20000, 9000, 5, 0, null), bd(10000));

        assertEquals(PauseAction.CONTINUE, decision.getAction());
    }

    @Test
    void pauseVerdictIsNotRevisitedByReservationRule() {
        PauseDecision decision = engine.evaluatePause(ad(), seminar(bd(100000)),
                seven(30000, 9000, 5, 0, 5), bd(10000));

        assertEquals(PauseAction.PAUSE, decision.getAction());
        assertTrue(decision.getReason().startsWith("7-day CPA"));
    }

    private static ManagedAd ad() {
        return ManagedAd.builder()
                .adId("ad-1")
                .adName("20240501/tanaka/video_a/lp1")
                .advertiserId("adv-1")
                .adgroupId("ag-1")
                .campaignId("cp-1")
                .deliveryStatus(DeliveryStatus.ENABLE)
                .dailyBudget(bd(5000))
                .build();
    }

    private static TodayMetrics today(long spend, int conversions) {
        return TodayMetrics.builder()
                .adId("ad-1")
                .spend(bd(spend))
                .conversions(conversions)
                .build();
    }

    private static SevenDayMetrics seven(long spend, long impressions, int conversions, int frontSales, Integer reservations) {
        return SevenDayMetrics.builder()
                .adId("ad-1")
                .spend(bd(spend))
                .impressions(impressions)
                .conversions(conversions)
                .frontSales(frontSales)
                .reservations(reservations)
                .build();
    }

    private static OptimizationTarget seminar(BigDecimal allowableReservationCpo) {
        return OptimizationTarget.builder()
                .advertiserId("adv-1")
                .appealName("セミナー")
                .funnelCategory(FunnelCategory.SEMINAR)
                .targetCpa(TARGET_CPA)
                .allowableCpa(bd(5000))
                .allowableReservationCpo(allowableReservationCpo)
                .build();
    }

    private static OptimizationTarget sns() {
        return OptimizationTarget.builder()
                .advertiserId("adv-1")
                .appealName("SNS")
                .funnelCategory(FunnelCategory.SNS)
                .targetCpa(TARGET_CPA)
                .allowableCpa(bd(5000))
                .targetFrontCpo(bd(15000))
                .allowableFrontCpo(bd(20000))
                .build();
    }

    private static BigDecimal bd(long value) {
        return BigDecimal.valueOf(value);
    }
}
