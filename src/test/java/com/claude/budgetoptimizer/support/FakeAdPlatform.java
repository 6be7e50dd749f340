package com.claude.budgetoptimizer.support;

import com.claude.budgetoptimizer.client.AdInventoryClient;
import com.claude.budgetoptimizer.client.PlatformMutationClient;
import com.claude.budgetoptimizer.domain.BudgetEntityLevel;
import com.claude.budgetoptimizer.domain.DeliveryStatus;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.exception.PlatformMutationException;
import com.claude.budgetoptimizer.exception.TransientInfrastructureException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 광고 목록과 변경 호출을 메모리에 기록하는 광고 플랫폼.
 */
public class FakeAdPlatform implements AdInventoryClient, PlatformMutationClient {

    public final List<ManagedAd> ads = new ArrayList<>();
    public final List<BudgetUpdate> budgetUpdates = new ArrayList<>();
    public final List<String> pausedAdIds = new ArrayList<>();

    public boolean rejectMutations;
    public int transientMutationFailures;
    public RuntimeException inventoryFailure;
    public int inventoryCalls;

    public static ManagedAd ad(String adId, String adgroupId, long dailyBudget) {
        return ManagedAd.builder()
                .adId(adId)
                .adName("20240501/tanaka/video_" + adId + "/lp1")
                .advertiserId("adv-1")
                .adgroupId(adgroupId)
                .campaignId("cp-1")
                .deliveryStatus(DeliveryStatus.ENABLE)
                .dailyBudget(BigDecimal.valueOf(dailyBudget))
                .build();
    }

    @Override
    public List<ManagedAd> fetchAds(String accessToken, String advertiserId) {
        inventoryCalls++;
        if (inventoryFailure != null) {
            throw inventoryFailure;
        }
        return new ArrayList<>(ads);
    }

    @Override
    public void updateDailyBudget(String accessToken, String advertiserId, BudgetEntityLevel level, String entityId,
                                  BigDecimal dailyBudget) {
        checkMutation();
        budgetUpdates.add(new BudgetUpdate(level, entityId, dailyBudget));
    }

    @Override
    public void updateDeliveryStatus(String accessToken, String advertiserId, String adId, DeliveryStatus status) {
        checkMutation();
        if (status == DeliveryStatus.DISABLE) {
            pausedAdIds.add(adId);
        }
    }

    private void checkMutation() {
        if (transientMutationFailures > 0) {
            transientMutationFailures--;
            throw new TransientInfrastructureException("platform busy", 503, null);
        }
        if (rejectMutations) {
            throw new PlatformMutationException("budget update rejected: code 40002");
        }
    }

    public static class BudgetUpdate {
        public final BudgetEntityLevel level;
        public final String entityId;
        public final BigDecimal budget;

        BudgetUpdate(BudgetEntityLevel level, String entityId, BigDecimal budget) {
            this.level = level;
            this.entityId = entityId;
            this.budget = budget;
        }
    }
}
