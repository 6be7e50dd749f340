package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 광고 플랫폼에서 조회한 운영 중 광고 한 건과 예산이 걸린 상위 엔티티 정보.
 */
@Value
@Builder
public class ManagedAd {

    String adId;
    String adName;
    String advertiserId;
    String adgroupId;
    String campaignId;
    DeliveryStatus deliveryStatus;
    // 캠페인 예산 최적화(CBO) 여부
    boolean pooledBudget;
    BigDecimal dailyBudget;

    public boolean isActive() {
        return deliveryStatus == DeliveryStatus.ENABLE;
    }

    public BudgetEntityLevel getBudgetEntityLevel() {
        return pooledBudget ? BudgetEntityLevel.CAMPAIGN : BudgetEntityLevel.ADGROUP;
    }

    public String getBudgetEntityId() {
        return pooledBudget ? campaignId : adgroupId;
    }

    public String getBudgetEntityKey() {
        return getBudgetEntityLevel() + ":" + getBudgetEntityId();
    }

    public AdName parseName() {
        return AdName.parse(adName);
    }
}
