package com.claude.budgetoptimizer.client;

import com.claude.budgetoptimizer.domain.BudgetEntityLevel;
import com.claude.budgetoptimizer.domain.DeliveryStatus;

import java.math.BigDecimal;

/**
 * 광고 플랫폼 변경 API. 두 호출 모두 "값을 X 로 설정" 형태라서 같은 값으로 다시 보내도 결과가 같다.
 */
public interface PlatformMutationClient {

    void updateDailyBudget(String accessToken, String advertiserId,
                           BudgetEntityLevel level, String entityId, BigDecimal dailyBudget);

    void updateDeliveryStatus(String accessToken, String advertiserId, String adId, DeliveryStatus status);
}
