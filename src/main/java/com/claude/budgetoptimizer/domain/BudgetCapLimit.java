package com.claude.budgetoptimizer.domain;

import lombok.Value;

import java.math.BigDecimal;

/**
 * 예산 엔티티에 적용되는 유효 상한. 같은 풀의 캡 중 가장 작은 값이다.
 */
@Value
public class BudgetCapLimit {

    BigDecimal maxDailyBudget;
    // 가장 작은 캡을 가진 광고
    String limitingAdId;
}
