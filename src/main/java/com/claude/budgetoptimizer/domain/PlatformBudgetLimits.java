package com.claude.budgetoptimizer.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 광고 플랫폼이 받는 일예산 범위. 플랫폼으로 보내는 값은 모두 엔 단위 정수다.
 */
public final class PlatformBudgetLimits {

    public static final BigDecimal MIN_DAILY_BUDGET = new BigDecimal("2000");
    public static final BigDecimal MAX_DAILY_BUDGET = new BigDecimal("50000000");

    private PlatformBudgetLimits() {
    }

    public static BigDecimal normalize(BigDecimal budget) {
        BigDecimal rounded = budget.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(MIN_DAILY_BUDGET) < 0) {
            return MIN_DAILY_BUDGET;
        }
        if (rounded.compareTo(MAX_DAILY_BUDGET) > 0) {
            return MAX_DAILY_BUDGET;
        }
        return rounded;
    }
}
