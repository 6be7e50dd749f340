package com.claude.budgetoptimizer.domain;

import lombok.Value;

import java.math.BigDecimal;

/**
 * 리포트 API 에서 받은 광고 단위 집계값.
 */
@Value
public class PerformanceAggregate {

    public static final PerformanceAggregate ZERO = new PerformanceAggregate(BigDecimal.ZERO, 0L, 0L);

    BigDecimal spend;
    long impressions;
    long clicks;

    public PerformanceAggregate plus(PerformanceAggregate other) {
        return new PerformanceAggregate(spend.add(other.spend), impressions + other.impressions, clicks + other.clicks);
    }
}
