package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Value
@Builder
public class TodayMetrics {

    String adId;
    String registrationPath;
    BigDecimal spend;
    long impressions;
    long clicks;
    // 전환 수는 리포트 API 가 아니라 전환 장부 기준
    int conversions;

    /**
     * 전환이 0 이면 CPA 는 정의되지 않는다.
     */
    public BigDecimal getCpa() {
        if (conversions <= 0) {
            return null;
        }
        return spend.divide(BigDecimal.valueOf(conversions), 2, RoundingMode.HALF_UP);
    }
}
