package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * 오늘 포함 최근 7일 집계.
 */
@Value
@Builder
public class SevenDayMetrics {

    String adId;
    LocalDate from;
    LocalDate to;
    BigDecimal spend;
    long impressions;
    int conversions;
    int frontSales;
    // 예약 장부를 보지 않았거나 조회에 실패하면 null
    Integer reservations;

    public BigDecimal getCpa() {
        return ratio(spend, conversions);
    }

    public BigDecimal getFrontCpo() {
        return ratio(spend, frontSales);
    }

    public BigDecimal getReservationCpo() {
        return reservations == null ? null : ratio(spend, reservations);
    }

    private static BigDecimal ratio(BigDecimal amount, int count) {
        if (count <= 0) {
            return null;
        }
        return amount.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }
}
