package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 한 광고주 run 에 필요한 목표치와 장부 위치. run 시작 시 한 번 만들어지고 변하지 않는다.
 */
@Value
@Builder
public class OptimizationTarget {

    String advertiserId;
    String accessToken;
    String appealName;
    FunnelCategory funnelCategory;
    BigDecimal targetCpa;
    BigDecimal allowableCpa;
    BigDecimal targetFrontCpo;
    BigDecimal allowableFrontCpo;
    // null 이면 개별 예약 CPO 판정을 하지 않는다
    BigDecimal allowableReservationCpo;
    String conversionLedger;
    String frontSalesLedger;

    public boolean checksReservations() {
        return allowableReservationCpo != null;
    }
}
