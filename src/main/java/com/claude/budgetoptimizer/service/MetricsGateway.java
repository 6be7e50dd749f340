package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;

import java.time.LocalDate;

/**
 * 판정에 필요한 지표 조회. 광고 플랫폼 리포트와 스프레드시트 장부를 합친다.
 */
public interface MetricsGateway {

    TodayMetrics fetchToday(OptimizationTarget target, ManagedAd ad, LocalDate today);

    /**
     * 오늘 포함 7일 (today - 6 ~ today).
     */
    SevenDayMetrics fetchSevenDay(OptimizationTarget target, ManagedAd ad, LocalDate today);

    void invalidate();
}
