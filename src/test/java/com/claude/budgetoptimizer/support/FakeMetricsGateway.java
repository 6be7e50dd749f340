package com.claude.budgetoptimizer.support;

import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;
import com.claude.budgetoptimizer.service.MetricsGateway;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * 광고별 지표를 미리 넣어두는 게이트웨이. 넣지 않은 광고는 지출 0, 전환 0 이다.
 */
public class FakeMetricsGateway implements MetricsGateway {

    private final Map<String, TodayMetrics> today = new HashMap<>();
    private final Map<String, SevenDayMetrics> sevenDay = new HashMap<>();
    public final Map<String, RuntimeException> failures = new HashMap<>();
    public int sevenDayCalls;
    public int invalidations;

    public FakeMetricsGateway today(String adId, long spend, int conversions) {
        today.put(adId, TodayMetrics.builder()
                .adId(adId)
                .spend(BigDecimal.valueOf(spend))
                .conversions(conversions)
                .build());
        return this;
    }

    public FakeMetricsGateway sevenDay(String adId, long spend, long impressions, int conversions) {
        sevenDay.put(adId, SevenDayMetrics.builder()
                .adId(adId)
                .spend(BigDecimal.valueOf(spend))
                .impressions(impressions)
                .conversions(conversions)
                .build());
        return this;
    }

    @Override
    public TodayMetrics fetchToday(OptimizationTarget target, ManagedAd ad, LocalDate date) {
        RuntimeException failure = failures.get(ad.getAdId());
        if (failure != null) {
            throw failure;
        }
        return today.getOrDefault(ad.getAdId(), TodayMetrics.builder()
                .adId(ad.getAdId())
                .spend(BigDecimal.ZERO)
                .build());
    }

    @Override
    public SevenDayMetrics fetchSevenDay(OptimizationTarget target, ManagedAd ad, LocalDate date) {
        sevenDayCalls++;
        return sevenDay.getOrDefault(ad.getAdId(), SevenDayMetrics.builder()
                .adId(ad.getAdId())
                .spend(BigDecimal.ZERO)
                .build());
    }

    @Override
    public void invalidate() {
        invalidations++;
    }
}
