package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.client.LedgerClient;
import com.claude.budgetoptimizer.client.ReportApiClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.AdName;
import com.claude.budgetoptimizer.domain.ColumnSchema;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.PerformanceAggregate;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;
import com.claude.budgetoptimizer.exception.BudgetOptimizationException;
import com.claude.budgetoptimizer.util.TimedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * 지표 게이트웨이
 *
 * 지출 / 노출 / 클릭은 리포트 API, 전환 / 프론트 판매 / 개별 예약은 장부 기준이다.
 * 리포트는 광고주와 기간 단위로 한 번 받아 캐시에 두고 광고별로 꺼내 쓴다.
 */
@Service
@Slf4j
public class PlatformMetricsGateway implements MetricsGateway {

    static final int TRAILING_DAYS = 7;

    private final ReportApiClient reportApiClient;
    private final LedgerClient ledgerClient;
    private final RetryTemplate retryTemplate;
    private final BudgetOptimizationProperties.Ledger ledgerProperties;
    private final TimedCache<String, Map<String, PerformanceAggregate>> reportCache;

    public PlatformMetricsGateway(ReportApiClient reportApiClient,
                                  LedgerClient ledgerClient,
                                  RetryTemplate optimizationRetryTemplate,
                                  BudgetOptimizationProperties properties,
                                  Clock clock) {
        this.reportApiClient = reportApiClient;
        this.ledgerClient = ledgerClient;
        this.retryTemplate = optimizationRetryTemplate;
        this.ledgerProperties = properties.getLedger();
        this.reportCache = new TimedCache<>(properties.getCache().getTtl(), clock);
    }

    @Override
    public TodayMetrics fetchToday(OptimizationTarget target, ManagedAd ad, LocalDate today) {
        AdName name = ad.parseName();
        String path = name.registrationPath(ledgerProperties.getPathPrefix(), target.getAppealName());

        PerformanceAggregate performance = aggregateFor(target, ad, today, today);
        int conversions = ledgerClient.countMatchingRows(target.getConversionLedger(),
                ledgerProperties.getConversionSheet(), path, today, today);

        return TodayMetrics.builder()
                .adId(ad.getAdId())
                .registrationPath(path)
                .spend(performance.getSpend())
                .impressions(performance.getImpressions())
                .clicks(performance.getClicks())
                .conversions(conversions)
                .build();
    }

    @Override
    public SevenDayMetrics fetchSevenDay(OptimizationTarget target, ManagedAd ad, LocalDate today) {
        AdName name = ad.parseName();
        LocalDate from = today.minusDays(TRAILING_DAYS - 1);
        String path = name.registrationPath(ledgerProperties.getPathPrefix(), target.getAppealName());

        PerformanceAggregate performance = aggregateFor(target, ad, from, today);
        int conversions = ledgerClient.countMatchingRows(target.getConversionLedger(),
                ledgerProperties.getConversionSheet(), path, from, today);

        int frontSales = 0;
        if (target.getFunnelCategory().hasPaidFrontOffer()) {
            for (String sheet : ledgerProperties.getFrontSalesSheets()) {
                frontSales += ledgerClient.countMatchingRows(target.getFrontSalesLedger(), sheet, path, from, today);
            }
        }

        Integer reservations = null;
        if (target.checksReservations()) {
            reservations = countReservations(target, ad, name, from, today);
        }

        return SevenDayMetrics.builder()
                .adId(ad.getAdId())
                .from(from)
                .to(today)
                .spend(performance.getSpend())
                .impressions(performance.getImpressions())
                .conversions(conversions)
                .frontSales(frontSales)
                .reservations(reservations)
                .build();
    }

    @Override
    public void invalidate() {
        reportCache.invalidateAll();
        ledgerClient.invalidate();
    }

    /**
     * 예약 장부 조회 실패는 판정을 막지 않는다. null 을 돌려주면 예약 CPO 판정을 건너뛴다.
     */
    private Integer countReservations(OptimizationTarget target, ManagedAd ad, AdName name,
                                      LocalDate from, LocalDate to) {
        BudgetOptimizationProperties.Reservation reservation = ledgerProperties.getReservation();
        BudgetOptimizationProperties.ReservationSheet sheet = reservation.getSheets().get(target.getFunnelCategory());
        if (sheet == null || reservation.getSpreadsheetId() == null) {
            log.warn("[{}] {} 퍼널의 개별 예약 시트 설정이 없음", target.getAdvertiserId(), target.getFunnelCategory());
            return null;
        }
        String path = name.reservationPath(ledgerProperties.getPathPrefix(), target.getAppealName());
        try {
            return ledgerClient.countMatchingRows(reservation.getSpreadsheetId(), sheet.getSheetName(), path, from, to,
                    ColumnSchema.fixed(sheet.getPathColumn(), sheet.getDateColumn()));
        } catch (BudgetOptimizationException e) {
            log.warn("[{}] ad {} 개별 예약 조회 실패, 예약 CPO 판정 생략: {}",
                    target.getAdvertiserId(), ad.getAdId(), e.toReason());
            return null;
        }
    }

    private PerformanceAggregate aggregateFor(OptimizationTarget target, ManagedAd ad, LocalDate from, LocalDate to) {
        String key = target.getAdvertiserId() + ":" + from + ":" + to;
        Map<String, PerformanceAggregate> byAd = reportCache.get(key, k -> retryTemplate.execute(context ->
                reportApiClient.fetchAdAggregates(target.getAccessToken(), target.getAdvertiserId(), from, to)));
        return byAd.getOrDefault(ad.getAdId(), PerformanceAggregate.ZERO);
    }
}
