package com.claude.budgetoptimizer.client;

import com.claude.budgetoptimizer.domain.PerformanceAggregate;

import java.time.LocalDate;
import java.util.Map;

/**
 * 광고 플랫폼 리포트 API. 기간 [from, to] 의 광고별 집계를 adId 로 묶어 돌려준다.
 */
public interface ReportApiClient {

    Map<String, PerformanceAggregate> fetchAdAggregates(String accessToken, String advertiserId,
                                                        LocalDate from, LocalDate to);
}
