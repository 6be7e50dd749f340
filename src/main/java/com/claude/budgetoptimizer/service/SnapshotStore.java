package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.entity.HourlyOptimizationSnapshot;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 시간 단위 스냅샷 저장소. 스냅샷은 추가만 하고 수정하지 않는다.
 */
public interface SnapshotStore {

    /**
     * (advertiserId, adId, executionTime) 이 이미 있으면 그 행은 건너뛴다.
     */
    void append(List<HourlyOptimizationSnapshot> batch);

    /**
     * [from, before) 구간에서 광고별 가장 최근 스냅샷.
     */
    Map<String, HourlyOptimizationSnapshot> latestBefore(String advertiserId, LocalDateTime from, LocalDateTime before);

    boolean existsSince(String advertiserId, LocalDateTime since);

    /**
     * 최신순 최대 1,000건. date 가 있으면 그 날짜의 스냅샷만.
     */
    List<HourlyOptimizationSnapshot> findByAdvertiser(String advertiserId, LocalDate date);

    int pruneCreatedBefore(LocalDateTime cutoff);
}
