package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.entity.HourlyOptimizationSnapshot;
import com.claude.budgetoptimizer.repository.HourlyOptimizationSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스냅샷 저장소 JPA 구현
 *
 * 한 run 의 스냅샷은 saveAll 한 번으로 넣는다. 재시도된 run 이 같은 실행 시각으로
 * 다시 쓰면 유니크 제약에 걸리므로 행 단위 insert-if-absent 로 다시 넣는다.
 */
@Service
@Slf4j
public class SnapshotService implements SnapshotStore {

    static final int QUERY_LIMIT = 1000;

    private final HourlyOptimizationSnapshotRepository snapshotRepository;
    private final RetryTemplate retryTemplate;

    public SnapshotService(HourlyOptimizationSnapshotRepository snapshotRepository,
                           RetryTemplate optimizationRetryTemplate) {
        this.snapshotRepository = snapshotRepository;
        this.retryTemplate = optimizationRetryTemplate;
    }

    @Override
    public void append(List<HourlyOptimizationSnapshot> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            retryTemplate.execute(context -> snapshotRepository.saveAll(batch));
            log.debug("snapshot {}건 저장", batch.size());
        } catch (DataIntegrityViolationException e) {
            log.warn("snapshot 중복 키 감지, 행 단위로 재저장: {}", e.getMostSpecificCause().getMessage());
            int inserted = appendIfAbsent(batch);
            log.info("snapshot {}건 중 {}건 신규 저장", batch.size(), inserted);
        }
    }

    private int appendIfAbsent(List<HourlyOptimizationSnapshot> batch) {
        int inserted = 0;
        for (HourlyOptimizationSnapshot snapshot : batch) {
            boolean exists = snapshotRepository.findByAdvertiserIdAndAdIdAndExecutionTime(
                    snapshot.getAdvertiserId(), snapshot.getAdId(), snapshot.getExecutionTime()).isPresent();
            if (exists) {
                continue;
            }
            try {
                snapshotRepository.save(copyWithoutId(snapshot));
                inserted++;
            } catch (DataIntegrityViolationException e) {
                // 조회와 저장 사이에 다른 실행이 같은 키를 넣음. 이미 있는 행이 정답이다.
                log.debug("snapshot {} 은 이미 저장됨", snapshot.naturalKey());
            }
        }
        return inserted;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, HourlyOptimizationSnapshot> latestBefore(String advertiserId, LocalDateTime from, LocalDateTime before) {
        Map<String, HourlyOptimizationSnapshot> latest = new LinkedHashMap<>();
        for (HourlyOptimizationSnapshot snapshot : snapshotRepository.findInWindowNewestFirst(advertiserId, from, before)) {
            latest.putIfAbsent(snapshot.getAdId(), snapshot);
        }
        return latest;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsSince(String advertiserId, LocalDateTime since) {
        return snapshotRepository.existsByAdvertiserIdAndExecutionTimeGreaterThanEqual(advertiserId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HourlyOptimizationSnapshot> findByAdvertiser(String advertiserId, LocalDate date) {
        PageRequest limit = PageRequest.of(0, QUERY_LIMIT);
        if (date == null) {
            return snapshotRepository.findRecent(advertiserId, limit);
        }
        return snapshotRepository.findRecentBetween(advertiserId, date.atStartOfDay(),
                date.plusDays(1).atStartOfDay(), limit);
    }

    @Override
    @Transactional
    public int pruneCreatedBefore(LocalDateTime cutoff) {
        int deleted = snapshotRepository.deleteCreatedBefore(cutoff);
        log.info("보존 기간 지난 snapshot {}건 삭제 (created before {})", deleted, cutoff);
        return deleted;
    }

    // saveAll 이 롤백되면서 id 가 채워진 채로 남을 수 있다
    private static HourlyOptimizationSnapshot copyWithoutId(HourlyOptimizationSnapshot s) {
        return HourlyOptimizationSnapshot.builder()
                .advertiserId(s.getAdvertiserId())
                .adId(s.getAdId())
                .adName(s.getAdName())
                .executionTime(s.getExecutionTime())
                .todayConversionCount(s.getTodayConversionCount())
                .todaySpend(s.getTodaySpend())
                .todayCpa(s.getTodayCpa())
                .dailyBudget(s.getDailyBudget())
                .action(s.getAction())
                .reason(s.getReason())
                .newBudget(s.getNewBudget())
                .createdAt(s.getCreatedAt())
                .build();
    }
}
