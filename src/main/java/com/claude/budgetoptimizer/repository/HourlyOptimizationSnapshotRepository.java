package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.HourlyOptimizationSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 시간 단위 스냅샷 레포지토리
 */
@Repository
public interface HourlyOptimizationSnapshotRepository extends JpaRepository<HourlyOptimizationSnapshot, Long> {

    Optional<HourlyOptimizationSnapshot> findByAdvertiserIdAndAdIdAndExecutionTime(
        String advertiserId, String adId, LocalDateTime executionTime);

    /**
     * [from, before) 구간의 스냅샷을 최신순으로 조회. 광고별 최신 1건은 서비스에서 고른다.
     */
    @Query("SELECT s FROM HourlyOptimizationSnapshot s " +
           "WHERE s.advertiserId = :advertiserId " +
           "AND s.executionTime >= :from " +
           "AND s.executionTime < :before " +
           "ORDER BY s.executionTime DESC, s.id DESC")
    List<HourlyOptimizationSnapshot> findInWindowNewestFirst(
        @Param("advertiserId") String advertiserId,
        @Param("from") LocalDateTime from,
        @Param("before") LocalDateTime before);

    boolean existsByAdvertiserIdAndExecutionTimeGreaterThanEqual(String advertiserId, LocalDateTime since);

    @Query("SELECT s FROM HourlyOptimizationSnapshot s " +
           "WHERE s.advertiserId = :advertiserId " +
           "ORDER BY s.executionTime DESC, s.id DESC")
    List<HourlyOptimizationSnapshot> findRecent(@Param("advertiserId") String advertiserId, Pageable pageable);

    @Query("SELECT s FROM HourlyOptimizationSnapshot s " +
           "WHERE s.advertiserId = :advertiserId " +
           "AND s.executionTime >= :from " +
           "AND s.executionTime < :to " +
           "ORDER BY s.executionTime DESC, s.id DESC")
    List<HourlyOptimizationSnapshot> findRecentBetween(
        @Param("advertiserId") String advertiserId,
        @Param("from") LocalDateTime from,
        @Param("to") LocalDateTime to,
        Pageable pageable);

    @Transactional
    @Modifying
    @Query("DELETE FROM HourlyOptimizationSnapshot s WHERE s.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
