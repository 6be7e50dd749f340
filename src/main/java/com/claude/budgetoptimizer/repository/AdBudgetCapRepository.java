package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.AdBudgetCap;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AdBudgetCapRepository extends JpaRepository<AdBudgetCap, Long> {

    Optional<AdBudgetCap> findByAdId(String adId);

    List<AdBudgetCap> findByAdvertiserIdOrderByAdIdAsc(String advertiserId);

    /**
     * 광고그룹 예산 풀에서 오늘 유효한 캡 (작은 값부터). 광고 ID 로만 등록된 캡도 포함한다.
     */
    @Query("SELECT c FROM AdBudgetCap c WHERE (c.adId = :adId OR c.adgroupId = :adgroupId) " +
           "AND c.enabled = true " +
           "AND (c.startDate IS NULL OR c.startDate <= :today) " +
           "AND (c.endDate IS NULL OR c.endDate >= :today) " +
           "ORDER BY c.maxDailyBudget ASC, c.adId ASC")
    List<AdBudgetCap> findActiveByAdgroup(@Param("adId") String adId,
                                          @Param("adgroupId") String adgroupId,
                                          @Param("today") LocalDate today);

    /**
     * CBO 캠페인 예산 풀에서 오늘 유효한 캡 (작은 값부터). 광고 ID 로만 등록된 캡도 포함한다.
     */
    @Query("SELECT c FROM AdBudgetCap c WHERE (c.adId = :adId OR c.campaignId = :campaignId) " +
           "AND c.enabled = true " +
           "AND (c.startDate IS NULL OR c.startDate <= :today) " +
           "AND (c.endDate IS NULL OR c.endDate >= :today) " +
           "ORDER BY c.maxDailyBudget ASC, c.adId ASC")
    List<AdBudgetCap> findActiveByCampaign(@Param("adId") String adId,
                                           @Param("campaignId") String campaignId,
                                           @Param("today") LocalDate today);
}
