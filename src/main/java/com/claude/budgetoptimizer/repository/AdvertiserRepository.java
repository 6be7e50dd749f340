package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.Advertiser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AdvertiserRepository extends JpaRepository<Advertiser, Long> {

    Optional<Advertiser> findByAdvertiserId(String advertiserId);

    @Query("SELECT a FROM Advertiser a WHERE a.optimizationEnabled = true " +
           "AND a.status = :status " +
           "AND a.appeal IS NOT NULL " +
           "ORDER BY a.lastRunAt ASC NULLS FIRST, a.advertiserId ASC")
    List<Advertiser> findOptimizationTargets(@Param("status") Advertiser.AdvertiserStatus status);

    /**
     * 최적화 대상 광고주. 오래 전에 돈 광고주부터.
     */
    default List<Advertiser> findOptimizationTargets() {
        return findOptimizationTargets(Advertiser.AdvertiserStatus.ACTIVE);
    }
}
