package com.claude.budgetoptimizer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 매 시간 run 에서 광고별로 남기는 관측 기록
 *
 * 다음 라운드에서 "전환이 늘었는가" 판단의 기준이 된다. 한 번 쓰면 수정하지 않고
 * 보존 기간이 지나면 일괄 삭제한다.
 */
@Entity
@Immutable
@Table(name = "hourly_optimization_snapshots",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_snapshot_execution",
                   columnNames = {"advertiser_id", "ad_id", "execution_time"})
       },
       indexes = {
           @Index(name = "idx_snapshot_advertiser_time", columnList = "advertiser_id, execution_time"),
           @Index(name = "idx_snapshot_ad_time", columnList = "ad_id, execution_time"),
           @Index(name = "idx_snapshot_created_at", columnList = "created_at")
       })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class HourlyOptimizationSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "advertiser_id", nullable = false)
    private String advertiserId;

    @Column(name = "ad_id", nullable = false)
    private String adId;

    @Column(name = "ad_name", length = 512)
    private String adName;

    @Column(name = "execution_time", nullable = false)
    private LocalDateTime executionTime;

    @Column(name = "today_conversion_count", nullable = false)
    private int todayConversionCount;

    @Column(name = "today_spend", precision = 14, scale = 2)
    private BigDecimal todaySpend;

    @Column(name = "today_cpa", precision = 14, scale = 2)
    private BigDecimal todayCpa;

    @Column(name = "daily_budget", precision = 14, scale = 2)
    private BigDecimal dailyBudget;

    @Column(name = "action", length = 32)
    private String action;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Column(name = "new_budget", precision = 14, scale = 2)
    private BigDecimal newBudget;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public String naturalKey() {
        return advertiserId + ":" + adId + ":" + executionTime;
    }
}
