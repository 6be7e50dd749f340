package com.claude.budgetoptimizer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 광고 단위 일예산 상한
 *
 * 광고 하나에 캡 하나. 예산은 광고그룹 또는 CBO 캠페인에 걸려 있으므로
 * 같은 예산 엔티티의 캡 중 가장 작은 값이 적용된다.
 */
@Entity
@Table(name = "ad_budget_caps",
       indexes = {
           @Index(name = "idx_cap_adgroup", columnList = "adgroup_id"),
           @Index(name = "idx_cap_campaign", columnList = "campaign_id"),
           @Index(name = "idx_cap_advertiser", columnList = "advertiser_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdBudgetCap {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "advertiser_id", nullable = false)
    private String advertiserId;

    @Column(name = "ad_id", nullable = false, unique = true)
    private String adId;

    @Column(name = "adgroup_id")
    private String adgroupId;

    @Column(name = "campaign_id")
    private String campaignId;

    @Column(name = "max_daily_budget", nullable = false, precision = 14, scale = 2)
    private BigDecimal maxDailyBudget;

    @Builder.Default
    private Boolean enabled = true;

    // null 이면 기간 제한 없음
    private LocalDate startDate;
    private LocalDate endDate;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (enabled == null) {
            enabled = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isActiveOn(LocalDate date) {
        return Boolean.TRUE.equals(enabled)
                && (startDate == null || !startDate.isAfter(date))
                && (endDate == null || !endDate.isBefore(date));
    }
}
