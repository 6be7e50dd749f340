package com.claude.budgetoptimizer.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 소구(appeal) 별 목표치와 장부 위치
 */
@Entity
@Table(name = "appeal_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppealProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    @Column(name = "target_cpa", precision = 12, scale = 2)
    private BigDecimal targetCpa;

    @Column(name = "allowable_cpa", precision = 12, scale = 2)
    private BigDecimal allowableCpa;

    @Column(name = "target_front_cpo", precision = 12, scale = 2)
    private BigDecimal targetFrontCpo;

    @Column(name = "allowable_front_cpo", precision = 12, scale = 2)
    private BigDecimal allowableFrontCpo;

    @Column(name = "allowable_reservation_cpo", precision = 12, scale = 2)
    private BigDecimal allowableReservationCpo;

    // 스프레드시트 URL 또는 ID
    @Column(name = "conversion_ledger", length = 512)
    private String conversionLedger;

    @Column(name = "front_sales_ledger", length = 512)
    private String frontSalesLedger;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
