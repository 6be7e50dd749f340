package com.claude.budgetoptimizer.entity;

import com.claude.budgetoptimizer.domain.RunStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 최적화 대상 광고주
 *
 * 플랫폼 광고주 ID, 연결된 소구 프로필, 마지막 run 기록을 가진다.
 * 실패 횟수는 참고용이며 자동으로 최적화를 끄지 않는다.
 */
@Entity
@Table(name = "advertisers")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Advertiser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String advertiserId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    private AdvertiserStatus status;

    @Column(name = "optimization_enabled")
    private Boolean optimizationEnabled = true;

    // 비어 있으면 budget-optimization.platform.default-access-token 사용
    @Column(name = "access_token", length = 512)
    @ToString.Exclude
    private String accessToken;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "appeal_id")
    private AppealProfile appeal;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "last_run_status")
    @Enumerated(EnumType.STRING)
    private RunStatus lastRunStatus;

    @Column(name = "failure_count")
    private Integer failureCount = 0;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum AdvertiserStatus {
        ACTIVE, INACTIVE, SUSPENDED
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = AdvertiserStatus.ACTIVE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isEligibleForOptimization() {
        return Boolean.TRUE.equals(optimizationEnabled)
                && status == AdvertiserStatus.ACTIVE
                && appeal != null;
    }

    public void recordRun(RunStatus runStatus, LocalDateTime runAt) {
        this.lastRunAt = runAt;
        this.lastRunStatus = runStatus;
        if (runStatus == RunStatus.FAILED) {
            this.failureCount = (failureCount == null ? 0 : failureCount) + 1;
        } else if (runStatus != RunStatus.LOCKED) {
            this.failureCount = 0;
        }
    }
}
