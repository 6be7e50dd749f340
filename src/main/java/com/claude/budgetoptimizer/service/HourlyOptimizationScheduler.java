package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 배치 스케줄러
 *
 * 핵심 역할:
 * 1. 매 정시 hourlyBudgetOptimizationJob 실행 (운영 시간 판정은 run 안에서 한다)
 * 2. 만료된 job lease 정리
 * 3. 보존 기간(730일)이 지난 스냅샷 삭제
 *
 * 어떤 예외도 스케줄러 스레드를 멈추지 않도록 각 작업은 자체적으로 오류를 기록하고 끝난다.
 */
@Service
@Slf4j
public class HourlyOptimizationScheduler {

    private final JobLauncher jobLauncher;
    private final Job hourlyBudgetOptimizationJob;
    private final JobLock jobLock;
    private final SnapshotStore snapshotStore;
    private final BudgetOptimizationProperties properties;
    private final Clock clock;

    public HourlyOptimizationScheduler(JobLauncher jobLauncher,
                                       Job hourlyBudgetOptimizationJob,
                                       JobLock jobLock,
                                       SnapshotStore snapshotStore,
                                       BudgetOptimizationProperties properties,
                                       Clock clock) {
        this.jobLauncher = jobLauncher;
        this.hourlyBudgetOptimizationJob = hourlyBudgetOptimizationJob;
        this.jobLock = jobLock;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${budget-optimization.schedule.hourly-cron:0 0 * * * *}",
               zone = "${budget-optimization.zone:Asia/Tokyo}")
    public void launchHourlyOptimization() {
        if (!properties.getSchedule().isEnabled()) {
            log.debug("스케줄 실행 비활성화 상태");
            return;
        }
        try {
            JobParameters jobParameters = new JobParametersBuilder()
                    .addString("dryRun", "false")
                    .addLong("timestamp", clock.millis())
                    .toJobParameters();
            log.info("hourlyBudgetOptimizationJob 실행: {}", jobParameters);

            JobExecution execution = jobLauncher.run(hourlyBudgetOptimizationJob, jobParameters);
            if (execution.getStatus().isUnsuccessful()) {
                log.error("hourlyBudgetOptimizationJob 실패: {} {}", execution.getStatus(), execution.getAllFailureExceptions());
            } else {
                log.info("hourlyBudgetOptimizationJob 완료: {}", execution.getStatus());
            }
        } catch (Exception e) {
            log.error("hourlyBudgetOptimizationJob 실행 중 오류", e);
        }
    }

    /**
     * 프로세스가 죽어서 남은 lease 정리
     */
    @Scheduled(fixedDelayString = "${budget-optimization.schedule.lease-cleanup-interval:PT10M}")
    public void purgeExpiredLeases() {
        try {
            int purged = jobLock.purgeExpired();
            if (purged > 0) {
                log.warn("만료된 job lease {}건 정리", purged);
            }
        } catch (Exception e) {
            log.error("job lease 정리 중 오류", e);
        }
    }

    @Scheduled(cron = "${budget-optimization.snapshot.prune-cron:0 30 3 * * *}",
               zone = "${budget-optimization.zone:Asia/Tokyo}")
    public void pruneSnapshots() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getSnapshot().getRetentionDays());
        try {
            snapshotStore.pruneCreatedBefore(cutoff);
        } catch (Exception e) {
            log.error("snapshot 정리 중 오류 (cutoff {})", cutoff, e);
        }
    }
}
