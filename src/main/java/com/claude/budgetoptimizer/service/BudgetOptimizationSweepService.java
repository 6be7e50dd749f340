package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.domain.SweepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 전체 광고주 최적화 (execute-all)
 *
 * 처리 과정:
 * 1. 최적화 대상 광고주 조회
 * 2. optimizationTaskExecutor 에서 광고주별 run 을 병렬 실행 (동시 실행 수는 sweep.parallelism)
 * 3. 모든 run 이 끝날 때까지 기다린 뒤 결과를 모아 돌려준다
 *
 * 한 광고주의 실패는 그 광고주 결과에만 남고 다른 광고주 run 에 영향을 주지 않는다.
 */
@Service
@Slf4j
public class BudgetOptimizationSweepService {

    private final AdvertiserDirectory advertiserDirectory;
    private final HourlyOptimizationOrchestrator orchestrator;
    private final Executor optimizationTaskExecutor;
    private final Clock clock;

    public BudgetOptimizationSweepService(AdvertiserDirectory advertiserDirectory,
                                          HourlyOptimizationOrchestrator orchestrator,
                                          @Qualifier("optimizationTaskExecutor") Executor optimizationTaskExecutor,
                                          Clock clock) {
        this.advertiserDirectory = advertiserDirectory;
        this.orchestrator = orchestrator;
        this.optimizationTaskExecutor = optimizationTaskExecutor;
        this.clock = clock;
    }

    public SweepResult executeAll(boolean dryRun) {
        LocalDateTime startedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        List<String> advertiserIds = advertiserDirectory.findTargetAdvertiserIds();
        log.info("=== 전체 광고주 최적화 시작: {}명{} ===", advertiserIds.size(), dryRun ? " (dry run)" : "");

        List<CompletableFuture<HourlyRunResult>> futures = advertiserIds.stream()
                .map(advertiserId -> CompletableFuture.supplyAsync(
                        () -> runIsolated(advertiserId, dryRun), optimizationTaskExecutor))
                .collect(Collectors.toList());

        List<HourlyRunResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        SweepResult sweep = SweepResult.of(startedAt, dryRun, results);
        log.info("=== 전체 광고주 최적화 완료: 처리 {}, 실패 {}, 전체 {} ===",
                sweep.getProcessed(), sweep.getFailed(), sweep.getTotal());
        return sweep;
    }

    /**
     * 분류되지 않은 예외도 이 광고주의 FAILED 결과로 바꿔서 형제 run 을 보호한다.
     */
    private HourlyRunResult runIsolated(String advertiserId, boolean dryRun) {
        try {
            return orchestrator.execute(advertiserId, dryRun);
        } catch (RuntimeException e) {
            log.error("[{}] 예기치 못한 오류로 run 실패", advertiserId, e);
            return HourlyRunResult.of(advertiserId, LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS),
                    dryRun, RunStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
