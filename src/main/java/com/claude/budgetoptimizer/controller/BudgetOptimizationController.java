package com.claude.budgetoptimizer.controller;

import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.domain.SweepResult;
import com.claude.budgetoptimizer.dto.ApiResponse;
import com.claude.budgetoptimizer.dto.ExecuteRequest;
import com.claude.budgetoptimizer.entity.HourlyOptimizationSnapshot;
import com.claude.budgetoptimizer.service.BudgetOptimizationSweepService;
import com.claude.budgetoptimizer.service.HourlyOptimizationOrchestrator;
import com.claude.budgetoptimizer.service.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * 예산 최적화 수동 실행 / 조회 컨트롤러
 *
 * - 광고주 단위 실행과 dry run
 * - 전체 광고주 실행
 * - 시간 단위 스냅샷 조회
 */
@RestController
@RequestMapping("/api/budget-optimization")
@Slf4j
public class BudgetOptimizationController {

    private final HourlyOptimizationOrchestrator orchestrator;
    private final BudgetOptimizationSweepService sweepService;
    private final SnapshotStore snapshotStore;

    public BudgetOptimizationController(HourlyOptimizationOrchestrator orchestrator,
                                        BudgetOptimizationSweepService sweepService,
                                        SnapshotStore snapshotStore) {
        this.orchestrator = orchestrator;
        this.sweepService = sweepService;
        this.snapshotStore = snapshotStore;
    }

    @PostMapping("/execute/{advertiserId}")
    public ResponseEntity<ApiResponse<HourlyRunResult>> execute(@PathVariable String advertiserId,
                                                                @RequestBody(required = false) ExecuteRequest request) {
        boolean dryRun = request != null && request.isDryRun();
        log.info("광고주 {} 최적화 수동 실행 요청 (dryRun={})", advertiserId, dryRun);
        return runFor(advertiserId, dryRun);
    }

    @PostMapping("/dry-run/{advertiserId}")
    public ResponseEntity<ApiResponse<HourlyRunResult>> dryRun(@PathVariable String advertiserId) {
        log.info("광고주 {} dry run 요청", advertiserId);
        return runFor(advertiserId, true);
    }

    @PostMapping("/execute-all")
    public ResponseEntity<ApiResponse<SweepResult>> executeAll(@RequestBody(required = false) ExecuteRequest request) {
        boolean dryRun = request != null && request.isDryRun();
        log.info("전체 광고주 최적화 수동 실행 요청 (dryRun={})", dryRun);
        try {
            return ResponseEntity.ok(ApiResponse.ok(sweepService.executeAll(dryRun)));
        } catch (Exception e) {
            log.error("전체 광고주 최적화 실행 실패", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure(e.getMessage()));
        }
    }

    @GetMapping("/snapshots/{advertiserId}")
    public ResponseEntity<ApiResponse<List<HourlyOptimizationSnapshot>>> getSnapshots(
            @PathVariable String advertiserId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        try {
            return ResponseEntity.ok(ApiResponse.ok(snapshotStore.findByAdvertiser(advertiserId, date)));
        } catch (Exception e) {
            log.error("광고주 {} 스냅샷 조회 실패", advertiserId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure(e.getMessage()));
        }
    }

    private ResponseEntity<ApiResponse<HourlyRunResult>> runFor(String advertiserId, boolean dryRun) {
        try {
            HourlyRunResult result = orchestrator.execute(advertiserId, dryRun);
            if (result.isFailed()) {
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(ApiResponse.failure(result.getMessage()));
            }
            return ResponseEntity.ok(ApiResponse.ok(result));
        } catch (Exception e) {
            log.error("광고주 {} 최적화 실행 실패", advertiserId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.failure(e.getMessage()));
        }
    }
}
