package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 광고주 한 명의 시간 단위 run 결과.
 */
@Value
@Builder
public class HourlyRunResult {

    String advertiserId;
    LocalDateTime executionTime;
    RunStatus status;
    boolean dryRun;
    boolean firstRound;
    @Builder.Default
    List<BudgetDecision> budgetDecisions = List.of();
    @Builder.Default
    List<PauseDecision> pauseDecisions = List.of();
    @Builder.Default
    RunSummary summary = RunSummary.EMPTY;
    String message;

    public static HourlyRunResult of(String advertiserId, LocalDateTime executionTime, boolean dryRun,
                                     RunStatus status, String message) {
        return HourlyRunResult.builder()
                .advertiserId(advertiserId)
                .executionTime(executionTime)
                .dryRun(dryRun)
                .status(status)
                .message(message)
                .build();
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }
}
