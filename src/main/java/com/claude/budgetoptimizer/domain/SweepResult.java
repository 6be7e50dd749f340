package com.claude.budgetoptimizer.domain;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

@Value
public class SweepResult {

    LocalDateTime executionTime;
    boolean dryRun;
    int total;
    int processed;
    int failed;
    List<HourlyRunResult> results;

    public static SweepResult of(LocalDateTime executionTime, boolean dryRun, List<HourlyRunResult> results) {
        int failed = (int) results.stream().filter(HourlyRunResult::isFailed).count();
        return new SweepResult(executionTime, dryRun, results.size(), results.size() - failed, failed, results);
    }
}
