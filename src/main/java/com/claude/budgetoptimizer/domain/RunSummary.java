package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RunSummary {

    public static final RunSummary EMPTY = RunSummary.builder().build();

    int totalAds;
    int increased;
    int continued;
    int skipped;
    int paused;
    int budgetReduced;
    int processed;
    int failed;

    /**
     * @param totalAds         run 대상 활성 광고 수
     * @param unchangedSkipped 이후 라운드에서 전환이 늘지 않아 판정 목록에서 빠진 광고 수
     */
    public static RunSummary of(int totalAds, int unchangedSkipped,
                                List<BudgetDecision> budgetDecisions, List<PauseDecision> pauseDecisions) {
        int failed = (int) (budgetDecisions.stream().filter(BudgetDecision::isFailed).count()
                + pauseDecisions.stream().filter(PauseDecision::isFailed).count());
        return RunSummary.builder()
                .totalAds(totalAds)
                .increased(countBudget(budgetDecisions, BudgetAction.INCREASE))
                .continued(countBudget(budgetDecisions, BudgetAction.CONTINUE))
                .skipped(countBudget(budgetDecisions, BudgetAction.SKIP) + unchangedSkipped)
                .paused(countPause(pauseDecisions, PauseAction.PAUSE))
                .budgetReduced(countPause(pauseDecisions, PauseAction.REDUCE_BUDGET))
                .processed(budgetDecisions.size() + pauseDecisions.size() - failed)
                .failed(failed)
                .build();
    }

    private static int countBudget(List<BudgetDecision> decisions, BudgetAction action) {
        return (int) decisions.stream().filter(d -> d.getAction() == action && !d.isFailed()).count();
    }

    private static int countPause(List<PauseDecision> decisions, PauseAction action) {
        return (int) decisions.stream().filter(d -> d.getAction() == action && !d.isFailed()).count();
    }
}
