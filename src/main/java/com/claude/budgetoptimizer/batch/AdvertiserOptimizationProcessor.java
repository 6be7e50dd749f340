package com.claude.budgetoptimizer.batch;

import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.service.HourlyOptimizationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@StepScope
@Slf4j
public class AdvertiserOptimizationProcessor implements ItemProcessor<String, HourlyRunResult> {

    private final HourlyOptimizationOrchestrator orchestrator;
    private final boolean dryRun;

    public AdvertiserOptimizationProcessor(HourlyOptimizationOrchestrator orchestrator,
                                           @Value("#{jobParameters['dryRun']}") String dryRun) {
        this.orchestrator = orchestrator;
        this.dryRun = Boolean.parseBoolean(dryRun);
    }

    @Override
    public HourlyRunResult process(String advertiserId) {
        log.debug("[{}] 최적화 run 실행 (dryRun={})", advertiserId, dryRun);
        return orchestrator.execute(advertiserId, dryRun);
    }
}
