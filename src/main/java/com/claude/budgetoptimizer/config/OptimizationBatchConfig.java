package com.claude.budgetoptimizer.config;

import com.claude.budgetoptimizer.batch.AdvertiserOptimizationProcessor;
import com.claude.budgetoptimizer.batch.RunResultWriter;
import com.claude.budgetoptimizer.batch.TargetAdvertiserReader;
import com.claude.budgetoptimizer.domain.HourlyRunResult;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OptimizationBatchConfig {

    private final JobRepository jobRepository;
    private final TargetAdvertiserReader targetAdvertiserReader;
    private final AdvertiserOptimizationProcessor optimizationProcessor;
    private final RunResultWriter runResultWriter;

    public OptimizationBatchConfig(JobRepository jobRepository,
                                   TargetAdvertiserReader targetAdvertiserReader,
                                   AdvertiserOptimizationProcessor optimizationProcessor,
                                   RunResultWriter runResultWriter) {
        this.jobRepository = jobRepository;
        this.targetAdvertiserReader = targetAdvertiserReader;
        this.optimizationProcessor = optimizationProcessor;
        this.runResultWriter = runResultWriter;
    }

    @Bean
    public Job hourlyBudgetOptimizationJob() {
        return new JobBuilder("hourlyBudgetOptimizationJob", jobRepository)
                .start(optimizeAdvertisersStep())
                .build();
    }

    // chunk 는 트랜잭션을 갖지 않는다. lock 과 스냅샷이 광고주 run 안에서 바로 커밋되어야 한다.
    @Bean
    public Step optimizeAdvertisersStep() {
        return new StepBuilder("optimizeAdvertisersStep", jobRepository)
                .<String, HourlyRunResult>chunk(1, new ResourcelessTransactionManager())
                .reader(targetAdvertiserReader)
                .processor(optimizationProcessor)
                .writer(runResultWriter)
                .faultTolerant()
                .skipLimit(1000)
                .skip(Exception.class)
                .build();
    }
}
