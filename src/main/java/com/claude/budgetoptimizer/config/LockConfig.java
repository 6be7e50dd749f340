package com.claude.budgetoptimizer.config;

import com.claude.budgetoptimizer.repository.JobLeaseRepository;
import com.claude.budgetoptimizer.service.DatabaseJobLock;
import com.claude.budgetoptimizer.service.InMemoryJobLock;
import com.claude.budgetoptimizer.service.JobLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * lock.mode 에 따라 DB lease 또는 프로세스 내 lock 을 선택한다.
 */
@Configuration
@Slf4j
public class LockConfig {

    @Bean
    public JobLock jobLock(BudgetOptimizationProperties properties, JobLeaseRepository leaseRepository, Clock clock) {
        BudgetOptimizationProperties.Lock.Mode mode = properties.getLock().getMode();
        log.info("job lock mode: {} (timeout {})", mode, properties.getLock().getTimeout());
        if (mode == BudgetOptimizationProperties.Lock.Mode.IN_MEMORY) {
            return new InMemoryJobLock(clock);
        }
        return new DatabaseJobLock(leaseRepository, clock);
    }
}
