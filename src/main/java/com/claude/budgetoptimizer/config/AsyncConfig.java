package com.claude.budgetoptimizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 비동기 처리 설정
 *
 * execute-all 에서 광고주별 run 을 병렬로 돌리는 스레드 풀.
 * 광고주 하나는 항상 스레드 하나에서 처리된다.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 최적화 run 용 스레드 풀
     *
     * core = max = sweep.parallelism 으로 고정해서 플랫폼 API 동시 호출 수를 제한한다.
     * 큐가 가득 차면 호출한 스레드에서 실행된다.
     */
    @Bean(name = "optimizationTaskExecutor")
    public Executor optimizationTaskExecutor(BudgetOptimizationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int parallelism = properties.getSweep().getParallelism();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(100);
        executor.setKeepAliveSeconds(60);

        // 로그에서 run 스레드를 구분하기 위한 접두사
        executor.setThreadNamePrefix("Optimization-");

        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        return executor;
    }
}
