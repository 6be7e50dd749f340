package com.claude.budgetoptimizer.config;

import com.claude.budgetoptimizer.exception.TransientInfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * 시계, HTTP 클라이언트, 재시도 정책
 */
@Configuration
@EnableConfigurationProperties(BudgetOptimizationProperties.class)
@Slf4j
public class InfrastructureConfig {

    @Bean
    public Clock clock(BudgetOptimizationProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }

    @Bean(name = "platformRestTemplate")
    public RestTemplate platformRestTemplate(RestTemplateBuilder builder, BudgetOptimizationProperties properties) {
        return builder
                .setConnectTimeout(properties.getPlatform().getConnectTimeout())
                .setReadTimeout(properties.getPlatform().getReadTimeout())
                .build();
    }

    @Bean(name = "sheetsRestTemplate")
    public RestTemplate sheetsRestTemplate(RestTemplateBuilder builder, BudgetOptimizationProperties properties) {
        return builder
                .setConnectTimeout(properties.getPlatform().getConnectTimeout())
                .setReadTimeout(properties.getPlatform().getReadTimeout())
                .build();
    }

    /**
     * 외부 호출과 DB 쓰기 공통 재시도. 기본값 3회, 1s → 2s → 4s, 최대 10s.
     * 분류된 일시 장애만 재시도하고 나머지는 바로 전파한다.
     */
    @Bean
    public RetryTemplate optimizationRetryTemplate(BudgetOptimizationProperties properties) {
        BudgetOptimizationProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getInitialInterval().toMillis(), retry.getMultiplier(),
                        retry.getMaxInterval().toMillis())
                .retryOn(List.of(TransientInfrastructureException.class, TransientDataAccessException.class))
                .traversingCauses()
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        log.warn("재시도 대상 오류 (attempt {}): {}", context.getRetryCount(), throwable.getMessage());
                    }
                })
                .build();
    }
}
