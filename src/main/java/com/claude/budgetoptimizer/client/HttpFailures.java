package com.claude.budgetoptimizer.client;

import com.claude.budgetoptimizer.exception.BudgetOptimizationException;
import com.claude.budgetoptimizer.exception.DataQualityException;
import com.claude.budgetoptimizer.exception.PlatformMutationException;
import com.claude.budgetoptimizer.exception.TransientInfrastructureException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Set;

/**
 * RestTemplate 예외를 분류된 예외로 바꾼다. 408, 429, 5xx 와 I/O 오류는 재시도 대상.
 */
public final class HttpFailures {

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 500, 502, 503, 504);

    private HttpFailures() {
    }

    public static boolean isRetryable(int status) {
        return RETRYABLE_STATUS.contains(status) || status >= 500;
    }

    public static BudgetOptimizationException forQuery(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            int status = ((RestClientResponseException) e).getStatusCode().value();
            if (isRetryable(status)) {
                return new TransientInfrastructureException(operation + " failed with HTTP " + status, status, e);
            }
            return new DataQualityException(DataQualityException.PLATFORM_REJECTED_QUERY,
                    operation + " rejected with HTTP " + status, e);
        }
        return transientFailure(operation, e);
    }

    public static BudgetOptimizationException forMutation(String operation, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            int status = ((RestClientResponseException) e).getStatusCode().value();
            if (isRetryable(status)) {
                return new TransientInfrastructureException(operation + " failed with HTTP " + status, status, e);
            }
            return new PlatformMutationException(operation + " rejected with HTTP " + status, e);
        }
        return transientFailure(operation, e);
    }

    private static BudgetOptimizationException transientFailure(String operation, RestClientException e) {
        String detail = e instanceof ResourceAccessException ? "I/O error" : e.getClass().getSimpleName();
        return new TransientInfrastructureException(operation + " failed: " + detail + " " + e.getMessage(), null, e);
    }
}
