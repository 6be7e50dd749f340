package com.claude.budgetoptimizer.exception;

import lombok.Getter;

/**
 * 타임아웃, rate limit, 5xx 등 재시도하면 성공할 수 있는 외부 호출 실패.
 */
@Getter
public class TransientInfrastructureException extends BudgetOptimizationException {

    public static final String REMOTE_UNAVAILABLE = "T-01";

    // HTTP 응답이 없었던 실패(I/O, 본문 code)는 null
    private final Integer httpStatus;

    public TransientInfrastructureException(String message, Integer httpStatus, Throwable cause) {
        super(ErrorCategory.TRANSIENT, REMOTE_UNAVAILABLE, message, cause);
        this.httpStatus = httpStatus;
    }
}
