package com.claude.budgetoptimizer.exception;

import lombok.Getter;

/**
 * 예산 최적화 처리 중 발생하는 모든 분류된 예외의 루트.
 *
 * 분류는 타입과 {@link ErrorCategory} 로만 판단하고 메시지 문자열은 보지 않는다.
 */
@Getter
public abstract class BudgetOptimizationException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;

    protected BudgetOptimizationException(ErrorCategory category, String code, String message) {
        super(message);
        this.category = category;
        this.code = code;
    }

    protected BudgetOptimizationException(ErrorCategory category, String code, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.code = code;
    }

    /**
     * decision reason 에 그대로 들어가는 형태: {@code [O-01] message}
     */
    public String toReason() {
        return "[" + code + "] " + getMessage();
    }
}
