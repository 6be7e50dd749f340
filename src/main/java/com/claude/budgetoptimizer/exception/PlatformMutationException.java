package com.claude.budgetoptimizer.exception;

public class PlatformMutationException extends BudgetOptimizationException {

    public static final String MUTATION_REJECTED = "P-01";

    public PlatformMutationException(String message) {
        super(ErrorCategory.PLATFORM_MUTATION, MUTATION_REJECTED, message);
    }

    public PlatformMutationException(String message, Throwable cause) {
        super(ErrorCategory.PLATFORM_MUTATION, MUTATION_REJECTED, message, cause);
    }
}
