package com.claude.budgetoptimizer.domain;

public enum BudgetAction {
    INCREASE, CONTINUE, SKIP
}
