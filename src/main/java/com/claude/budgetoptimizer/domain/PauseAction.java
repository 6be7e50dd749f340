package com.claude.budgetoptimizer.domain;

public enum PauseAction {
    PAUSE, CONTINUE, SKIP_NEW_CREATIVE, REDUCE_BUDGET
}
