package com.claude.budgetoptimizer.domain;

public enum RunStatus {
    COMPLETED,
    NO_ACTIVE_ADS,
    OUTSIDE_WINDOW,
    LOCKED,
    FAILED
}
