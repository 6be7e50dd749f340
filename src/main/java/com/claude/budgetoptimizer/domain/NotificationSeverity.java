package com.claude.budgetoptimizer.domain;

public enum NotificationSeverity {
    INFO, WARNING, CRITICAL
}
