package com.claude.budgetoptimizer.domain;

public enum NotificationType {
    BUDGET_CAP_APPLIED(NotificationSeverity.INFO),
    BUDGET_CAP_REACHED(NotificationSeverity.WARNING),
    AD_PAUSED(NotificationSeverity.WARNING),
    BUDGET_REDUCED(NotificationSeverity.INFO);

    private final NotificationSeverity defaultSeverity;

    NotificationType(NotificationSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public NotificationSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
