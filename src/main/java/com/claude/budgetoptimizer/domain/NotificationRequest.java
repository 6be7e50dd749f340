package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class NotificationRequest {

    String advertiserId;
    NotificationType type;
    NotificationSeverity severity;
    AuditEntry.EntityType entityType;
    String entityId;
    String title;
    String message;
    Map<String, Object> metadata;

    public NotificationSeverity getEffectiveSeverity() {
        return severity != null ? severity : type.getDefaultSeverity();
    }
}
