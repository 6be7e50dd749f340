package com.claude.budgetoptimizer.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 적용된 변경 한 건의 감사 기록. before / after 는 JSON 으로 저장된다.
 */
@Value
@Builder
public class AuditEntry {

    public enum Action {
        UPDATE_BUDGET, PAUSE, DECREASE_BUDGET
    }

    public enum EntityType {
        AD, ADGROUP, CAMPAIGN;

        public static EntityType of(BudgetEntityLevel level) {
            return level == BudgetEntityLevel.CAMPAIGN ? CAMPAIGN : ADGROUP;
        }
    }

    public static final String SOURCE = "BUDGET_OPTIMIZATION";

    String advertiserId;
    EntityType entityType;
    String entityId;
    Action action;
    @Builder.Default
    String source = SOURCE;
    Map<String, Object> before;
    Map<String, Object> after;
    String reason;
}
