package com.claude.budgetoptimizer.domain;

/**
 * 일예산이 걸려 있는 엔티티 레벨. CBO 캠페인이면 CAMPAIGN, 아니면 ADGROUP.
 */
public enum BudgetEntityLevel {
    ADGROUP, CAMPAIGN
}
