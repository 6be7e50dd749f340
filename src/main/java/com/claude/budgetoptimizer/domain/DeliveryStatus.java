package com.claude.budgetoptimizer.domain;

public enum DeliveryStatus {
    ENABLE, DISABLE
}
