package com.claude.budgetoptimizer.domain;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CapResolution {

    public enum Outcome {
        UNCHANGED,
        CLAMPED_TO_CEILING,
        CEILING_REACHED,
        CAP_APPLIED,
        CAP_REACHED
    }

    Outcome outcome;
    BigDecimal budget;
    BigDecimal limit;

    public boolean isIncreaseRemaining() {
        return outcome != Outcome.CAP_REACHED && outcome != Outcome.CEILING_REACHED;
    }

    public boolean isOverrideCapEvent() {
        return outcome == Outcome.CAP_APPLIED || outcome == Outcome.CAP_REACHED;
    }
}
