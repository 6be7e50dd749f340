package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.CapResolution;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BudgetCapResolverTest {

    private final BudgetCapResolver resolver = new BudgetCapResolver();

    @Test
    void overrideCapClampsProposal() {
        CapResolution resolution = resolver.resolve(bd(5000), bd(6500), cap(6000));

        assertEquals(CapResolution.Outcome.CAP_APPLIED, resolution.getOutcome());
        assertEquals(0, bd(6000).compareTo(resolution.getBudget()));
        assertTrue(resolution.isIncreaseRemaining());
        assertTrue(resolution.isOverrideCapEvent());
    }

    @Test
    void budgetAlreadyAtCapIsReached() {
        CapResolution resolution = resolver.resolve(bd(6000), bd(7800), cap(6000));

        assertEquals(CapResolution.Outcome.CAP_REACHED, resolution.getOutcome());
        assertFalse(resolution.isIncreaseRemaining());
        assertTrue(resolution.isOverrideCapEvent());
    }

    @Test
    void proposalUnderCapIsUnchanged() {
        CapResolution resolution = resolver.resolve(bd(5000), bd(6500), cap(10000));

        assertEquals(CapResolution.Outcome.UNCHANGED, resolution.getOutcome());
        assertEquals(0, bd(6500).compareTo(resolution.getBudget()));
        assertFalse(resolution.isOverrideCapEvent());
    }

    @Test
    void globalCeilingAppliesWithoutCap() {
        CapResolution clamped = resolver.resolve(bd(35000), bd(45500), Optional.empty());
        assertEquals(CapResolution.Outcome.CLAMPED_TO_CEILING, clamped.getOutcome());
        assertEquals(0, bd(40000).compareTo(clamped.getBudget()));
        assertFalse(clamped.isOverrideCapEvent());

        CapResolution reached = resolver.resolve(bd(40000), bd(52000), Optional.empty());
        assertEquals(CapResolution.Outcome.CEILING_REACHED, reached.getOutcome());
    }

    @Test
    void capAboveCeilingDoesNotBind() {
        CapResolution resolution = resolver.resolve(bd(35000), bd(45500), cap(50000));

        assertEquals(CapResolution.Outcome.CLAMPED_TO_CEILING, resolution.getOutcome());
        assertEquals(0, bd(40000).compareTo(resolution.getLimit()));
    }

    private static Optional<BudgetCapLimit> cap(long value) {
        return Optional.of(new BudgetCapLimit(bd(value), "ad-cap"));
    }

    private static BigDecimal bd(long value) {
        return BigDecimal.valueOf(value);
    }
}
