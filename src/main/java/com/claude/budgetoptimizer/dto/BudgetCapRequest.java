package com.claude.budgetoptimizer.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetCapRequest {

    @NotBlank
    private String advertiserId;

    @NotBlank
    private String adId;

    private String adgroupId;

    private String campaignId;

    @NotNull
    @Positive
    private BigDecimal maxDailyBudget;

    private Boolean enabled;

    private LocalDate startDate;

    private LocalDate endDate;
}
