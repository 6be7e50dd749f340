package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 운영 시간대. 모든 시각은 설정된 zone 의 로컬 시각이다.
 */
@Component
public class OperatingSchedule {

    private final int firstRoundHour;
    private final int lastHour;

    public OperatingSchedule(BudgetOptimizationProperties properties) {
        this.firstRoundHour = properties.getFirstRoundHour();
        this.lastHour = properties.getLastHour();
    }

    public boolean isWithinWindow(LocalDateTime localTime) {
        int hour = localTime.getHour();
        return hour >= firstRoundHour && hour <= lastHour;
    }

    /**
     * 그날 첫 라운드 슬롯의 시작 시각. 이 시각 이후 스냅샷이 없으면 첫 라운드다.
     */
    public LocalDateTime firstRoundSlotStart(LocalDate date) {
        return date.atTime(firstRoundHour, 0);
    }
}
