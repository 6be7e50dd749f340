package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.AuditEntry;
import com.claude.budgetoptimizer.entity.ChangeLog;
import com.claude.budgetoptimizer.repository.ChangeLogRepository;
import com.claude.budgetoptimizer.support.MutableClock;
import com.claude.budgetoptimizer.support.TestRetryTemplates;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ChangeLogServiceTest {

    @Autowired
    private ChangeLogRepository changeLogRepository;

    @Test
    void recordsBudgetChangeWithJsonPayload() {
        LocalDateTime now = LocalDateTime.of(2024, 5, 10, 10, 0);
        ChangeLogService changeLogService = new ChangeLogService(changeLogRepository, new ObjectMapper(),
                TestRetryTemplates.noBackoff(3), MutableClock.at(now));

        changeLogService.record(AuditEntry.builder()
                .advertiserId("adv-1")
                .entityType(AuditEntry.EntityType.ADGROUP)
                .entityId("ag-1")
                .action(AuditEntry.Action.UPDATE_BUDGET)
                .before(Map.of("budget", 5000))
                .after(Map.of("budget", 6500))
                .reason("CPA 양호, 30% 증액")
                .build());

        List<ChangeLog> logs = changeLogRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc("ADGROUP", "ag-1");
        assertEquals(1, logs.size());
        ChangeLog saved = logs.get(0);
        assertEquals("UPDATE_BUDGET", saved.getAction());
        assertEquals(AuditEntry.SOURCE, saved.getSource());
        assertEquals("{\"budget\":5000}", saved.getBeforeData());
        assertEquals("{\"budget\":6500}", saved.getAfterData());
        assertEquals(now, saved.getCreatedAt());
    }
}
