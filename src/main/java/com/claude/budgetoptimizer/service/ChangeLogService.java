package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.AuditEntry;
import com.claude.budgetoptimizer.entity.ChangeLog;
import com.claude.budgetoptimizer.repository.ChangeLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * 변경 이력 기록. 일시적인 DB 오류는 재시도한다.
 */
@Service
@Slf4j
public class ChangeLogService implements AuditTrail {

    private final ChangeLogRepository changeLogRepository;
    private final ObjectMapper objectMapper;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public ChangeLogService(ChangeLogRepository changeLogRepository, ObjectMapper objectMapper,
                            RetryTemplate optimizationRetryTemplate, Clock clock) {
        this.changeLogRepository = changeLogRepository;
        this.objectMapper = objectMapper;
        this.retryTemplate = optimizationRetryTemplate;
        this.clock = clock;
    }

    @Override
    public void record(AuditEntry entry) {
        ChangeLog changeLog = ChangeLog.builder()
                .advertiserId(entry.getAdvertiserId())
                .entityType(entry.getEntityType().name())
                .entityId(entry.getEntityId())
                .action(entry.getAction().name())
                .source(entry.getSource())
                .beforeData(toJson(entry.getBefore()))
                .afterData(toJson(entry.getAfter()))
                .reason(entry.getReason())
                .createdAt(LocalDateTime.now(clock))
                .build();
        retryTemplate.execute(context -> changeLogRepository.save(changeLog));
        log.debug("[{}] change log: {} {} {}", entry.getAdvertiserId(), entry.getAction(), entry.getEntityType(), entry.getEntityId());
    }

    private String toJson(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("change log payload is not serializable: " + data, e);
        }
    }
}
