package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.NotificationRequest;
import com.claude.budgetoptimizer.entity.Notification;
import com.claude.budgetoptimizer.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 알림 저장
 *
 * 같은 광고주, 같은 종류, 같은 엔티티의 알림은 하루에 한 번만 남긴다.
 */
@Service
@Slf4j
public class NotificationService implements NotificationSink {

    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, ObjectMapper objectMapper, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean notify(NotificationRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime startOfDay = LocalDate.now(clock).atStartOfDay();
        if (notificationRepository.existsByAdvertiserIdAndTypeAndEntityIdAndCreatedAtGreaterThanEqual(
                request.getAdvertiserId(), request.getType(), request.getEntityId(), startOfDay)) {
            log.debug("[{}] 오늘 이미 보낸 알림 생략: {} {}", request.getAdvertiserId(), request.getType(), request.getEntityId());
            return false;
        }

        Notification notification = Notification.builder()
                .advertiserId(request.getAdvertiserId())
                .type(request.getType())
                .severity(request.getEffectiveSeverity())
                .entityType(request.getEntityType() == null ? null : request.getEntityType().name())
                .entityId(request.getEntityId())
                .title(request.getTitle())
                .message(request.getMessage())
                .metadata(toJson(request))
                .read(false)
                .createdAt(now)
                .build();
        notificationRepository.save(notification);
        log.info("[{}] 알림 생성: {} ({})", request.getAdvertiserId(), request.getType(), request.getTitle());
        return true;
    }

    private String toJson(NotificationRequest request) {
        if (request.getMetadata() == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(request.getMetadata());
        } catch (JsonProcessingException e) {
            log.warn("[{}] 알림 metadata 직렬화 실패: {}", request.getAdvertiserId(), e.getMessage());
            return null;
        }
    }
}
