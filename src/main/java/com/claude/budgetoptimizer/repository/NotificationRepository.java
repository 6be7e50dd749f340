package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.domain.NotificationType;
import com.claude.budgetoptimizer.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    boolean existsByAdvertiserIdAndTypeAndEntityIdAndCreatedAtGreaterThanEqual(
        String advertiserId, NotificationType type, String entityId, LocalDateTime since);

    List<Notification> findByAdvertiserIdOrderByCreatedAtDesc(String advertiserId);
}
