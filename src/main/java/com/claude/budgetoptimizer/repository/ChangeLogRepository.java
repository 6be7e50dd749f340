package com.claude.budgetoptimizer.repository;

import com.claude.budgetoptimizer.entity.ChangeLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeLogRepository extends JpaRepository<ChangeLog, Long> {

    List<ChangeLog> findByEntityTypeAndEntityIdOrderByCreatedAtDesc(String entityType, String entityId);

    List<ChangeLog> findByAdvertiserIdOrderByCreatedAtDesc(String advertiserId);
}
