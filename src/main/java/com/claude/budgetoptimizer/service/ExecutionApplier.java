package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.client.PlatformMutationClient;
import com.claude.budgetoptimizer.domain.AuditEntry;
import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.BudgetDecision;
import com.claude.budgetoptimizer.domain.CapResolution;
import com.claude.budgetoptimizer.domain.DeliveryStatus;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.NotificationRequest;
import com.claude.budgetoptimizer.domain.NotificationType;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.PauseDecision;
import com.claude.budgetoptimizer.domain.PlatformBudgetLimits;
import com.claude.budgetoptimizer.exception.BudgetOptimizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 판정을 광고 플랫폼에 반영한다.
 *
 * 순서는 항상 변경 호출 → 감사 기록 → 알림. 변경 호출이 실패하면 감사 기록도 알림도 남기지 않는다.
 * 감사 기록과 알림 실패는 로그만 남기고 run 을 계속한다.
 */
@Service
@Slf4j
public class ExecutionApplier {

    private final PlatformMutationClient mutationClient;
    private final AuditTrail auditTrail;
    private final NotificationSink notificationSink;
    private final RetryTemplate retryTemplate;

    public ExecutionApplier(PlatformMutationClient mutationClient,
                            AuditTrail auditTrail,
                            NotificationSink notificationSink,
                            RetryTemplate optimizationRetryTemplate) {
        this.mutationClient = mutationClient;
        this.auditTrail = auditTrail;
        this.notificationSink = notificationSink;
        this.retryTemplate = optimizationRetryTemplate;
    }

    public BudgetDecision applyIncrease(OptimizationTarget target, ManagedAd ad, BudgetDecision decision) {
        BigDecimal platformBudget = PlatformBudgetLimits.normalize(decision.getNewBudget());
        try {
            updateBudget(target, ad, platformBudget);
        } catch (BudgetOptimizationException e) {
            log.error("[{}] ad {} 증액 반영 실패 ({} {}): {}", target.getAdvertiserId(), ad.getAdId(),
                    ad.getBudgetEntityLevel(), ad.getBudgetEntityId(), e.toReason(), e);
            return decision.markFailed(e.toReason());
        }

        log.info("[{}] ad {} {} {} 예산 {} -> {}", target.getAdvertiserId(), ad.getAdId(),
                ad.getBudgetEntityLevel(), ad.getBudgetEntityId(), decision.getCurrentBudget(), platformBudget);
        audit(AuditEntry.builder()
                .advertiserId(target.getAdvertiserId())
                .entityType(AuditEntry.EntityType.of(ad.getBudgetEntityLevel()))
                .entityId(ad.getBudgetEntityId())
                .action(AuditEntry.Action.UPDATE_BUDGET)
                .before(budgetPayload(ad, decision.getCurrentBudget()))
                .after(budgetPayload(ad, platformBudget))
                .reason(decision.getReason())
                .build());
        return decision.toBuilder().newBudget(platformBudget).applied(true).build();
    }

    public PauseDecision applyPause(OptimizationTarget target, ManagedAd ad, PauseDecision decision) {
        try {
            retryTemplate.execute(context -> {
                mutationClient.updateDeliveryStatus(target.getAccessToken(), target.getAdvertiserId(),
                        ad.getAdId(), DeliveryStatus.DISABLE);
                return null;
            });
        } catch (BudgetOptimizationException e) {
            log.error("[{}] ad {} 정지 반영 실패: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason(), e);
            return decision.markFailed(e.toReason());
        }

        log.info("[{}] ad {} 정지: {}", target.getAdvertiserId(), ad.getAdId(), decision.getReason());
        Map<String, Object> before = new LinkedHashMap<>();
        before.put("status", DeliveryStatus.ENABLE.name());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("status", DeliveryStatus.DISABLE.name());
        audit(AuditEntry.builder()
                .advertiserId(target.getAdvertiserId())
                .entityType(AuditEntry.EntityType.AD)
                .entityId(ad.getAdId())
                .action(AuditEntry.Action.PAUSE)
                .before(before)
                .after(after)
                .reason(decision.getReason())
                .build());
        notifySafely(NotificationRequest.builder()
                .advertiserId(target.getAdvertiserId())
                .type(NotificationType.AD_PAUSED)
                .entityType(AuditEntry.EntityType.AD)
                .entityId(ad.getAdId())
                .title("Ad paused: " + ad.getAdName())
                .message(decision.getReason())
                .metadata(Map.of("adId", ad.getAdId()))
                .build());
        return decision.toBuilder().applied(true).build();
    }

    public PauseDecision applyReduction(OptimizationTarget target, ManagedAd ad, PauseDecision decision) {
        BigDecimal platformBudget = PlatformBudgetLimits.normalize(decision.getReducedBudget());
        try {
            updateBudget(target, ad, platformBudget);
        } catch (BudgetOptimizationException e) {
            log.error("[{}] ad {} 감액 반영 실패: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason(), e);
            return decision.markFailed(e.toReason());
        }

        log.info("[{}] ad {} {} {} 예산 감액 {} -> {}", target.getAdvertiserId(), ad.getAdId(),
                ad.getBudgetEntityLevel(), ad.getBudgetEntityId(), decision.getCurrentBudget(), platformBudget);
        audit(AuditEntry.builder()
                .advertiserId(target.getAdvertiserId())
                .entityType(AuditEntry.EntityType.of(ad.getBudgetEntityLevel()))
                .entityId(ad.getBudgetEntityId())
                .action(AuditEntry.Action.DECREASE_BUDGET)
                .before(budgetPayload(ad, decision.getCurrentBudget()))
                .after(budgetPayload(ad, platformBudget))
                .reason(decision.getReason())
                .build());
        notifySafely(NotificationRequest.builder()
                .advertiserId(target.getAdvertiserId())
                .type(NotificationType.BUDGET_REDUCED)
                .entityType(AuditEntry.EntityType.of(ad.getBudgetEntityLevel()))
                .entityId(ad.getBudgetEntityId())
                .title("Budget reduced: " + ad.getAdName())
                .message(decision.getReason())
                .metadata(Map.of("adId", ad.getAdId(),
                        "previousBudget", decision.getCurrentBudget(),
                        "newBudget", platformBudget))
                .build());
        return decision.toBuilder().reducedBudget(platformBudget).applied(true).build();
    }

    /**
     * override 캡이 증액을 자르거나 막았을 때의 알림.
     */
    public void notifyCapEvent(OptimizationTarget target, ManagedAd ad, CapResolution resolution,
                               BigDecimal currentBudget, BigDecimal proposedBudget, BudgetCapLimit cap) {
        if (!resolution.isOverrideCapEvent()) {
            return;
        }
        boolean reached = resolution.getOutcome() == CapResolution.Outcome.CAP_REACHED;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("adId", ad.getAdId());
        metadata.put("limitingAdId", cap.getLimitingAdId());
        metadata.put("maxDailyBudget", cap.getMaxDailyBudget());
        metadata.put("currentBudget", currentBudget);
        metadata.put("proposedBudget", proposedBudget);
        metadata.put("appliedBudget", resolution.getBudget());

        notifySafely(NotificationRequest.builder()
                .advertiserId(target.getAdvertiserId())
                .type(reached ? NotificationType.BUDGET_CAP_REACHED : NotificationType.BUDGET_CAP_APPLIED)
                .entityType(AuditEntry.EntityType.AD)
                .entityId(ad.getAdId())
                .title((reached ? "Budget cap reached: " : "Budget cap applied: ") + ad.getAdName())
                .message(reached
                        ? String.format("daily budget %s already at cap %s", currentBudget, cap.getMaxDailyBudget())
                        : String.format("increase to %s limited to cap %s", proposedBudget, cap.getMaxDailyBudget()))
                .metadata(metadata)
                .build());
    }

    private void updateBudget(OptimizationTarget target, ManagedAd ad, BigDecimal budget) {
        retryTemplate.execute(context -> {
            mutationClient.updateDailyBudget(target.getAccessToken(), target.getAdvertiserId(),
                    ad.getBudgetEntityLevel(), ad.getBudgetEntityId(), budget);
            return null;
        });
    }

    private void audit(AuditEntry entry) {
        try {
            auditTrail.record(entry);
        } catch (RuntimeException e) {
            log.error("[{}] 변경 이력 기록 실패 ({} {}): {}", entry.getAdvertiserId(), entry.getAction(),
                    entry.getEntityId(), e.getMessage(), e);
        }
    }

    private void notifySafely(NotificationRequest request) {
        try {
            notificationSink.notify(request);
        } catch (RuntimeException e) {
            log.warn("[{}] 알림 저장 실패 ({}): {}", request.getAdvertiserId(), request.getType(), e.getMessage());
        }
    }

    private static Map<String, Object> budgetPayload(ManagedAd ad, BigDecimal budget) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", ad.getBudgetEntityLevel().name());
        payload.put("budget", budget);
        return payload;
    }
}
