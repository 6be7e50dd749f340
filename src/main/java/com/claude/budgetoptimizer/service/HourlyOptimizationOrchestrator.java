package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.client.AdInventoryClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.BudgetAction;
import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.BudgetDecision;
import com.claude.budgetoptimizer.domain.CapResolution;
import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.domain.LockHandle;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.PauseAction;
import com.claude.budgetoptimizer.domain.PauseDecision;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.domain.RunSummary;
import com.claude.budgetoptimizer.domain.SevenDayMetrics;
import com.claude.budgetoptimizer.domain.TodayMetrics;
import com.claude.budgetoptimizer.entity.HourlyOptimizationSnapshot;
import com.claude.budgetoptimizer.exception.BudgetOptimizationException;
import com.claude.budgetoptimizer.exception.DataQualityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 광고주 한 명의 시간 단위 최적화 run
 *
 * 처리 흐름:
 * 1. 운영 시간(01:00 ~ 19:59) 밖이면 아무것도 하지 않는다
 * 2. 광고주 lock 획득 (dry run 은 lock 없이 진행)
 * 3. 활성 광고 조회, 첫 라운드 여부 판정
 * 4. stage 1: 모든 라운드에서 증액 판정. 이후 라운드는 직전 스냅샷보다 전환이 늘어난 광고만 본다
 * 5. stage 2: 첫 라운드에서만 7일 성과로 정지 / 감액 판정
 * 6. 광고별 스냅샷 저장 후 lock 해제
 *
 * 광고 하나의 실패는 그 광고의 판정에만 남고 run 은 계속된다.
 * 광고주 설정 오류나 광고 목록 조회 실패는 그 광고주 run 만 FAILED 로 끝낸다.
 */
@Service
@Slf4j
public class HourlyOptimizationOrchestrator {

    static final String LOCK_PREFIX = "budget-optimization:";
    static final String UNCHANGED_REASON = "no new conversions since last snapshot";

    private final AdvertiserDirectory advertiserDirectory;
    private final AdInventoryClient inventoryClient;
    private final MetricsGateway metricsGateway;
    private final BudgetDecisionEngine decisionEngine;
    private final BudgetCapLookup capLookup;
    private final BudgetCapResolver capResolver;
    private final ExecutionApplier executionApplier;
    private final SnapshotStore snapshotStore;
    private final JobLock jobLock;
    private final OperatingSchedule schedule;
    private final RetryTemplate retryTemplate;
    private final Duration lockTimeout;
    private final Clock clock;

    public HourlyOptimizationOrchestrator(AdvertiserDirectory advertiserDirectory,
                                          AdInventoryClient inventoryClient,
                                          MetricsGateway metricsGateway,
                                          BudgetDecisionEngine decisionEngine,
                                          BudgetCapLookup capLookup,
                                          BudgetCapResolver capResolver,
                                          ExecutionApplier executionApplier,
                                          SnapshotStore snapshotStore,
                                          JobLock jobLock,
                                          OperatingSchedule schedule,
                                          RetryTemplate optimizationRetryTemplate,
                                          BudgetOptimizationProperties properties,
                                          Clock clock) {
        this.advertiserDirectory = advertiserDirectory;
        this.inventoryClient = inventoryClient;
        this.metricsGateway = metricsGateway;
        this.decisionEngine = decisionEngine;
        this.capLookup = capLookup;
        this.capResolver = capResolver;
        this.executionApplier = executionApplier;
        this.snapshotStore = snapshotStore;
        this.jobLock = jobLock;
        this.schedule = schedule;
        this.retryTemplate = optimizationRetryTemplate;
        this.lockTimeout = properties.getLock().getTimeout();
        this.clock = clock;
    }

    public HourlyRunResult execute(String advertiserId, boolean dryRun) {
        LocalDateTime executionTime = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        if (!schedule.isWithinWindow(executionTime)) {
            log.info("[{}] 운영 시간 외 ({}), run 생략", advertiserId, executionTime.toLocalTime());
            return HourlyRunResult.of(advertiserId, executionTime, dryRun, RunStatus.OUTSIDE_WINDOW,
                    "outside operating window");
        }

        Optional<LockHandle> lock = Optional.empty();
        if (!dryRun) {
            lock = jobLock.tryAcquire(LOCK_PREFIX + advertiserId, lockTimeout);
            if (lock.isEmpty()) {
                log.info("[{}] 다른 run 이 진행 중, 이번 tick 생략", advertiserId);
                return HourlyRunResult.of(advertiserId, executionTime, dryRun, RunStatus.LOCKED,
                        "another run holds the lock");
            }
        }

        try {
            return run(advertiserId, executionTime, dryRun);
        } catch (BudgetOptimizationException e) {
            log.error("[{}] run 중단: {}", advertiserId, e.toReason(), e);
            return HourlyRunResult.of(advertiserId, executionTime, dryRun, RunStatus.FAILED, e.toReason());
        } finally {
            lock.ifPresent(this::releaseLock);
        }
    }

    private HourlyRunResult run(String advertiserId, LocalDateTime executionTime, boolean dryRun) {
        OptimizationTarget target = advertiserDirectory.loadTarget(advertiserId);
        LocalDate today = executionTime.toLocalDate();

        List<ManagedAd> ads = retryTemplate.execute(context ->
                inventoryClient.fetchAds(target.getAccessToken(), advertiserId)).stream()
                .filter(ManagedAd::isActive)
                .collect(Collectors.toList());
        if (ads.isEmpty()) {
            log.info("[{}] 활성 광고 없음", advertiserId);
            return HourlyRunResult.of(advertiserId, executionTime, dryRun, RunStatus.NO_ACTIVE_ADS, "no active ads");
        }

        boolean firstRound = !snapshotStore.existsSince(advertiserId, schedule.firstRoundSlotStart(today));
        Map<String, HourlyOptimizationSnapshot> previous = firstRound
                ? Map.of()
                : snapshotStore.latestBefore(advertiserId, today.atStartOfDay(), executionTime);
        log.info("[{}] run 시작: {} 광고 {}개, {}{}", advertiserId, executionTime, ads.size(),
                firstRound ? "첫 라운드" : "이후 라운드", dryRun ? " (dry run)" : "");

        RunContext context = new RunContext(target, today, dryRun);

        // stage 1
        List<BudgetDecision> budgetDecisions = new ArrayList<>();
        int unchanged = 0;
        for (ManagedAd ad : ads) {
            Optional<BudgetDecision> decision = evaluateIncrease(context, ad, firstRound, previous);
            if (decision.isPresent()) {
                budgetDecisions.add(decision.get());
            } else {
                unchanged++;
            }
        }

        // stage 2
        List<PauseDecision> pauseDecisions = new ArrayList<>();
        if (firstRound) {
            for (ManagedAd ad : ads) {
                pauseDecisions.add(evaluatePause(context, ad));
            }
        }

        String message = null;
        if (!dryRun) {
            message = persistSnapshots(context, ads, budgetDecisions, previous, executionTime);
        }

        RunSummary summary = RunSummary.of(ads.size(), unchanged, budgetDecisions, pauseDecisions);
        log.info("[{}] run 완료: 증액 {}, 유지 {}, 건너뜀 {}, 정지 {}, 감액 {}, 실패 {}", advertiserId,
                summary.getIncreased(), summary.getContinued(), summary.getSkipped(),
                summary.getPaused(), summary.getBudgetReduced(), summary.getFailed());

        return HourlyRunResult.builder()
                .advertiserId(advertiserId)
                .executionTime(executionTime)
                .status(RunStatus.COMPLETED)
                .dryRun(dryRun)
                .firstRound(firstRound)
                .budgetDecisions(budgetDecisions)
                .pauseDecisions(pauseDecisions)
                .summary(summary)
                .message(message)
                .build();
    }

    /**
     * @return 이후 라운드에서 전환이 늘지 않은 광고는 empty
     */
    private Optional<BudgetDecision> evaluateIncrease(RunContext context, ManagedAd ad, boolean firstRound,
                                                      Map<String, HourlyOptimizationSnapshot> previous) {
        OptimizationTarget target = context.target;
        try {
            TodayMetrics today = metricsGateway.fetchToday(target, ad, context.today);
            context.observed.put(ad.getAdId(), today);

            if (firstRound) {
                if (today.getConversions() < 1) {
                    return Optional.of(BudgetDecision.skip(ad, "no conversions today").toBuilder()
                            .todaySpend(today.getSpend())
                            .todayConversions(0)
                            .build());
                }
            } else {
                int previousCount = previousConversionCount(previous, ad.getAdId());
                if (today.getConversions() <= previousCount) {
                    log.debug("[{}] ad {} 전환 변화 없음 ({} -> {})", target.getAdvertiserId(), ad.getAdId(),
                            previousCount, today.getConversions());
                    return Optional.empty();
                }
            }

            BigDecimal currentBudget = context.effectiveBudget(ad);
            BudgetDecision decision = decisionEngine.evaluateIncrease(ad, currentBudget, today, target.getTargetCpa());
            log.debug("[{}] ad {} 증액 판정 {}: {}", target.getAdvertiserId(), ad.getAdId(), decision.getAction(), decision.getReason());
            if (decision.getAction() != BudgetAction.INCREASE) {
                return Optional.of(decision);
            }
            if (context.increasedEntities.contains(ad.getBudgetEntityKey())) {
                return Optional.of(decision.toContinue("shared budget already increased this run"));
            }

            Optional<BudgetCapLimit> cap = capLookup.findEffectiveCap(ad, context.today);
            CapResolution resolution = capResolver.resolve(currentBudget, decision.getNewBudget(), cap);
            if (!context.dryRun && cap.isPresent()) {
                executionApplier.notifyCapEvent(target, ad, resolution, currentBudget, decision.getNewBudget(), cap.get());
            }
            decision = applyCapResolution(decision, resolution);
            if (decision.getAction() != BudgetAction.INCREASE) {
                return Optional.of(decision);
            }

            if (!context.dryRun) {
                decision = executionApplier.applyIncrease(target, ad, decision);
            }
            if (!decision.isFailed()) {
                context.recordBudget(ad, decision.getNewBudget());
                context.increasedEntities.add(ad.getBudgetEntityKey());
            }
            return Optional.of(decision);
        } catch (DataQualityException e) {
            log.warn("[{}] ad {} 증액 판정 생략: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason());
            return Optional.of(BudgetDecision.skip(ad, e.toReason()));
        } catch (BudgetOptimizationException e) {
            log.error("[{}] ad {} 증액 판정 실패: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason(), e);
            return Optional.of(BudgetDecision.skip(ad, e.toReason()).markFailed(e.toReason()));
        }
    }

    private BudgetDecision applyCapResolution(BudgetDecision decision, CapResolution resolution) {
        String limit = BudgetDecisionEngine.yen(resolution.getLimit());
        switch (resolution.getOutcome()) {
            case CAP_REACHED:
                return decision.toContinue("budget cap " + limit + " reached: no change");
            case CEILING_REACHED:
                return decision.toContinue("budget ceiling " + limit + " reached: no change");
            case CAP_APPLIED:
                return decision.toBuilder()
                        .newBudget(resolution.getBudget())
                        .reason(decision.getReason() + "; limited by budget cap " + limit)
                        .build();
            case CLAMPED_TO_CEILING:
                return decision.toBuilder()
                        .newBudget(resolution.getBudget())
                        .reason(decision.getReason() + "; limited by ceiling " + limit)
                        .build();
            default:
                return decision;
        }
    }

    private PauseDecision evaluatePause(RunContext context, ManagedAd ad) {
        OptimizationTarget target = context.target;
        try {
            SevenDayMetrics metrics = metricsGateway.fetchSevenDay(target, ad, context.today);
            PauseDecision decision = decisionEngine.evaluatePause(ad, target, metrics, context.effectiveBudget(ad));
            log.debug("[{}] ad {} 정지 판정 {}: {}", target.getAdvertiserId(), ad.getAdId(), decision.getAction(), decision.getReason());
            if (context.dryRun) {
                return decision;
            }
            if (decision.getAction() == PauseAction.PAUSE) {
                return executionApplier.applyPause(target, ad, decision);
            }
            if (decision.getAction() == PauseAction.REDUCE_BUDGET) {
                PauseDecision applied = executionApplier.applyReduction(target, ad, decision);
                if (!applied.isFailed()) {
                    context.recordBudget(ad, applied.getReducedBudget());
                }
                return applied;
            }
            return decision;
        } catch (DataQualityException e) {
            log.warn("[{}] ad {} 정지 판정 생략: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason());
            return PauseDecision.skip(ad, PauseAction.SKIP_NEW_CREATIVE, e.toReason());
        } catch (BudgetOptimizationException e) {
            log.error("[{}] ad {} 정지 판정 실패: {}", target.getAdvertiserId(), ad.getAdId(), e.toReason(), e);
            return PauseDecision.skip(ad, PauseAction.CONTINUE, e.toReason()).markFailed(e.toReason());
        }
    }

    /**
     * 관측하지 못한 광고는 직전 전환 수를 그대로 남겨 다음 라운드의 비교 기준이 어긋나지 않게 한다.
     *
     * @return 저장 실패 시 run 결과에 남길 메시지
     */
    private String persistSnapshots(RunContext context, List<ManagedAd> ads, List<BudgetDecision> budgetDecisions,
                                    Map<String, HourlyOptimizationSnapshot> previous, LocalDateTime executionTime) {
        Map<String, BudgetDecision> decisionByAd = new HashMap<>();
        budgetDecisions.forEach(d -> decisionByAd.put(d.getAdId(), d));
        LocalDateTime createdAt = LocalDateTime.now(clock);

        List<HourlyOptimizationSnapshot> batch = new ArrayList<>(ads.size());
        for (ManagedAd ad : ads) {
            TodayMetrics observed = context.observed.get(ad.getAdId());
            BudgetDecision decision = decisionByAd.get(ad.getAdId());
            int conversions = observed != null
                    ? observed.getConversions()
                    : previousConversionCount(previous, ad.getAdId());

            batch.add(HourlyOptimizationSnapshot.builder()
                    .advertiserId(context.target.getAdvertiserId())
                    .adId(ad.getAdId())
                    .adName(ad.getAdName())
                    .executionTime(executionTime)
                    .todayConversionCount(conversions)
                    .todaySpend(observed == null ? null : observed.getSpend())
                    .todayCpa(observed == null ? null : observed.getCpa())
                    .dailyBudget(ad.getDailyBudget())
                    .action(decision == null ? BudgetAction.SKIP.name() : decision.getAction().name())
                    .reason(decision == null ? UNCHANGED_REASON : decision.getReason())
                    .newBudget(decision != null && decision.isApplied() ? decision.getNewBudget() : null)
                    .createdAt(createdAt)
                    .build());
        }

        try {
            snapshotStore.append(batch);
            return null;
        } catch (DataAccessException e) {
            log.error("[{}] snapshot 저장 실패, 다음 라운드 비교 기준이 없음", context.target.getAdvertiserId(), e);
            return "snapshot persistence failed: " + e.getMostSpecificCause().getMessage();
        }
    }

    private void releaseLock(LockHandle handle) {
        try {
            jobLock.release(handle);
        } catch (DataAccessException e) {
            log.error("lock {} 해제 실패, {} 에 만료됨", handle.getLockKey(), handle.getExpiresAt(), e);
        }
    }

    private static int previousConversionCount(Map<String, HourlyOptimizationSnapshot> previous, String adId) {
        HourlyOptimizationSnapshot snapshot = previous.get(adId);
        return snapshot == null ? 0 : snapshot.getTodayConversionCount();
    }

    /**
     * run 하나의 가변 상태. 같은 예산 엔티티를 공유하는 광고들이 변경 후 예산을 보도록 한다.
     */
    private static final class RunContext {
        private final OptimizationTarget target;
        private final LocalDate today;
        private final boolean dryRun;
        private final Map<String, TodayMetrics> observed = new HashMap<>();
        private final Map<String, BigDecimal> budgets = new HashMap<>();
        private final Set<String> increasedEntities = new HashSet<>();

        private RunContext(OptimizationTarget target, LocalDate today, boolean dryRun) {
            this.target = target;
            this.today = today;
            this.dryRun = dryRun;
        }

        private BigDecimal effectiveBudget(ManagedAd ad) {
            return budgets.getOrDefault(ad.getBudgetEntityKey(), ad.getDailyBudget());
        }

        private void recordBudget(ManagedAd ad, BigDecimal budget) {
            budgets.put(ad.getBudgetEntityKey(), budget);
        }
    }
}
