package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.dto.BudgetCapRequest;
import com.claude.budgetoptimizer.entity.AdBudgetCap;
import com.claude.budgetoptimizer.repository.AdBudgetCapRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 광고별 일예산 상한 관리
 *
 * 캡은 광고 단위로 등록하지만 예산은 광고그룹 / CBO 캠페인에 걸리므로
 * 조회는 예산 풀 단위로 한 번의 쿼리로 끝난다. 풀 ID 없이 광고 ID 로만 등록된 캡은
 * 그 광고 자신에게만 적용된다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetCapService implements BudgetCapLookup {

    private final AdBudgetCapRepository capRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<BudgetCapLimit> findEffectiveCap(ManagedAd ad, LocalDate date) {
        List<AdBudgetCap> caps = ad.isPooledBudget()
                ? capRepository.findActiveByCampaign(ad.getAdId(), ad.getCampaignId(), date)
                : capRepository.findActiveByAdgroup(ad.getAdId(), ad.getAdgroupId(), date);
        return caps.stream()
                .findFirst()
                .map(cap -> new BudgetCapLimit(cap.getMaxDailyBudget(), cap.getAdId()));
    }

    @Transactional(readOnly = true)
    public List<AdBudgetCap> findByAdvertiser(String advertiserId) {
        return capRepository.findByAdvertiserIdOrderByAdIdAsc(advertiserId);
    }

    /**
     * 광고 ID 기준 upsert
     */
    @Transactional
    public AdBudgetCap upsert(BudgetCapRequest request) {
        AdBudgetCap cap = capRepository.findByAdId(request.getAdId()).orElseGet(AdBudgetCap::new);
        boolean created = cap.getId() == null;
        apply(cap, request);
        AdBudgetCap saved = capRepository.save(cap);
        log.info("[{}] 예산 캡 {}: ad {} max {}", saved.getAdvertiserId(), created ? "등록" : "갱신",
                saved.getAdId(), saved.getMaxDailyBudget());
        return saved;
    }

    @Transactional
    public AdBudgetCap update(Long id, BudgetCapRequest request) {
        AdBudgetCap cap = capRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("budget cap not found: " + id));
        apply(cap, request);
        return capRepository.save(cap);
    }

    @Transactional
    public void delete(Long id) {
        if (!capRepository.existsById(id)) {
            throw new NoSuchElementException("budget cap not found: " + id);
        }
        capRepository.deleteById(id);
        log.info("예산 캡 삭제: {}", id);
    }

    private void apply(AdBudgetCap cap, BudgetCapRequest request) {
        if (request.getStartDate() != null && request.getEndDate() != null
                && request.getEndDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        cap.setAdvertiserId(request.getAdvertiserId());
        cap.setAdId(request.getAdId());
        cap.setAdgroupId(request.getAdgroupId());
        cap.setCampaignId(request.getCampaignId());
        cap.setMaxDailyBudget(request.getMaxDailyBudget());
        cap.setEnabled(request.getEnabled() == null || request.getEnabled());
        cap.setStartDate(request.getStartDate());
        cap.setEndDate(request.getEndDate());
    }
}
