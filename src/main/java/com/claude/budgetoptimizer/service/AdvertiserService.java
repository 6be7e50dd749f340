package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.FunnelCategory;
import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.entity.Advertiser;
import com.claude.budgetoptimizer.entity.AppealProfile;
import com.claude.budgetoptimizer.exception.AdvertiserConfigurationException;
import com.claude.budgetoptimizer.repository.AdvertiserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 광고주 조회와 run 기록
 *
 * 광고주 행과 소구 프로필을 묶어 run 에서 쓰는 {@link OptimizationTarget} 으로 만든다.
 */
@Service
@Slf4j
public class AdvertiserService implements AdvertiserDirectory {

    private final AdvertiserRepository advertiserRepository;
    private final String defaultAccessToken;

    public AdvertiserService(AdvertiserRepository advertiserRepository, BudgetOptimizationProperties properties) {
        this.advertiserRepository = advertiserRepository;
        this.defaultAccessToken = properties.getPlatform().getDefaultAccessToken();
    }

    @Override
    @Transactional(readOnly = true)
    public OptimizationTarget loadTarget(String advertiserId) {
        Advertiser advertiser = advertiserRepository.findByAdvertiserId(advertiserId)
                .orElseThrow(() -> new AdvertiserConfigurationException(
                        AdvertiserConfigurationException.ADVERTISER_NOT_FOUND, "advertiser not found: " + advertiserId));

        AppealProfile appeal = advertiser.getAppeal();
        if (appeal == null) {
            throw new AdvertiserConfigurationException(AdvertiserConfigurationException.APPEAL_NOT_LINKED,
                    "advertiser " + advertiserId + " has no appeal profile");
        }

        String accessToken = advertiser.getAccessToken();
        if (accessToken == null || accessToken.isBlank()) {
            accessToken = defaultAccessToken;
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new AdvertiserConfigurationException(AdvertiserConfigurationException.CREDENTIAL_MISSING,
                    "no access token for advertiser " + advertiserId);
        }

        return OptimizationTarget.builder()
                .advertiserId(advertiserId)
                .accessToken(accessToken)
                .appealName(appeal.getName())
                .funnelCategory(FunnelCategory.detect(appeal.getName()))
                .targetCpa(appeal.getTargetCpa())
                .allowableCpa(appeal.getAllowableCpa())
                .targetFrontCpo(appeal.getTargetFrontCpo())
                .allowableFrontCpo(appeal.getAllowableFrontCpo())
                .allowableReservationCpo(appeal.getAllowableReservationCpo())
                .conversionLedger(appeal.getConversionLedger())
                .frontSalesLedger(appeal.getFrontSalesLedger())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findTargetAdvertiserIds() {
        return advertiserRepository.findOptimizationTargets().stream()
                .map(Advertiser::getAdvertiserId)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void recordRunOutcome(String advertiserId, RunStatus status, LocalDateTime runAt) {
        advertiserRepository.findByAdvertiserId(advertiserId).ifPresentOrElse(
            advertiser -> {
                advertiser.recordRun(status, runAt);
                advertiserRepository.save(advertiser);
                if (status == RunStatus.FAILED) {
                    log.warn("[{}] run 실패 기록 (연속 {}회)", advertiserId, advertiser.getFailureCount());
                }
            },
            () -> log.warn("[{}] run 기록 대상 광고주 없음", advertiserId)
        );
    }
}
