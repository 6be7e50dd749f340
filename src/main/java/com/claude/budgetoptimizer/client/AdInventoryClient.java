package com.claude.budgetoptimizer.client;

import com.claude.budgetoptimizer.domain.ManagedAd;

import java.util.List;

public interface AdInventoryClient {

    /**
     * 광고주의 광고 목록. 광고마다 예산 엔티티(광고그룹 / CBO 캠페인)의 현재 일예산이 채워진다.
     */
    List<ManagedAd> fetchAds(String accessToken, String advertiserId);
}
