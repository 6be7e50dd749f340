package com.claude.budgetoptimizer.support;

import com.claude.budgetoptimizer.domain.OptimizationTarget;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.exception.AdvertiserConfigurationException;
import com.claude.budgetoptimizer.service.AdvertiserDirectory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FakeAdvertiserDirectory implements AdvertiserDirectory {

    public final Map<String, OptimizationTarget> targets = new LinkedHashMap<>();
    public final Map<String, RunStatus> outcomes = new LinkedHashMap<>();
    public final List<String> extraIds = new ArrayList<>();

    @Override
    public OptimizationTarget loadTarget(String advertiserId) {
        OptimizationTarget target = targets.get(advertiserId);
        if (target == null) {
            throw new AdvertiserConfigurationException(AdvertiserConfigurationException.ADVERTISER_NOT_FOUND,
                    "advertiser " + advertiserId + " is not registered");
        }
        return target;
    }

    @Override
    public List<String> findTargetAdvertiserIds() {
        List<String> ids = new ArrayList<>(targets.keySet());
        ids.addAll(extraIds);
        return ids;
    }

    @Override
    public void recordRunOutcome(String advertiserId, RunStatus status, LocalDateTime runAt) {
        outcomes.put(advertiserId, status);
    }
}
