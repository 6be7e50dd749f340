package com.claude.budgetoptimizer.batch;

import com.claude.budgetoptimizer.domain.HourlyRunResult;
import com.claude.budgetoptimizer.domain.RunStatus;
import com.claude.budgetoptimizer.service.AdvertiserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.stereotype.Component;

/**
 * run 결과를 광고주 행에 기록한다. 운영 시간 외 결과는 run 이 아니므로 남기지 않는다.
 */
@Component
@StepScope
@Slf4j
public class RunResultWriter implements ItemWriter<HourlyRunResult> {

    private final AdvertiserDirectory advertiserDirectory;

    public RunResultWriter(AdvertiserDirectory advertiserDirectory) {
        this.advertiserDirectory = advertiserDirectory;
    }

    @Override
    public void write(Chunk<? extends HourlyRunResult> chunk) {
        for (HourlyRunResult result : chunk.getItems()) {
            if (result.getStatus() == RunStatus.OUTSIDE_WINDOW) {
                continue;
            }
            advertiserDirectory.recordRunOutcome(result.getAdvertiserId(), result.getStatus(), result.getExecutionTime());
            log.info("[{}] run 결과 {}: processed {}, failed {}", result.getAdvertiserId(), result.getStatus(),
                    result.getSummary().getProcessed(), result.getSummary().getFailed());
        }
    }
}
