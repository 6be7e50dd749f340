package com.claude.budgetoptimizer.batch;

import com.claude.budgetoptimizer.service.AdvertiserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemReader;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;

/**
 * 최적화 대상 광고주 ID 를 하나씩 읽는다. 대상 목록은 step 시작 후 첫 read 에서 한 번 조회한다.
 */
@Component
@StepScope
@Slf4j
public class TargetAdvertiserReader implements ItemReader<String> {

    private final AdvertiserDirectory advertiserDirectory;

    private Iterator<String> advertiserIterator;

    public TargetAdvertiserReader(AdvertiserDirectory advertiserDirectory) {
        this.advertiserDirectory = advertiserDirectory;
    }

    @Override
    public String read() {
        if (advertiserIterator == null) {
            List<String> advertiserIds = advertiserDirectory.findTargetAdvertiserIds();
            log.info("최적화 대상 광고주 {}명", advertiserIds.size());
            advertiserIterator = advertiserIds.iterator();
        }
        return advertiserIterator.hasNext() ? advertiserIterator.next() : null;
    }
}
