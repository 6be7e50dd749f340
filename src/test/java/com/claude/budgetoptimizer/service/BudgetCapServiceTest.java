package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.domain.BudgetCapLimit;
import com.claude.budgetoptimizer.domain.DeliveryStatus;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.dto.BudgetCapRequest;
import com.claude.budgetoptimizer.entity.AdBudgetCap;
import com.claude.budgetoptimizer.repository.AdBudgetCapRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class BudgetCapServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    @Autowired
    private AdBudgetCapRepository capRepository;

    private BudgetCapService capService;

    @BeforeEach
    void setUp() {
        capService = new BudgetCapService(capRepository);
    }

    @Test
    void smallestActiveCapInAdgroupWins() {
        capService.upsert(request("ad-1", "ag-1", "cp-1", 12000));
        capService.upsert(request("ad-2", "ag-1", "cp-1", 9000));
        capService.upsert(request("ad-3", "ag-2", "cp-1", 3000));

        Optional<BudgetCapLimit> cap = capService.findEffectiveCap(ad("ad-1", "ag-1", false), TODAY);

        assertTrue(cap.isPresent());
        assertEquals(0, new BigDecimal("9000").compareTo(cap.get().getMaxDailyBudget()));
        assertEquals("ad-2", cap.get().getLimitingAdId());
    }

    @Test
    void pooledBudgetLooksUpWholeCampaign() {
        capService.upsert(request("ad-1", "ag-1", "cp-1", 12000));
        capService.upsert(request("ad-3", "ag-2", "cp-1", 3000));

        BudgetCapLimit cap = capService.findEffectiveCap(ad("ad-1", "ag-1", true), TODAY).orElseThrow();

        assertEquals("ad-3", cap.getLimitingAdId());
    }

    @Test
    void capRegisteredOnlyByAdIdAppliesToThatAd() {
        capService.upsert(request("ad-1", null, null, 6000));

        BudgetCapLimit adgroupCap = capService.findEffectiveCap(ad("ad-1", "ag-1", false), TODAY).orElseThrow();
        assertEquals(0, new BigDecimal("6000").compareTo(adgroupCap.getMaxDailyBudget()));
        assertEquals("ad-1", adgroupCap.getLimitingAdId());

        assertTrue(capService.findEffectiveCap(ad("ad-1", "ag-1", true), TODAY).isPresent());
        assertTrue(capService.findEffectiveCap(ad("ad-2", "ag-1", false), TODAY).isEmpty());
    }

    @Test
    void disabledAndOutOfRangeCapsAreIgnored() {
        BudgetCapRequest disabled = request("ad-1", "ag-1", "cp-1", 3000);
        disabled.setEnabled(false);
        capService.upsert(disabled);
        BudgetCapRequest expired = request("ad-2", "ag-1", "cp-1", 4000);
        expired.setEndDate(TODAY.minusDays(1));
        capService.upsert(expired);
        BudgetCapRequest future = request("ad-3", "ag-1", "cp-1", 5000);
        future.setStartDate(TODAY.plusDays(1));
        capService.upsert(future);

        assertTrue(capService.findEffectiveCap(ad("ad-1", "ag-1", false), TODAY).isEmpty());
    }

    @Test
    void upsertUpdatesExistingCapForSameAd() {
        AdBudgetCap first = capService.upsert(request("ad-1", "ag-1", "cp-1", 12000));
        AdBudgetCap second = capService.upsert(request("ad-1", "ag-1", "cp-1", 8000));

        assertEquals(first.getId(), second.getId());
        assertEquals(1, capService.findByAdvertiser("adv-1").size());
        assertEquals(0, new BigDecimal("8000").compareTo(capService.findByAdvertiser("adv-1").get(0).getMaxDailyBudget()));
    }

    @Test
    void invalidDateRangeIsRejected() {
        BudgetCapRequest request = request("ad-1", "ag-1", "cp-1", 12000);
        request.setStartDate(TODAY);
        request.setEndDate(TODAY.minusDays(1));

        assertThrows(IllegalArgumentException.class, () -> capService.upsert(request));
    }

    @Test
    void updateAndDeleteRequireExistingCap() {
        assertThrows(NoSuchElementException.class, () -> capService.update(999L, request("ad-1", "ag-1", "cp-1", 1)));
        assertThrows(NoSuchElementException.class, () -> capService.delete(999L));

        AdBudgetCap cap = capService.upsert(request("ad-1", "ag-1", "cp-1", 12000));
        capService.delete(cap.getId());
        assertTrue(capService.findByAdvertiser("adv-1").isEmpty());
    }

    static BudgetCapRequest request(String adId, String adgroupId, String campaignId, long maxDailyBudget) {
        BudgetCapRequest request = new BudgetCapRequest();
        request.setAdvertiserId("adv-1");
        request.setAdId(adId);
        request.setAdgroupId(adgroupId);
        request.setCampaignId(campaignId);
        request.setMaxDailyBudget(BigDecimal.valueOf(maxDailyBudget));
        return request;
    }

    private static ManagedAd ad(String adId, String adgroupId, boolean pooled) {
        return ManagedAd.builder()
                .adId(adId)
                .adName("20240501/tanaka/video_a/lp1")
                .advertiserId("adv-1")
                .adgroupId(adgroupId)
                .campaignId("cp-1")
                .deliveryStatus(DeliveryStatus.ENABLE)
                .pooledBudget(pooled)
                .dailyBudget(new BigDecimal("5000"))
                .build();
    }
}
