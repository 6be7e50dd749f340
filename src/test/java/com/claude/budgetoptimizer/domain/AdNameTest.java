package com.claude.budgetoptimizer.domain;

import com.claude.budgetoptimizer.exception.DataQualityException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdNameTest {

    @Test
    void parsesFourSegments() {
        AdName name = AdName.parse("20240501/tanaka/video_a/lp1");

        assertEquals("20240501", name.getLaunchDate());
        assertEquals("tanaka", name.getCreator());
        assertEquals("video_a", name.getCreativeName());
        assertEquals("lp1", name.getLandingPageName());
    }

    @Test
    void creativeNameKeepsInnerSlashes() {
        AdName name = AdName.parse("20240501/tanaka/video/a/b/lp2");

        assertEquals("video/a/b", name.getCreativeName());
        assertEquals("lp2", name.getLandingPageName());
    }

    @Test
    void buildsLedgerPaths() {
        AdName name = AdName.parse("20240501/tanaka/video_a/lp1");

        assertEquals("TikTok広告-SNS-lp1", name.registrationPath("TikTok広告", "SNS"));
        assertEquals("TikTok広告-SNS-lp1-video_a", name.reservationPath("TikTok広告", "SNS"));
    }

    @Test
    void rejectsMalformedNames() {
        assertEquals(DataQualityException.AD_NAME_UNPARSEABLE,
                assertThrows(DataQualityException.class, () -> AdName.parse("a/b/c")).getCode());
        assertThrows(DataQualityException.class, () -> AdName.parse(" "));
        assertThrows(DataQualityException.class, () -> AdName.parse(null));
        assertThrows(DataQualityException.class, () -> AdName.parse("20240501/tanaka/video_a/"));
    }
}
