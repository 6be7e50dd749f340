package com.claude.budgetoptimizer.domain;

import com.claude.budgetoptimizer.exception.DataQualityException;
import lombok.Value;

import java.util.Arrays;

/**
 * 광고명 규칙 {@code 출고일/제작자/크리에이티브명/LP명} 을 분해한 값.
 *
 * 크리에이티브명에 '/' 가 들어갈 수 있으므로 첫 두 구간과 마지막 구간을 제외한
 * 나머지를 모두 크리에이티브명으로 본다.
 */
@Value
public class AdName {

    private static final int MIN_SEGMENTS = 4;

    String launchDate;
    String creator;
    String creativeName;
    String landingPageName;

    public static AdName parse(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new DataQualityException(DataQualityException.AD_NAME_UNPARSEABLE, "ad name is empty");
        }
        String[] parts = rawName.split("/", -1);
        if (parts.length < MIN_SEGMENTS) {
            throw new DataQualityException(DataQualityException.AD_NAME_UNPARSEABLE,
                    "ad name '" + rawName + "' has " + parts.length + " segments, expected at least " + MIN_SEGMENTS);
        }
        String creative = String.join("/", Arrays.copyOfRange(parts, 2, parts.length - 1));
        String landingPage = parts[parts.length - 1];
        if (landingPage.isBlank()) {
            throw new DataQualityException(DataQualityException.AD_NAME_UNPARSEABLE,
                    "ad name '" + rawName + "' has an empty landing page segment");
        }
        return new AdName(parts[0], parts[1], creative, landingPage);
    }

    /**
     * 등록 경로 {@code prefix-appeal-LP}. 전환 장부와 프론트 판매 장부의 매칭 키.
     */
    public String registrationPath(String prefix, String appealName) {
        return prefix + "-" + appealName + "-" + landingPageName;
    }

    /**
     * 개별 예약 장부의 매칭 키 {@code prefix-appeal-LP-creative}.
     */
    public String reservationPath(String prefix, String appealName) {
        return prefix + "-" + appealName + "-" + landingPageName + "-" + creativeName;
    }
}
