package com.claude.budgetoptimizer.domain;

/**
 * 소구(appeal) 이름으로 판정하는 퍼널 분류.
 *
 * SNS, AI 는 유료 프론트 상품이 있어서 pause 판정에 front CPO 를 사용하고,
 * SEMINAR 는 리드 획득만 보는 퍼널이다.
 */
public enum FunnelCategory {
    SNS(true),
    AI(true),
    SEMINAR(false);

    private final boolean paidFrontOffer;

    FunnelCategory(boolean paidFrontOffer) {
        this.paidFrontOffer = paidFrontOffer;
    }

    public boolean hasPaidFrontOffer() {
        return paidFrontOffer;
    }

    // SNS 를 먼저 본다. "SNS AI講座" 같은 이름은 SNS 로 분류된다.
    public static FunnelCategory detect(String appealName) {
        if (appealName == null) {
            return SEMINAR;
        }
        if (appealName.contains("SNS")) {
            return SNS;
        }
        if (appealName.contains("AI")) {
            return AI;
        }
        return SEMINAR;
    }
}
