package com.claude.budgetoptimizer.exception;

/**
 * 광고주, 소구(appeal) 설정, 인증 정보가 없어서 run 자체를 시작할 수 없는 경우.
 */
public class AdvertiserConfigurationException extends BudgetOptimizationException {

    public static final String ADVERTISER_NOT_FOUND = "C-02";
    public static final String APPEAL_NOT_LINKED = "O-02";
    public static final String CREDENTIAL_MISSING = "C-01";

    public AdvertiserConfigurationException(String code, String message) {
        super(ErrorCategory.CONFIGURATION, code, message);
    }
}
