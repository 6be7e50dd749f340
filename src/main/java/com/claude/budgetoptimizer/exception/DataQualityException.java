package com.claude.budgetoptimizer.exception;

public class DataQualityException extends BudgetOptimizationException {

    public static final String AD_NAME_UNPARSEABLE = "O-01";
    public static final String TARGET_MISSING = "O-02";
    public static final String COLUMN_NOT_DETECTED = "G-07";
    public static final String INVALID_SPREADSHEET = "G-08";
    public static final String PLATFORM_REJECTED_QUERY = "T-04";

    public DataQualityException(String code, String message) {
        super(ErrorCategory.DATA_QUALITY, code, message);
    }

    public DataQualityException(String code, String message, Throwable cause) {
        super(ErrorCategory.DATA_QUALITY, code, message, cause);
    }
}
