package com.claude.budgetoptimizer.exception;

/**
 * 실패 분류. 재시도 여부와 run summary 집계 방식이 이 값으로 결정된다.
 */
public enum ErrorCategory {
    DATA_QUALITY,       // 재시도 없음, SKIP 으로 강등
    TRANSIENT,          // RetryTemplate 재시도 대상
    CONCURRENCY,
    PLATFORM_MUTATION,  // 해당 광고만 실패 처리
    CONFIGURATION       // 해당 광고주 run 전체 중단
}
