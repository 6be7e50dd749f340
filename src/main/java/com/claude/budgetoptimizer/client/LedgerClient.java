package com.claude.budgetoptimizer.client;

import com.claude.budgetoptimizer.domain.ColumnSchema;

import java.time.LocalDate;

/**
 * 전환 / 프론트 판매 / 개별 예약 장부에서 경로와 기간으로 행 수를 센다.
 */
public interface LedgerClient {

    /**
     * 헤더로 컬럼 위치를 찾아서 센다.
     *
     * @param sheetLocator 스프레드시트 URL 또는 ID
     */
    int countMatchingRows(String sheetLocator, String sheetName, String path, LocalDate from, LocalDate to);

    /**
     * 컬럼 위치가 고정된 장부용.
     */
    int countMatchingRows(String sheetLocator, String sheetName, String path, LocalDate from, LocalDate to,
                          ColumnSchema fixedSchema);

    ColumnSchema resolveSchema(String sheetLocator, String sheetName);

    void invalidate();
}
