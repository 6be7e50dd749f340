package com.claude.budgetoptimizer.domain;

import lombok.Value;

/**
 * 장부 시트에서 경로 컬럼과 일시 컬럼의 위치.
 *
 * 헤더 별칭으로 찾지 못해 기본 위치를 쓴 경우 {@code confident} 가 false 이고
 * {@code warning} 에 이유가 남는다. 진행 여부는 호출자가 정한다.
 */
@Value
public class ColumnSchema {

    public static final int DEFAULT_PATH_COLUMN = 4;
    public static final int DEFAULT_DATE_COLUMN = 5;

    int pathColumn;
    int dateColumn;
    boolean confident;
    String warning;

    public static ColumnSchema detected(int pathColumn, int dateColumn) {
        return new ColumnSchema(pathColumn, dateColumn, true, null);
    }

    public static ColumnSchema fixed(int pathColumn, int dateColumn) {
        return new ColumnSchema(pathColumn, dateColumn, true, null);
    }

    public static ColumnSchema fallback(String warning) {
        return new ColumnSchema(DEFAULT_PATH_COLUMN, DEFAULT_DATE_COLUMN, false, warning);
    }
}
