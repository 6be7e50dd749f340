package com.claude.budgetoptimizer.client;

import java.util.List;

/**
 * 스프레드시트 값 조회. 첫 행은 헤더이며 빈 셀은 빈 문자열 또는 짧은 행으로 온다.
 */
public interface SheetValuesClient {

    List<List<String>> fetchValues(String spreadsheetId, String sheetName, String range);
}
