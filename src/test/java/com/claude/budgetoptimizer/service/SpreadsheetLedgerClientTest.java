package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.client.SheetValuesClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.ColumnSchema;
import com.claude.budgetoptimizer.exception.DataQualityException;
import com.claude.budgetoptimizer.exception.TransientInfrastructureException;
import com.claude.budgetoptimizer.support.MutableClock;
import com.claude.budgetoptimizer.support.TestRetryTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpreadsheetLedgerClientTest {

    private static final String SHEET_ID = "1AbCdEfGhIjKlMnOpQrStUvWxYz0123456789";
    private static final String SHEET_URL = "https://docs.google.com/spreadsheets/d/" + SHEET_ID + "/edit#gid=0";
    private static final String PATH = "TikTok広告-SNS-lp1";
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private FakeSheetValuesClient sheets;
    private BudgetOptimizationProperties properties;
    private SpreadsheetLedgerClient ledger;

    @BeforeEach
    void setUp() {
        sheets = new FakeSheetValuesClient();
        properties = new BudgetOptimizationProperties();
        ledger = newLedger();
    }

    private SpreadsheetLedgerClient newLedger() {
        return new SpreadsheetLedgerClient(sheets, TestRetryTemplates.noBackoff(3), properties,
                MutableClock.at(LocalDateTime.of(2024, 5, 10, 12, 0)));
    }

    @Test
    void countsRowsByExactPathAndInclusiveDateRange() {
        sheets.rows = List.of(
                List.of("名前", "登録経路", "登録日時"),
                List.of("a", PATH, "2024/05/04 09:00"),
                List.of("b", PATH, "2024-05-10"),
                List.of("c", PATH, "2024/05/03"),
                List.of("d", PATH + "-x", "2024/05/08"),
                List.of("e", " " + PATH + " ", "2024/5/9"));

        assertEquals(3, ledger.countMatchingRows(SHEET_URL, "TT_オプト", PATH, TODAY.minusDays(6), TODAY));
    }

    @Test
    void sheetIsFetchedOncePerCacheWindow() {
        sheets.rows = List.of(List.of("登録経路", "登録日"), List.of(PATH, "2024/05/10"));

        ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY);
        ledger.countMatchingRows(SHEET_ID, "TT_オプト", "other", TODAY, TODAY);
        assertEquals(1, sheets.calls);

        ledger.invalidate();
        ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY);
        assertEquals(2, sheets.calls);
    }

    @Test
    void transientFetchFailureIsRetried() {
        sheets.rows = List.of(List.of("登録経路", "登録日"), List.of(PATH, "2024/05/10"));
        sheets.failuresBeforeSuccess = 2;

        assertEquals(1, ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY));
        assertEquals(3, sheets.calls);
    }

    @Test
    void undetectedColumnsAreDataQualityErrorByDefault() {
        sheets.rows = List.of(List.of("a", "b", "c", "d", "e", "f"), List.of("", "", "", "", PATH, "2024/05/10"));

        DataQualityException e = assertThrows(DataQualityException.class,
                () -> ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY));
        assertEquals(DataQualityException.COLUMN_NOT_DETECTED, e.getCode());
    }

    @Test
    void fallbackColumnsAreUsedWhenAllowed() {
        properties.getLedger().setAllowFallbackColumns(true);
        ledger = newLedger();
        sheets.rows = List.of(List.of("a", "b", "c", "d", "e", "f"), List.of("", "", "", "", PATH, "2024/05/10"));

        assertEquals(1, ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY));
    }

    @Test
    void fixedSchemaIgnoresHeader() {
        sheets.rows = List.of(List.of("x", "y"), List.of("2024/05/09", PATH), List.of("2024/04/01", PATH));

        assertEquals(1, ledger.countMatchingRows(SHEET_ID, "SNS", PATH, TODAY.minusDays(6), TODAY,
                ColumnSchema.fixed(1, 0)));
    }

    @Test
    void emptySheetCountsZero() {
        sheets.rows = List.of();

        assertEquals(0, ledger.countMatchingRows(SHEET_ID, "TT_オプト", PATH, TODAY, TODAY));
        assertFalse(ledger.resolveSchema(SHEET_ID, "TT_オプト").isConfident());
    }

    @Test
    void extractsSpreadsheetIdFromUrlOrBareId() {
        assertEquals(SHEET_ID, SpreadsheetLedgerClient.extractSpreadsheetId(SHEET_URL));
        assertEquals(SHEET_ID, SpreadsheetLedgerClient.extractSpreadsheetId(" " + SHEET_ID + " "));
        assertEquals(DataQualityException.INVALID_SPREADSHEET, assertThrows(DataQualityException.class,
                () -> SpreadsheetLedgerClient.extractSpreadsheetId("https://example.com/sheet")).getCode());
        assertThrows(DataQualityException.class, () -> SpreadsheetLedgerClient.extractSpreadsheetId(""));
    }

    @Test
    void detectsColumnsByAlias() {
        ColumnSchema schema = SpreadsheetLedgerClient.detectSchema(List.of("id", "timestamp", "流入経路"));

        assertTrue(schema.isConfident());
        assertEquals(2, schema.getPathColumn());
        assertEquals(1, schema.getDateColumn());
    }

    @Test
    void parsesLedgerDateFormats() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");

        assertEquals(LocalDate.of(2024, 5, 1), SpreadsheetLedgerClient.parseDate("2024/5/1 23:59", tokyo));
        assertEquals(LocalDate.of(2024, 5, 1), SpreadsheetLedgerClient.parseDate("2024-05-01", tokyo));
        // UTC 16:00 은 도쿄 다음 날 01:00
        assertEquals(LocalDate.of(2024, 5, 2), SpreadsheetLedgerClient.parseDate("2024-05-01T16:00:00Z", tokyo));
        assertNull(SpreadsheetLedgerClient.parseDate("2024/13/40", tokyo));
        assertNull(SpreadsheetLedgerClient.parseDate("yesterday", tokyo));
        assertNull(SpreadsheetLedgerClient.parseDate("", tokyo));
    }

    private static class FakeSheetValuesClient implements SheetValuesClient {
        List<List<String>> rows = new ArrayList<>();
        int failuresBeforeSuccess;
        int calls;

        @Override
        public List<List<String>> fetchValues(String spreadsheetId, String sheetName, String range) {
            calls++;
            if (failuresBeforeSuccess > 0) {
                failuresBeforeSuccess--;
                throw new TransientInfrastructureException("sheets unavailable", 503, null);
            }
            return rows;
        }
    }
}
