package com.claude.budgetoptimizer.service;

import com.claude.budgetoptimizer.client.LedgerClient;
import com.claude.budgetoptimizer.client.SheetValuesClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.ColumnSchema;
import com.claude.budgetoptimizer.exception.DataQualityException;
import com.claude.budgetoptimizer.util.TimedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스프레드시트 장부 카운터
 *
 * 시트 전체를 한 번 읽어 TTL 캐시에 두고, 같은 run 안의 광고별 카운트는 캐시에서 센다.
 * 컬럼 위치는 헤더 별칭으로 찾고, 찾지 못하면 기본 위치(E열 경로, F열 일시)를 쓸지
 * 설정(ledger.allow-fallback-columns)으로 결정한다.
 */
@Service
@Slf4j
public class SpreadsheetLedgerClient implements LedgerClient {

    static final List<String> PATH_HEADER_ALIASES = List.of("登録経路", "流入経路", "registration_path", "path");
    static final List<String> DATE_HEADER_ALIASES = List.of("登録日時", "登録日", "date", "created_at", "timestamp");

    private static final Pattern SPREADSHEET_URL =
            Pattern.compile("^https://(?:docs|sheets)\\.google\\.com/spreadsheets/d/([a-zA-Z0-9_-]+)");
    private static final Pattern BARE_SPREADSHEET_ID = Pattern.compile("^[a-zA-Z0-9_-]{20,}$");
    private static final Pattern LEADING_DATE = Pattern.compile("^(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})");

    private final SheetValuesClient sheetValuesClient;
    private final RetryTemplate retryTemplate;
    private final BudgetOptimizationProperties.Ledger ledgerProperties;
    private final Clock clock;
    private final ZoneId zone;
    private final TimedCache<String, List<List<String>>> sheetCache;

    public SpreadsheetLedgerClient(SheetValuesClient sheetValuesClient,
                                   RetryTemplate optimizationRetryTemplate,
                                   BudgetOptimizationProperties properties,
                                   Clock clock) {
        this.sheetValuesClient = sheetValuesClient;
        this.retryTemplate = optimizationRetryTemplate;
        this.ledgerProperties = properties.getLedger();
        this.clock = clock;
        this.zone = ZoneId.of(properties.getZone());
        this.sheetCache = new TimedCache<>(properties.getCache().getTtl(), clock);
    }

    @Override
    public int countMatchingRows(String sheetLocator, String sheetName, String path, LocalDate from, LocalDate to) {
        String spreadsheetId = extractSpreadsheetId(sheetLocator);
        List<List<String>> rows = loadSheet(spreadsheetId, sheetName);
        if (rows.isEmpty()) {
            log.warn("장부 시트가 비어 있음: {}", sheetName);
            return 0;
        }
        ColumnSchema schema = detectSchema(rows.get(0));
        if (!schema.isConfident()) {
            if (!ledgerProperties.isAllowFallbackColumns()) {
                throw new DataQualityException(DataQualityException.COLUMN_NOT_DETECTED,
                        "sheet '" + sheetName + "': " + schema.getWarning());
            }
            log.warn("[{}] {}; 기본 위치 사용 (path={}, date={})", DataQualityException.COLUMN_NOT_DETECTED,
                    schema.getWarning(), schema.getPathColumn(), schema.getDateColumn());
        }
        return count(rows, schema, path, from, to);
    }

    @Override
    public int countMatchingRows(String sheetLocator, String sheetName, String path, LocalDate from, LocalDate to,
                                 ColumnSchema fixedSchema) {
        String spreadsheetId = extractSpreadsheetId(sheetLocator);
        List<List<String>> rows = loadSheet(spreadsheetId, sheetName);
        if (rows.isEmpty()) {
            log.warn("장부 시트가 비어 있음: {}", sheetName);
            return 0;
        }
        return count(rows, fixedSchema, path, from, to);
    }

    @Override
    public ColumnSchema resolveSchema(String sheetLocator, String sheetName) {
        List<List<String>> rows = loadSheet(extractSpreadsheetId(sheetLocator), sheetName);
        if (rows.isEmpty()) {
            return ColumnSchema.fallback("sheet '" + sheetName + "' has no header row");
        }
        return detectSchema(rows.get(0));
    }

    @Override
    public void invalidate() {
        sheetCache.invalidateAll();
    }

    /**
     * URL 이나 ID 를 받아 스프레드시트 ID 를 돌려준다.
     */
    public static String extractSpreadsheetId(String sheetLocator) {
        if (sheetLocator == null || sheetLocator.isBlank()) {
            throw new DataQualityException(DataQualityException.INVALID_SPREADSHEET, "spreadsheet is not configured");
        }
        String locator = sheetLocator.trim();
        Matcher matcher = SPREADSHEET_URL.matcher(locator);
        if (matcher.find()) {
            return matcher.group(1);
        }
        if (BARE_SPREADSHEET_ID.matcher(locator).matches()) {
            return locator;
        }
        throw new DataQualityException(DataQualityException.INVALID_SPREADSHEET,
                "not a spreadsheet URL or id: " + locator);
    }

    static ColumnSchema detectSchema(List<String> header) {
        Optional<Integer> pathColumn = findColumn(header, PATH_HEADER_ALIASES);
        Optional<Integer> dateColumn = findColumn(header, DATE_HEADER_ALIASES);
        if (pathColumn.isPresent() && dateColumn.isPresent()) {
            return ColumnSchema.detected(pathColumn.get(), dateColumn.get());
        }
        return ColumnSchema.fallback("header " + header + " has no "
                + (pathColumn.isEmpty() ? "registration path" : "date") + " column");
    }

    private static Optional<Integer> findColumn(List<String> header, List<String> aliases) {
        // 별칭 순서가 우선순위
        for (String alias : aliases) {
            for (int i = 0; i < header.size(); i++) {
                String cell = header.get(i) == null ? "" : header.get(i).trim();
                if (cell.equalsIgnoreCase(alias) || cell.contains(alias)) {
                    return Optional.of(i);
                }
            }
        }
        return Optional.empty();
    }

    private int count(List<List<String>> rows, ColumnSchema schema, String path, LocalDate from, LocalDate to) {
        int count = 0;
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String pathValue = cell(row, schema.getPathColumn());
            if (pathValue.isEmpty() || !pathValue.equals(path)) {
                continue;
            }
            LocalDate date = parseDate(cell(row, schema.getDateColumn()), zone);
            if (date != null && !date.isBefore(from) && !date.isAfter(to)) {
                count++;
            }
        }
        log.debug("path {} {}~{}: {} rows", path, from, to, count);
        return count;
    }

    private List<List<String>> loadSheet(String spreadsheetId, String sheetName) {
        String cacheKey = spreadsheetId + ":" + sheetName + ":" + ledgerProperties.getReadRange();
        return sheetCache.get(cacheKey, key -> {
            List<List<String>> rows = retryTemplate.execute(context ->
                    sheetValuesClient.fetchValues(spreadsheetId, sheetName, ledgerProperties.getReadRange()));
            warnIfStale(sheetName, rows);
            return rows;
        });
    }

    private void warnIfStale(String sheetName, List<List<String>> rows) {
        if (rows.size() < 2) {
            return;
        }
        ColumnSchema schema = detectSchema(rows.get(0));
        if (!schema.isConfident()) {
            return;
        }
        LocalDate newest = null;
        for (int i = 1; i < rows.size(); i++) {
            LocalDate date = parseDate(cell(rows.get(i), schema.getDateColumn()), zone);
            if (date != null && (newest == null || date.isAfter(newest))) {
                newest = date;
            }
        }
        LocalDate threshold = LocalDate.now(clock).minusDays(ledgerProperties.getFreshnessMaxDays());
        if (newest != null && newest.isBefore(threshold)) {
            log.warn("[G-06] 장부 {} 의 최신 데이터가 {} 입니다 ({}일 이상 갱신되지 않음)",
                    sheetName, newest, ledgerProperties.getFreshnessMaxDays());
        }
    }

    private static String cell(List<String> row, int index) {
        if (index < 0 || index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index).trim();
    }

    /**
     * yyyy/M/d, yyyy-MM-dd (시각이 붙어도 됨) 와 오프셋이 있는 ISO 일시를 받는다.
     */
    static LocalDate parseDate(String value, ZoneId zone) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value.contains("T") && (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$"))) {
            try {
                return OffsetDateTime.parse(value).atZoneSameInstant(zone).toLocalDate();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        Matcher matcher = LEADING_DATE.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        try {
            return LocalDate.of(Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
        } catch (java.time.DateTimeException e) {
            return null;
        }
    }
}
