package com.claude.budgetoptimizer.config;

import com.claude.budgetoptimizer.domain.FunnelCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * budget-optimization.* 설정
 *
 * 모든 값은 기본값을 가지고 있어서 application.yml 에 없어도 동작한다.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "budget-optimization")
public class BudgetOptimizationProperties {

    @NotBlank
    private String zone = "Asia/Tokyo";

    // 운영 시간대 [firstRoundHour, lastHour] (로컬 시각, 양 끝 포함)
    @Min(0)
    @Max(23)
    private int firstRoundHour = 1;

    @Min(0)
    @Max(23)
    private int lastHour = 19;

    @Valid
    private Lock lock = new Lock();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private Sweep sweep = new Sweep();

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Platform platform = new Platform();

    @Valid
    private Sheets sheets = new Sheets();

    @Data
    public static class Lock {
        public enum Mode { DATABASE, IN_MEMORY }

        @NotNull
        private Mode mode = Mode.DATABASE;
        @NotNull
        private Duration timeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        @NotNull
        private Duration maxInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class Snapshot {
        @Min(1)
        private int retentionDays = 730;
        @NotBlank
        private String pruneCron = "0 30 3 * * *";
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        @NotBlank
        private String hourlyCron = "0 0 * * * *";
        @NotNull
        private Duration leaseCleanupInterval = Duration.ofMinutes(10);
    }

    @Data
    public static class Sweep {
        @Min(1)
        private int parallelism = 5;
    }

    @Data
    public static class Ledger {
        @NotBlank
        private String pathPrefix = "TikTok広告";
        @NotBlank
        private String conversionSheet = "TT_オプト";
        private List<String> frontSalesSheets = new ArrayList<>(List.of("TT【OTO】", "TT【3day】"));
        @Min(0)
        private int freshnessMaxDays = 2;
        @NotBlank
        private String readRange = "A:AZ";
        // false 면 헤더로 컬럼을 찾지 못한 장부는 data-quality 오류로 처리
        private boolean allowFallbackColumns = false;
        @Valid
        private Reservation reservation = new Reservation();
    }

    @Data
    public static class Reservation {
        private String spreadsheetId = "1MsJRbZGrLOkgd7lRApr1ciFQ1GOZaIjmrXQSIe3_nCA";
        private Map<FunnelCategory, ReservationSheet> sheets = defaultReservationSheets();

        private static Map<FunnelCategory, ReservationSheet> defaultReservationSheets() {
            Map<FunnelCategory, ReservationSheet> sheets = new EnumMap<>(FunnelCategory.class);
            sheets.put(FunnelCategory.SEMINAR, new ReservationSheet("スキルプラス（オートウェビナー用）", 0, 34));
            sheets.put(FunnelCategory.AI, new ReservationSheet("AI", 0, 46));
            sheets.put(FunnelCategory.SNS, new ReservationSheet("SNS", 0, 46));
            return sheets;
        }
    }

    @Data
    public static class ReservationSheet {
        private String sheetName;
        private int dateColumn;
        private int pathColumn;

        public ReservationSheet() {
        }

        public ReservationSheet(String sheetName, int dateColumn, int pathColumn) {
            this.sheetName = sheetName;
            this.dateColumn = dateColumn;
            this.pathColumn = pathColumn;
        }
    }

    @Data
    public static class Platform {
        @NotBlank
        private String baseUrl = "https://business-api.tiktok.com/open_api";
        private String defaultAccessToken;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Sheets {
        @NotBlank
        private String baseUrl = "https://sheets.googleapis.com/v4";
        private String accessToken;
    }
}
