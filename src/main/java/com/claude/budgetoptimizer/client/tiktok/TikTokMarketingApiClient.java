package com.claude.budgetoptimizer.client.tiktok;

import com.claude.budgetoptimizer.client.AdInventoryClient;
import com.claude.budgetoptimizer.client.HttpFailures;
import com.claude.budgetoptimizer.client.PlatformMutationClient;
import com.claude.budgetoptimizer.client.ReportApiClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.claude.budgetoptimizer.domain.BudgetEntityLevel;
import com.claude.budgetoptimizer.domain.DeliveryStatus;
import com.claude.budgetoptimizer.domain.ManagedAd;
import com.claude.budgetoptimizer.domain.PerformanceAggregate;
import com.claude.budgetoptimizer.exception.BudgetOptimizationException;
import com.claude.budgetoptimizer.exception.DataQualityException;
import com.claude.budgetoptimizer.exception.PlatformMutationException;
import com.claude.budgetoptimizer.exception.TransientInfrastructureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * TikTok Business API v1.3 어댑터
 *
 * 리포트, 광고 목록, 예산 / 상태 변경을 담당한다. 응답 본문의 code 가 0 이 아니면
 * HTTP 200 이어도 실패로 본다.
 */
@Component
@Slf4j
public class TikTokMarketingApiClient implements ReportApiClient, AdInventoryClient, PlatformMutationClient {

    private static final String REPORT_PATH = "/v1.3/report/integrated/get/";
    private static final String AD_PATH = "/v1.3/ad/get/";
    private static final String ADGROUP_PATH = "/v1.3/adgroup/get/";
    private static final String CAMPAIGN_PATH = "/v1.3/campaign/get/";
    private static final String AD_STATUS_UPDATE_PATH = "/v1.3/ad/status/update/";
    private static final String ADGROUP_BUDGET_UPDATE_PATH = "/v1.3/adgroup/budget/update/";
    private static final String CAMPAIGN_UPDATE_PATH = "/v1.3/campaign/update/";

    private static final int PAGE_SIZE = 1000;
    private static final int ID_FILTER_LIMIT = 100;
    private static final int RATE_LIMITED = 40100;
    private static final int SERVER_ERROR_FLOOR = 50000;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public TikTokMarketingApiClient(@Qualifier("platformRestTemplate") RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    BudgetOptimizationProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getPlatform().getBaseUrl();
    }

    @Override
    public Map<String, PerformanceAggregate> fetchAdAggregates(String accessToken, String advertiserId,
                                                               LocalDate from, LocalDate to) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("advertiser_id", advertiserId);
        params.put("report_type", "BASIC");
        params.put("data_level", "AUCTION_AD");
        params.put("dimensions", toJson(List.of("ad_id")));
        params.put("metrics", toJson(List.of("spend", "impressions", "clicks")));
        params.put("start_date", from.toString());
        params.put("end_date", to.toString());

        Map<String, PerformanceAggregate> aggregates = new HashMap<>();
        for (JsonNode row : fetchAllPages(REPORT_PATH, accessToken, params)) {
            String adId = row.path("dimensions").path("ad_id").asText(null);
            if (adId == null) {
                continue;
            }
            JsonNode metrics = row.path("metrics");
            PerformanceAggregate aggregate = new PerformanceAggregate(
                    decimal(metrics.path("spend")),
                    metrics.path("impressions").asLong(0),
                    metrics.path("clicks").asLong(0));
            aggregates.merge(adId, aggregate, PerformanceAggregate::plus);
        }
        log.debug("[{}] report {}~{}: {} ads", advertiserId, from, to, aggregates.size());
        return aggregates;
    }

    @Override
    public List<ManagedAd> fetchAds(String accessToken, String advertiserId) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("advertiser_id", advertiserId);
        params.put("fields", toJson(List.of("ad_id", "ad_name", "adgroup_id", "campaign_id", "operation_status")));
        List<JsonNode> ads = fetchAllPages(AD_PATH, accessToken, params);
        if (ads.isEmpty()) {
            return List.of();
        }

        Set<String> adgroupIds = ads.stream().map(a -> a.path("adgroup_id").asText()).collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> campaignIds = ads.stream().map(a -> a.path("campaign_id").asText()).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, JsonNode> adgroups = fetchByIds(ADGROUP_PATH, accessToken, advertiserId, "adgroup_ids", adgroupIds, "adgroup_id");
        Map<String, JsonNode> campaigns = fetchByIds(CAMPAIGN_PATH, accessToken, advertiserId, "campaign_ids", campaignIds, "campaign_id");

        List<ManagedAd> result = new ArrayList<>(ads.size());
        for (JsonNode ad : ads) {
            String adgroupId = ad.path("adgroup_id").asText();
            String campaignId = ad.path("campaign_id").asText();
            JsonNode campaign = campaigns.get(campaignId);
            JsonNode adgroup = adgroups.get(adgroupId);
            boolean pooled = campaign != null && campaign.path("budget_optimize_on").asBoolean(false);
            JsonNode budgetOwner = pooled ? campaign : adgroup;

            result.add(ManagedAd.builder()
                    .adId(ad.path("ad_id").asText())
                    .adName(ad.path("ad_name").asText(""))
                    .advertiserId(advertiserId)
                    .adgroupId(adgroupId)
                    .campaignId(campaignId)
                    .deliveryStatus("ENABLE".equals(ad.path("operation_status").asText()) ? DeliveryStatus.ENABLE : DeliveryStatus.DISABLE)
                    .pooledBudget(pooled)
                    .dailyBudget(budgetOwner == null ? BigDecimal.ZERO : decimal(budgetOwner.path("budget")))
                    .build());
        }
        log.debug("[{}] fetched {} ads ({} adgroups, {} campaigns)", advertiserId, result.size(), adgroups.size(), campaigns.size());
        return result;
    }

    @Override
    public void updateDailyBudget(String accessToken, String advertiserId,
                                  BudgetEntityLevel level, String entityId, BigDecimal dailyBudget) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("advertiser_id", advertiserId);
        String path;
        if (level == BudgetEntityLevel.CAMPAIGN) {
            path = CAMPAIGN_UPDATE_PATH;
            body.put("campaign_id", entityId);
            body.put("budget", dailyBudget);
        } else {
            path = ADGROUP_BUDGET_UPDATE_PATH;
            ArrayNode budgets = body.putArray("budget");
            ObjectNode item = budgets.addObject();
            item.put("adgroup_id", entityId);
            item.put("budget", dailyBudget);
        }
        post(path, accessToken, body, "update " + level + " " + entityId + " budget");
        log.info("[{}] {} {} budget set to {}", advertiserId, level, entityId, dailyBudget);
    }

    @Override
    public void updateDeliveryStatus(String accessToken, String advertiserId, String adId, DeliveryStatus status) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("advertiser_id", advertiserId);
        body.putArray("ad_ids").add(adId);
        body.put("operation_status", status.name());
        post(AD_STATUS_UPDATE_PATH, accessToken, body, "update ad " + adId + " status");
        log.info("[{}] ad {} status set to {}", advertiserId, adId, status);
    }

    private Map<String, JsonNode> fetchByIds(String path, String accessToken, String advertiserId,
                                             String filterName, Set<String> ids, String idField) {
        Map<String, JsonNode> byId = new HashMap<>();
        List<String> remaining = new ArrayList<>(ids);
        for (int start = 0; start < remaining.size(); start += ID_FILTER_LIMIT) {
            List<String> slice = remaining.subList(start, Math.min(start + ID_FILTER_LIMIT, remaining.size()));
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("advertiser_id", advertiserId);
            params.put("filtering", toJson(Map.of(filterName, slice)));
            byId.putAll(fetchAllPages(path, accessToken, params).stream()
                    .collect(Collectors.toMap(n -> n.path(idField).asText(), Function.identity(), (a, b) -> a)));
        }
        return byId;
    }

    private List<JsonNode> fetchAllPages(String path, String accessToken, Map<String, Object> params) {
        List<JsonNode> rows = new ArrayList<>();
        int page = 1;
        int totalPages;
        do {
            UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl + path);
            params.forEach((name, value) -> builder.queryParam(name, value));
            builder.queryParam("page", page).queryParam("page_size", PAGE_SIZE);
            // JSON 파라미터의 괄호와 따옴표는 템플릿 변수로 해석되지 않도록 build 후 인코딩
            URI uri = builder.build().encode().toUri();

            JsonNode data = get(uri, accessToken, path);
            data.path("list").forEach(rows::add);
            totalPages = data.path("page_info").path("total_page").asInt(1);
            page++;
        } while (page <= totalPages);
        return rows;
    }

    private JsonNode get(URI uri, String accessToken, String operation) {
        try {
            JsonNode body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers(accessToken)), JsonNode.class).getBody();
            return unwrap(body, operation, false);
        } catch (RestClientException e) {
            throw HttpFailures.forQuery(operation, e);
        }
    }

    private void post(String path, String accessToken, ObjectNode body, String operation) {
        try {
            JsonNode response = restTemplate.exchange(URI.create(baseUrl + path), HttpMethod.POST,
                    new HttpEntity<>(body, headers(accessToken)), JsonNode.class).getBody();
            unwrap(response, operation, true);
        } catch (RestClientException e) {
            throw HttpFailures.forMutation(operation, e);
        }
    }

    private JsonNode unwrap(JsonNode body, String operation, boolean mutation) {
        if (body == null) {
            throw new TransientInfrastructureException(operation + " returned an empty body", null, null);
        }
        int code = body.path("code").asInt(-1);
        if (code == 0) {
            return body.path("data");
        }
        String message = operation + " failed: code=" + code + " message=" + body.path("message").asText();
        throw classify(code, message, mutation);
    }

    private BudgetOptimizationException classify(int code, String message, boolean mutation) {
        if (code == RATE_LIMITED || code >= SERVER_ERROR_FLOOR) {
            return new TransientInfrastructureException(message, null, null);
        }
        if (mutation) {
            return new PlatformMutationException(message);
        }
        return new DataQualityException(DataQualityException.PLATFORM_REJECTED_QUERY, message);
    }

    private HttpHeaders headers(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("Access-Token", accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private String toJson(Object value) {
        return objectMapper.valueToTree(value).toString();
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }
}
