package com.claude.budgetoptimizer.client.sheets;

import com.claude.budgetoptimizer.client.HttpFailures;
import com.claude.budgetoptimizer.client.SheetValuesClient;
import com.claude.budgetoptimizer.config.BudgetOptimizationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Sheets API v4 values.get 어댑터
 */
@Component
@Slf4j
public class GoogleSheetsValuesClient implements SheetValuesClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String accessToken;

    public GoogleSheetsValuesClient(@Qualifier("sheetsRestTemplate") RestTemplate restTemplate,
                                    BudgetOptimizationProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getSheets().getBaseUrl();
        this.accessToken = properties.getSheets().getAccessToken();
    }

    @Override
    public List<List<String>> fetchValues(String spreadsheetId, String sheetName, String range) {
        String a1Range = "'" + sheetName.replace("'", "''") + "'!" + range;
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/spreadsheets/{spreadsheetId}/values/{range}")
                .queryParam("majorDimension", "ROWS")
                .buildAndExpand(spreadsheetId, a1Range)
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        if (accessToken != null && !accessToken.isBlank()) {
            headers.setBearerAuth(accessToken);
        }

        JsonNode body;
        try {
            body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class).getBody();
        } catch (RestClientException e) {
            throw HttpFailures.forQuery("read sheet " + sheetName, e);
        }

        List<List<String>> rows = new ArrayList<>();
        if (body == null) {
            return rows;
        }
        for (JsonNode rowNode : body.path("values")) {
            List<String> row = new ArrayList<>(rowNode.size());
            rowNode.forEach(cell -> row.add(cell.asText("")));
            rows.add(row);
        }
        log.debug("sheet {} / {}: {} rows", spreadsheetId, sheetName, rows.size());
        return rows;
    }
}
