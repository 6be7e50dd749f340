package com.claude.budgetoptimizer.controller;

import com.claude.budgetoptimizer.repository.AdBudgetCapRepository;
import com.claude.budgetoptimizer.service.BudgetCapService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DataJpaTest
class BudgetCapControllerTest {

    private static final String CAP_JSON = "{\"advertiserId\":\"adv-1\",\"adId\":\"ad-1\",\"adgroupId\":\"ag-1\"," +
            "\"campaignId\":\"cp-1\",\"maxDailyBudget\":12000}";

    @Autowired
    private AdBudgetCapRepository capRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BudgetCapController(new BudgetCapService(capRepository))).build();
    }

    @Test
    void upsertThenList() throws Exception {
        mockMvc.perform(post("/api/budget-caps").contentType(MediaType.APPLICATION_JSON).content(CAP_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.adId").value("ad-1"))
                .andExpect(jsonPath("$.data.enabled").value(true));

        mockMvc.perform(get("/api/budget-caps").param("advertiserId", "adv-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    void invalidBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/budget-caps").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"advertiserId\":\"adv-1\",\"adId\":\"ad-1\",\"maxDailyBudget\":-1}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/budget-caps").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"advertiserId\":\"adv-1\",\"adId\":\"ad-1\",\"maxDailyBudget\":100," +
                                "\"startDate\":\"2024-05-10\",\"endDate\":\"2024-05-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        assertEquals(0, capRepository.count());
    }

    @Test
    void missingCapIsNotFound() throws Exception {
        mockMvc.perform(put("/api/budget-caps/999").contentType(MediaType.APPLICATION_JSON).content(CAP_JSON))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/budget-caps/999"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteRemovesCap() throws Exception {
        mockMvc.perform(post("/api/budget-caps").contentType(MediaType.APPLICATION_JSON).content(CAP_JSON))
                .andExpect(status().isOk());
        Long id = capRepository.findByAdId("ad-1").orElseThrow().getId();

        mockMvc.perform(delete("/api/budget-caps/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("deleted"));

        assertTrue(capRepository.findByAdId("ad-1").isEmpty());
    }
}
