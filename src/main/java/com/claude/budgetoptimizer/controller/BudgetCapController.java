package com.claude.budgetoptimizer.controller;

import com.claude.budgetoptimizer.dto.ApiResponse;
import com.claude.budgetoptimizer.dto.BudgetCapRequest;
import com.claude.budgetoptimizer.entity.AdBudgetCap;
import com.claude.budgetoptimizer.service.BudgetCapService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * 광고별 일예산 상한 관리
 */
@RestController
@RequestMapping("/api/budget-caps")
@Slf4j
public class BudgetCapController {

    private final BudgetCapService budgetCapService;

    public BudgetCapController(BudgetCapService budgetCapService) {
        this.budgetCapService = budgetCapService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<AdBudgetCap>>> list(@RequestParam String advertiserId) {
        return ResponseEntity.ok(ApiResponse.ok(budgetCapService.findByAdvertiser(advertiserId)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AdBudgetCap>> upsert(@Valid @RequestBody BudgetCapRequest request) {
        try {
            return ResponseEntity.ok(ApiResponse.ok(budgetCapService.upsert(request)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.failure(e.getMessage()));
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<AdBudgetCap>> update(@PathVariable Long id,
                                                           @Valid @RequestBody BudgetCapRequest request) {
        try {
            return ResponseEntity.ok(ApiResponse.ok(budgetCapService.update(id, request)));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ApiResponse.failure(e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<String>> delete(@PathVariable Long id) {
        try {
            budgetCapService.delete(id);
            return ResponseEntity.ok(ApiResponse.ok("deleted"));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure(e.getMessage()));
        }
    }
}
