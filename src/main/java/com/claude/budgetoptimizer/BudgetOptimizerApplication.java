package com.claude.budgetoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BudgetOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetOptimizerApplication.class, args);
    }
}
