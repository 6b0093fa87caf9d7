package com.stockinsight.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.stockinsight")
public class StockInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockInsightApplication.class, args);
    }
}
