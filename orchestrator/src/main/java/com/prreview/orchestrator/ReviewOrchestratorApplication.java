package com.prreview.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the PR review orchestrator.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... DATABASE_URL=jdbc:postgresql://localhost:5432/prreview mvn spring-boot:run
 */
@SpringBootApplication
public class ReviewOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewOrchestratorApplication.class, args);
    }
}
