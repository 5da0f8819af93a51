package com.llmcouncil.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CouncilOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouncilOrchestratorApplication.class, args);
    }
}
