package com.agentorchestra.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent orchestrator service.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
