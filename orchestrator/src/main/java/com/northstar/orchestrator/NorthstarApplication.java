package com.northstar.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Northstar orchestrator: turns model-written proposals into reviewed pull requests.
 *
 * To run:
 *   MORPH_API_KEY=... GITHUB_TOKEN=... mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class NorthstarApplication {

    public static void main(String[] args) {
        SpringApplication.run(NorthstarApplication.class, args);
    }
}
