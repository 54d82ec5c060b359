package com.featureforge.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Feature build coordinator.
 *
 * To run against a local PostgreSQL and agent service:
 *   FEATUREFORGE_DB_URL=jdbc:postgresql://localhost:5432/featureforge \
 *   FEATUREFORGE_AGENT_SERVICE_URL=http://localhost:8090 mvn -pl coordinator spring-boot:run
 */
@SpringBootApplication
public class CoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorApplication.class, args);
    }
}
