package com.autodev.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Coordination core for a fleet of autonomous coding workers.
 *
 * Every worker process runs this same service layer against one shared
 * PostgreSQL database. There is no in-memory coordinator: the task queue,
 * leases, mailbox, votes and approvals are all rows, and every race is
 * settled by a conditional write.
 *
 * To run:
 *   DB_URL=jdbc:postgresql://localhost:5432/autodev mvn spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorApplication.class, args);
    }
}
