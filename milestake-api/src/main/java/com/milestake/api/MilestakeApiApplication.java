package com.milestake.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Milestake API Application
 *
 * Settlement ledger, attestation service and mileage sync for staked
 * running challenges.
 */
@SpringBootApplication(scanBasePackages = "com.milestake")
@EntityScan(basePackages = "com.milestake.core.domain")
@EnableJpaRepositories(basePackages = "com.milestake.core.repository")
public class MilestakeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(MilestakeApiApplication.class, args);
    }
}
