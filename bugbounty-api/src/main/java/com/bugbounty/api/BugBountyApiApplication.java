package com.bugbounty.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Bug Bounty Platform API Application
 *
 * Researchers report vulnerabilities against programs published by companies.
 * Java 17 + Spring Boot 3.3.x
 */
@SpringBootApplication(scanBasePackages = "com.bugbounty")
@EntityScan(basePackages = "com.bugbounty.core.domain")
@EnableJpaRepositories(basePackages = "com.bugbounty.core.repository")
public class BugBountyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(BugBountyApiApplication.class, args);
    }
}
