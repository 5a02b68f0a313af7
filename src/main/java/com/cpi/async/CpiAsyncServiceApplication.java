package com.cpi.async;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for the personal CPI async service.
 *
 * Accepts calculation triggers, computes a personal price index on a
 * single background worker and posts the result back to the main service.
 */
@SpringBootApplication
public class CpiAsyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CpiAsyncServiceApplication.class, args);
    }
}
