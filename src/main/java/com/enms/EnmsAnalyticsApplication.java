package com.enms;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the energy analytics model-lifecycle service.
 * Trains per-machine baselines, scores readings against them, watches for
 * drift and rotates models through retraining and A/B comparison.
 */
@SpringBootApplication
public class EnmsAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnmsAnalyticsApplication.class, args);
    }
}
