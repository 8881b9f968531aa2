package com.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Prism view planner.
 *
 * Prism plans per-tenant analytics views over raw log tables. A view request names
 * a log type, a tenant and the columns it references; the planner answers with the
 * SQL that serves it, read either from a precomputed fast view or from a durable,
 * content-addressed cache table that is registered (and its extraction query
 * compiled) on first use.
 *
 * Key components:
 * - column catalog loaded from JSON at startup
 * - column dependency resolution with tiered column access
 * - fast view selection by ascending cardinality
 * - race-safe cache table registry on PostgreSQL
 * - federated joins over dblink foreign connections
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PrismApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrismApplication.class, args);
    }
}
