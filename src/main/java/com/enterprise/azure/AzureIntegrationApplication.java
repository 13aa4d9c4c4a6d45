package com.enterprise.azure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application for the Azure integration layer
 *
 * 5W1H:
 * WHO: Applications publishing to Service Bus and projecting view models into Cosmos DB
 * WHAT: Provisions messaging entities on demand and writes view models with throttle handling
 * WHEN: Entities are ensured on first use (or at startup when a topology is configured)
 * WHERE: Azure Service Bus namespace, Cosmos DB account, Table storage account
 * WHY: Keeps provisioning and 429 handling out of every call site
 * HOW: Check-then-create against the control plane; bounded retry honoring retry-after hints
 */
@SpringBootApplication
public class AzureIntegrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AzureIntegrationApplication.class, args);
    }
}
