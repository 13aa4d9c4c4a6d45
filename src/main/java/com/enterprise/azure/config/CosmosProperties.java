package com.enterprise.azure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Azure Cosmos DB Configuration Properties
 *
 * Binds azure.cosmos.* from application.yml to type-safe configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "azure.cosmos")
@Data
public class CosmosProperties {

    private String endpoint;
    private String key;
    private String databaseId;
    private String partitionKeyPath = "/id";

    private InsertRetry insertRetry = new InsertRetry();

    @Data
    public static class InsertRetry {
        private Integer maxAttempts = 3;
        private Integer schedulerThreads = 1;
    }
}
