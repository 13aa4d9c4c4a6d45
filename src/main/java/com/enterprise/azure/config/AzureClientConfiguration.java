package com.enterprise.azure.config;

import com.azure.cosmos.CosmosAsyncClient;
import com.azure.cosmos.CosmosClientBuilder;
import com.azure.data.tables.TableServiceClient;
import com.azure.data.tables.TableServiceClientBuilder;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationAsyncClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Azure SDK client wiring.
 *
 * Each backend is only wired when its connection settings are present, so an
 * application can pull in the messaging half without configuring Cosmos and
 * the other way round.
 */
@Configuration
@Slf4j
public class AzureClientConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "azure.servicebus", name = "connection-string")
    public ServiceBusAdministrationAsyncClient serviceBusAdministrationClient(ServiceBusProperties properties) {
        log.info("Creating Service Bus administration client");
        return new ServiceBusAdministrationClientBuilder()
            .connectionString(properties.getConnectionString())
            .buildAsyncClient();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "azure.cosmos", name = "endpoint")
    public CosmosAsyncClient cosmosAsyncClient(CosmosProperties properties) {
        log.info("Creating Cosmos client: endpoint={}", properties.getEndpoint());
        return new CosmosClientBuilder()
            .endpoint(properties.getEndpoint())
            .key(properties.getKey())
            .buildAsyncClient();
    }

    /**
     * Scheduler for throttled-insert backoff. Retries are re-scheduled here
     * instead of sleeping on the caller's thread.
     */
    @Bean(destroyMethod = "shutdownNow")
    @ConditionalOnProperty(prefix = "azure.cosmos", name = "endpoint")
    public ScheduledExecutorService insertRetryScheduler(CosmosProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("cosmos-insert-retry-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(
            properties.getInsertRetry().getSchedulerThreads(), threadFactory);
    }

    @Bean
    @ConditionalOnProperty(prefix = "azure.storage", name = "connection-string")
    public TableServiceClient tableServiceClient(TableStorageProperties properties) {
        return new TableServiceClientBuilder()
            .connectionString(properties.getConnectionString())
            .buildClient();
    }
}
