package com.enterprise.azure.servicebus;

import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusReceiverAsyncClient;
import com.azure.messaging.servicebus.ServiceBusSenderAsyncClient;
import com.enterprise.azure.config.ServiceBusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds data-plane handles for already provisioned entities.
 *
 * All handles come from one {@link ServiceBusClientBuilder} and therefore
 * share a single AMQP connection to the namespace. The builder is not
 * thread-safe, hence the synchronized methods.
 */
@Component
@ConditionalOnProperty(prefix = "azure.servicebus", name = "connection-string")
@Slf4j
public class ServiceBusClientFactory {

    private final ServiceBusClientBuilder builder;

    public ServiceBusClientFactory(ServiceBusProperties properties) {
        this.builder = new ServiceBusClientBuilder()
            .connectionString(properties.getConnectionString());
    }

    public synchronized ServiceBusSenderAsyncClient createQueueSender(String queueName) {
        log.debug("Building queue sender: queue={}", queueName);
        return builder.sender()
            .queueName(queueName)
            .buildAsyncClient();
    }

    public synchronized ServiceBusSenderAsyncClient createTopicSender(String topicName) {
        log.debug("Building topic sender: topic={}", topicName);
        return builder.sender()
            .topicName(topicName)
            .buildAsyncClient();
    }

    public synchronized ServiceBusReceiverAsyncClient createSubscriptionReceiver(String topicName,
                                                                              String subscriptionName) {
        log.debug("Building subscription receiver: topic={}, subscription={}", topicName, subscriptionName);
        return builder.receiver()
            .topicName(topicName)
            .subscriptionName(subscriptionName)
            .buildAsyncClient();
    }
}
