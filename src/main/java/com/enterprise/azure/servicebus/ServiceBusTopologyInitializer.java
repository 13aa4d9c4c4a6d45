package com.enterprise.azure.servicebus;

import com.enterprise.azure.config.ServiceBusProperties;
import com.enterprise.azure.config.ServiceBusProperties.QueueDefinition;
import com.enterprise.azure.config.ServiceBusProperties.SubscriptionDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ensures the configured topology at startup.
 *
 * Configuration:
 * - azure.servicebus.topology.enabled: turn startup provisioning on
 * - azure.servicebus.topology.queues / topics / subscriptions: logical names to ensure
 *
 * Topics are ensured before subscriptions. Any failure aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "azure.servicebus.topology", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ServiceBusTopologyInitializer implements ApplicationRunner {

    private final ServiceBusProperties properties;
    private final ServiceBusTopologyService topologyService;

    @Override
    public void run(ApplicationArguments args) {
        ServiceBusProperties.Topology topology = properties.getTopology();
        log.info("Ensuring Service Bus topology: queues={}, topics={}, subscriptions={}",
            topology.getQueues().size(), topology.getTopics().size(), topology.getSubscriptions().size());

        for (QueueDefinition queue : topology.getQueues()) {
            topologyService.createQueue(queue.getName(), queue.isRequiresSession());
        }
        for (String topic : topology.getTopics()) {
            topologyService.createTopic(topic);
        }
        for (SubscriptionDefinition subscription : topology.getSubscriptions()) {
            topologyService.createSubscription(subscription.getTopic(), subscription.getName());
        }

        log.info("Service Bus topology ensured");
    }
}
