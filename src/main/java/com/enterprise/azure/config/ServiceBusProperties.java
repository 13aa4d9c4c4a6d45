package com.enterprise.azure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Azure Service Bus Configuration Properties
 *
 * Binds azure.servicebus.* from application.yml. The master prefix and the
 * subscription-name prefix feed physical entity naming, so changing either
 * one points the application at a different set of queues, topics and
 * subscriptions.
 */
@Configuration
@ConfigurationProperties(prefix = "azure.servicebus")
@Data
public class ServiceBusProperties {

    private String connectionString;

    /** Optional environment prefix, e.g. "prod" gives "q.prod.&lt;name&gt;". */
    private String masterPrefix;

    /** Per-process disambiguation for subscription names. */
    private String subscriptionNamePrefix;

    private Topology topology = new Topology();

    @Data
    public static class Topology {
        private boolean enabled = false;
        private List<QueueDefinition> queues = new ArrayList<>();
        private List<String> topics = new ArrayList<>();
        private List<SubscriptionDefinition> subscriptions = new ArrayList<>();
    }

    @Data
    public static class QueueDefinition {
        private String name;
        private boolean requiresSession = false;
    }

    @Data
    public static class SubscriptionDefinition {
        private String topic;
        private String name;
    }
}
