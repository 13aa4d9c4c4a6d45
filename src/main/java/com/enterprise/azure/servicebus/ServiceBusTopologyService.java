package com.enterprise.azure.servicebus;

import com.azure.core.exception.ResourceExistsException;
import com.azure.messaging.servicebus.ServiceBusReceiverAsyncClient;
import com.azure.messaging.servicebus.ServiceBusSenderAsyncClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationAsyncClient;
import com.azure.messaging.servicebus.administration.models.CreateQueueOptions;
import com.enterprise.azure.support.Futures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Service Bus Topology Service
 *
 * 5W1H Analysis:
 * WHO: Publishers and subscribers that address entities by logical name (usually a message type)
 * WHAT: Ensures queues, topics and subscriptions exist and hands back client handles
 * WHEN: On every request; existence is re-checked each time and never cached
 * WHERE: Service Bus control plane (administration client) and data plane (sender/receiver)
 * WHY: Call sites never provision entities by hand and never create duplicates
 * HOW: Deterministic physical naming, then check-then-create
 *
 * Failure handling:
 * - Existence check errors propagate unchanged; nothing is retried here
 * - A create that loses a race against another process is treated as success
 * - Deleting a missing entity surfaces the backend error
 *
 * Every operation has a non-blocking form returning {@link CompletableFuture}
 * and a blocking form that waits for it.
 */
@Service
@ConditionalOnProperty(prefix = "azure.servicebus", name = "connection-string")
@RequiredArgsConstructor
@Slf4j
public class ServiceBusTopologyService {

    private final ServiceBusAdministrationAsyncClient adminClient;
    private final ServiceBusClientFactory clientFactory;
    private final EntityNameFormatter nameFormatter;

    // ---------------------------------------------------------------- queues

    public CompletableFuture<Void> createQueueAsync(String name, boolean requiresSession) {
        String queueName = nameFormatter.queueName(name);
        return ensureQueue(queueName, requiresSession).toFuture();
    }

    public void createQueue(String name, boolean requiresSession) {
        Futures.await(createQueueAsync(name, requiresSession));
    }

    public CompletableFuture<ServiceBusSenderAsyncClient> createQueueClientAsync(String name) {
        return createQueueClientAsync(name, false);
    }

    public CompletableFuture<ServiceBusSenderAsyncClient> createQueueClientAsync(String name,
                                                                               boolean requiresSession) {
        String queueName = nameFormatter.queueName(name);
        return ensureQueue(queueName, requiresSession)
            .then(Mono.fromCallable(() -> clientFactory.createQueueSender(queueName)))
            .toFuture();
    }

    public ServiceBusSenderAsyncClient createQueueClient(String name) {
        return Futures.await(createQueueClientAsync(name));
    }

    public ServiceBusSenderAsyncClient createQueueClient(String name, boolean requiresSession) {
        return Futures.await(createQueueClientAsync(name, requiresSession));
    }

    public CompletableFuture<Void> deleteQueueAsync(String name) {
        String queueName = nameFormatter.queueName(name);
        log.info("Deleting queue: queue={}", queueName);
        return adminClient.deleteQueue(queueName).toFuture();
    }

    public void deleteQueue(String name) {
        Futures.await(deleteQueueAsync(name));
    }

    // ---------------------------------------------------------------- topics

    public CompletableFuture<Void> createTopicAsync(String name) {
        String topicName = nameFormatter.topicName(name);
        return ensureTopic(topicName).toFuture();
    }

    public void createTopic(String name) {
        Futures.await(createTopicAsync(name));
    }

    public CompletableFuture<ServiceBusSenderAsyncClient> createTopicClientAsync(String name) {
        String topicName = nameFormatter.topicName(name);
        return ensureTopic(topicName)
            .then(Mono.fromCallable(() -> clientFactory.createTopicSender(topicName)))
            .toFuture();
    }

    public ServiceBusSenderAsyncClient createTopicClient(String name) {
        return Futures.await(createTopicClientAsync(name));
    }

    public CompletableFuture<Void> deleteTopicAsync(String name) {
        String topicName = nameFormatter.topicName(name);
        log.info("Deleting topic: topic={}", topicName);
        return adminClient.deleteTopic(topicName).toFuture();
    }

    public void deleteTopic(String name) {
        Futures.await(deleteTopicAsync(name));
    }

    // --------------------------------------------------------- subscriptions

    /**
     * Name validation happens before anything is sent, so an over-long
     * subscription name is thrown directly from this call rather than through
     * the returned future.
     *
     * @throws EntityNameFormatter.EntityNameTooLongException when the derived subscription name is too long
     */
    public CompletableFuture<Void> createSubscriptionAsync(String topicName, String subscriptionName) {
        String physicalTopic = nameFormatter.topicName(topicName);
        String physicalSubscription = nameFormatter.subscriptionName(subscriptionName);
        return ensureSubscription(physicalTopic, physicalSubscription).toFuture();
    }

    public void createSubscription(String topicName, String subscriptionName) {
        Futures.await(createSubscriptionAsync(topicName, subscriptionName));
    }

    public CompletableFuture<ServiceBusReceiverAsyncClient> createSubscriptionClientAsync(String topicName,
                                                                                        String subscriptionName) {
        String physicalTopic = nameFormatter.topicName(topicName);
        String physicalSubscription = nameFormatter.subscriptionName(subscriptionName);
        return ensureSubscription(physicalTopic, physicalSubscription)
            .then(Mono.fromCallable(() ->
                clientFactory.createSubscriptionReceiver(physicalTopic, physicalSubscription)))
            .toFuture();
    }

    public ServiceBusReceiverAsyncClient createSubscriptionClient(String topicName, String subscriptionName) {
        return Futures.await(createSubscriptionClientAsync(topicName, subscriptionName));
    }

    public CompletableFuture<Void> deleteSubscriptionAsync(String topicName, String subscriptionName) {
        String physicalTopic = nameFormatter.topicName(topicName);
        String physicalSubscription = nameFormatter.subscriptionName(subscriptionName);
        log.info("Deleting subscription: topic={}, subscription={}", physicalTopic, physicalSubscription);
        return adminClient.deleteSubscription(physicalTopic, physicalSubscription).toFuture();
    }

    public void deleteSubscription(String topicName, String subscriptionName) {
        Futures.await(deleteSubscriptionAsync(topicName, subscriptionName));
    }

    // -------------------------------------------------------- check-then-create

    private Mono<Void> ensureQueue(String queueName, boolean requiresSession) {
        return adminClient.getQueueExists(queueName)
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.debug("Queue exists: queue={}", queueName);
                    return Mono.<Void>empty();
                }
                CreateQueueOptions options = new CreateQueueOptions()
                    .setSessionRequired(requiresSession)
                    .setDeadLetteringOnMessageExpiration(true)
                    .setDuplicateDetectionRequired(true);

                log.info("Creating queue: queue={}, requiresSession={}", queueName, requiresSession);
                return ignoreConflict(adminClient.createQueue(queueName, options), queueName);
            });
    }

    private Mono<Void> ensureTopic(String topicName) {
        return adminClient.getTopicExists(topicName)
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.debug("Topic exists: topic={}", topicName);
                    return Mono.<Void>empty();
                }
                log.info("Creating topic: topic={}", topicName);
                return ignoreConflict(adminClient.createTopic(topicName), topicName);
            });
    }

    private Mono<Void> ensureSubscription(String topicName, String subscriptionName) {
        return adminClient.getSubscriptionExists(topicName, subscriptionName)
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.debug("Subscription exists: topic={}, subscription={}", topicName, subscriptionName);
                    return Mono.<Void>empty();
                }
                log.info("Creating subscription: topic={}, subscription={}", topicName, subscriptionName);
                return ignoreConflict(adminClient.createSubscription(topicName, subscriptionName),
                    topicName + "/" + subscriptionName);
            });
    }

    // Another process created the entity between our check and our create
    private Mono<Void> ignoreConflict(Mono<?> create, String entityPath) {
        return create.then()
            .onErrorResume(ResourceExistsException.class, e -> {
                log.info("Entity created concurrently, using existing: entity={}", entityPath);
                return Mono.empty();
            });
    }
}
