package com.enterprise.azure.servicebus;

import com.azure.core.exception.ResourceExistsException;
import com.azure.core.exception.ResourceNotFoundException;
import com.azure.messaging.servicebus.ServiceBusReceiverAsyncClient;
import com.azure.messaging.servicebus.ServiceBusSenderAsyncClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationAsyncClient;
import com.azure.messaging.servicebus.administration.models.CreateQueueOptions;
import com.enterprise.azure.config.ServiceBusProperties;
import com.enterprise.azure.servicebus.EntityNameFormatter.EntityNameTooLongException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit Tests for ServiceBusTopologyService
 *
 * Tests:
 * 1. Check-then-create for queues, topics and subscriptions
 * 2. Queue creation options
 * 3. Error propagation from the control plane
 * 4. Precondition failure before any network call
 */
@ExtendWith(MockitoExtension.class)
class ServiceBusTopologyServiceTest {

    private static final String QUEUE = "q.prod.Orders.OrderPlaced";
    private static final String TOPIC = "t.prod.Orders.OrderPlaced";

    @Mock
    private ServiceBusAdministrationAsyncClient adminClient;

    @Mock
    private ServiceBusClientFactory clientFactory;

    @Mock
    private ServiceBusSenderAsyncClient sender;

    @Mock
    private ServiceBusReceiverAsyncClient receiver;

    private EntityNameFormatter nameFormatter;
    private ServiceBusTopologyService topologyService;

    @BeforeEach
    void setUp() {
        ServiceBusProperties properties = new ServiceBusProperties();
        properties.setMasterPrefix("prod");
        properties.setSubscriptionNamePrefix("worker1");
        nameFormatter = new EntityNameFormatter(properties);
        topologyService = new ServiceBusTopologyService(adminClient, clientFactory, nameFormatter);
    }

    @Test
    void testCreateQueue_CreatesWhenAbsent() {
        // Given
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.just(false));
        when(adminClient.createQueue(eq(QUEUE), any(CreateQueueOptions.class))).thenReturn(Mono.empty());

        // When
        topologyService.createQueue("Orders.OrderPlaced", true);

        // Then
        ArgumentCaptor<CreateQueueOptions> options = ArgumentCaptor.forClass(CreateQueueOptions.class);
        verify(adminClient).createQueue(eq(QUEUE), options.capture());
        assertTrue(options.getValue().isSessionRequired());
        assertTrue(options.getValue().isDeadLetteringOnMessageExpiration());
        assertTrue(options.getValue().isDuplicateDetectionRequired());
    }

    @Test
    void testCreateQueue_SecondCallSkipsCreation() {
        // Given
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.just(false), Mono.just(true));
        when(adminClient.createQueue(eq(QUEUE), any(CreateQueueOptions.class))).thenReturn(Mono.empty());

        // When
        topologyService.createQueue("Orders.OrderPlaced", false);
        topologyService.createQueue("Orders.OrderPlaced", false);

        // Then
        verify(adminClient, times(2)).getQueueExists(QUEUE);
        verify(adminClient, times(1)).createQueue(eq(QUEUE), any(CreateQueueOptions.class));
    }

    @Test
    void testCreateQueue_ConcurrentCreationIsTolerated() {
        // Given
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.just(false));
        when(adminClient.createQueue(eq(QUEUE), any(CreateQueueOptions.class)))
            .thenReturn(Mono.error(new ResourceExistsException("Entity already exists", null)));

        // When & Then
        assertDoesNotThrow(() -> topologyService.createQueue("Orders.OrderPlaced", false));
    }

    @Test
    void testCreateQueueClient_ReturnsSenderForPhysicalName() {
        // Given
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.just(true));
        when(clientFactory.createQueueSender(QUEUE)).thenReturn(sender);

        // When
        ServiceBusSenderAsyncClient result = topologyService.createQueueClient("Orders.OrderPlaced");

        // Then
        assertSame(sender, result);
        verify(adminClient, never()).createQueue(anyString(), any(CreateQueueOptions.class));
    }

    @Test
    void testCreateQueueClientAsync_IsNonBlocking() {
        // Given
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.just(false));
        when(adminClient.createQueue(eq(QUEUE), any(CreateQueueOptions.class))).thenReturn(Mono.empty());
        when(clientFactory.createQueueSender(QUEUE)).thenReturn(sender);

        // When
        CompletableFuture<ServiceBusSenderAsyncClient> future =
            topologyService.createQueueClientAsync("Orders.OrderPlaced", true);

        // Then
        assertSame(sender, future.join());
    }

    @Test
    void testExistenceCheckFailure_PropagatesUnchanged() {
        // Given
        RuntimeException failure = new IllegalStateException("namespace unreachable");
        when(adminClient.getQueueExists(QUEUE)).thenReturn(Mono.error(failure));

        // When
        IllegalStateException thrown = assertThrows(
            IllegalStateException.class,
            () -> topologyService.createQueueClient("Orders.OrderPlaced")
        );

        // Then
        assertSame(failure, thrown);
        verify(adminClient, never()).createQueue(anyString(), any(CreateQueueOptions.class));
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testDeleteQueue_MissingEntitySurfacesError() {
        // Given
        ResourceNotFoundException notFound = new ResourceNotFoundException("Entity not found", null);
        when(adminClient.deleteQueue(QUEUE)).thenReturn(Mono.error(notFound));

        // When & Then
        ResourceNotFoundException thrown = assertThrows(
            ResourceNotFoundException.class,
            () -> topologyService.deleteQueue("Orders.OrderPlaced")
        );
        assertSame(notFound, thrown);
    }

    @Test
    void testCreateTopicClient_CreatesWhenAbsent() {
        // Given
        when(adminClient.getTopicExists(TOPIC)).thenReturn(Mono.just(false));
        when(adminClient.createTopic(TOPIC)).thenReturn(Mono.empty());
        when(clientFactory.createTopicSender(TOPIC)).thenReturn(sender);

        // When
        ServiceBusSenderAsyncClient result = topologyService.createTopicClient("Orders.OrderPlaced");

        // Then
        assertSame(sender, result);
        verify(adminClient).createTopic(TOPIC);
    }

    @Test
    void testCreateTopic_ExistingTopicIsLeftAlone() {
        // Given
        when(adminClient.getTopicExists(TOPIC)).thenReturn(Mono.just(true));

        // When
        topologyService.createTopic("Orders.OrderPlaced");

        // Then
        verify(adminClient, never()).createTopic(anyString());
    }

    @Test
    void testDeleteTopic_UsesPhysicalName() {
        // Given
        when(adminClient.deleteTopic(TOPIC)).thenReturn(Mono.empty());

        // When
        topologyService.deleteTopic("Orders.OrderPlaced");

        // Then
        verify(adminClient).deleteTopic(TOPIC);
    }

    @Test
    void testCreateSubscriptionClient_CreatesWhenAbsent() {
        // Given
        String subscription = nameFormatter.subscriptionName("com.acme.billing.InvoiceProjection");
        when(adminClient.getSubscriptionExists(TOPIC, subscription)).thenReturn(Mono.just(false));
        when(adminClient.createSubscription(TOPIC, subscription)).thenReturn(Mono.empty());
        when(clientFactory.createSubscriptionReceiver(TOPIC, subscription)).thenReturn(receiver);

        // When
        ServiceBusReceiverAsyncClient result = topologyService.createSubscriptionClient(
            "Orders.OrderPlaced", "com.acme.billing.InvoiceProjection");

        // Then
        assertSame(receiver, result);
        assertTrue(subscription.startsWith("s.prod.worker1."));
        verify(adminClient).createSubscription(TOPIC, subscription);
    }

    @Test
    void testCreateSubscription_TooLongNameFailsBeforeNetworkCall() {
        // Given
        ServiceBusProperties properties = new ServiceBusProperties();
        properties.setMasterPrefix("prod");
        properties.setSubscriptionNamePrefix("x".repeat(45));
        ServiceBusTopologyService service = new ServiceBusTopologyService(
            adminClient, clientFactory, new EntityNameFormatter(properties));

        // When & Then
        assertThrows(
            EntityNameTooLongException.class,
            () -> service.createSubscriptionAsync("Orders.OrderPlaced", "Handler")
        );
        verifyNoInteractions(adminClient);
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testDeleteSubscription_UsesPhysicalNames() {
        // Given
        String subscription = nameFormatter.subscriptionName("Handler");
        when(adminClient.deleteSubscription(TOPIC, subscription)).thenReturn(Mono.empty());

        // When
        topologyService.deleteSubscription("Orders.OrderPlaced", "Handler");

        // Then
        verify(adminClient).deleteSubscription(TOPIC, subscription);
    }
}
