package com.enterprise.azure.cosmos;

import com.azure.cosmos.CosmosAsyncClient;
import com.azure.cosmos.CosmosAsyncContainer;
import com.azure.cosmos.CosmosAsyncDatabase;
import com.azure.cosmos.models.PartitionKey;
import com.enterprise.azure.config.CosmosProperties;
import com.enterprise.azure.support.Futures;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read side of the view-model store.
 *
 * Resolves the container for a view-model type once and reuses it. This
 * class assumes containers already exist; the writable subclass creates
 * them on first use.
 */
@Slf4j
public class CosmosViewModelRepository {

    protected final CosmosAsyncClient client;
    protected final CosmosProperties properties;
    protected final ContainerCache containerCache = new ContainerCache();

    public CosmosViewModelRepository(CosmosAsyncClient client, CosmosProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public static String containerId(Class<?> type) {
        return type.getSimpleName();
    }

    /**
     * Point read by id, for containers partitioned on the id.
     */
    public <T extends ViewModel> CompletableFuture<Optional<T>> findAsync(Class<T> type, String id) {
        return findAsync(type, id, id);
    }

    public <T extends ViewModel> CompletableFuture<Optional<T>> findAsync(Class<T> type, String id,
                                                                          String partitionKey) {
        return getContainerAsync(type).thenCompose(container -> container
            .readItem(id, new PartitionKey(partitionKey), type)
            .map(response -> Optional.ofNullable(response.getItem()))
            .onErrorResume(CosmosThrottling::isNotFound, e -> Mono.just(Optional.<T>empty()))
            .toFuture());
    }

    public <T extends ViewModel> Optional<T> find(Class<T> type, String id) {
        return Futures.await(findAsync(type, id));
    }

    protected CosmosAsyncDatabase database() {
        return client.getDatabase(properties.getDatabaseId());
    }

    protected CompletableFuture<CosmosAsyncContainer> getContainerAsync(Class<?> type) {
        return containerCache.get(type, t -> createContainerIfNecessaryAsync(t)
            .thenApply(ignored -> database().getContainer(containerId(t))));
    }

    /**
     * Hook run once per type before its container is first used.
     */
    protected CompletableFuture<Void> createContainerIfNecessaryAsync(Class<?> type) {
        return CompletableFuture.completedFuture(null);
    }
}
