package com.enterprise.azure.cosmos;

import com.azure.cosmos.CosmosAsyncClient;
import com.azure.cosmos.models.CosmosContainerProperties;
import com.azure.cosmos.models.PartitionKey;
import com.enterprise.azure.config.CosmosProperties;
import com.enterprise.azure.support.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Writable View-Model Repository
 *
 * 5W1H Analysis:
 * WHO: Projections writing view models
 * WHAT: Insert, replace, delete, truncate per type, drop the database
 * WHEN: Containers (and the database) are created on the first use of a type
 * WHERE: Cosmos DB database azure.cosmos.database-id, one container per type
 * WHY: Projections stay free of provisioning and throttle handling
 * HOW: Inserts go through {@link ThrottledInsertExecutor}; replace and delete go straight to Cosmos
 *
 * Batch insert is sequential and stops at the first item that fails for good;
 * earlier items stay written.
 */
@Repository
@ConditionalOnProperty(prefix = "azure.cosmos", name = "endpoint")
@Slf4j
public class WritableCosmosViewModelRepository extends CosmosViewModelRepository {

    private final ThrottledInsertExecutor insertExecutor;

    public WritableCosmosViewModelRepository(CosmosAsyncClient client,
                                             CosmosProperties properties,
                                             ThrottledInsertExecutor insertExecutor) {
        super(client, properties);
        this.insertExecutor = insertExecutor;
    }

    @Override
    protected CompletableFuture<Void> createContainerIfNecessaryAsync(Class<?> type) {
        String containerId = containerId(type);
        return client.createDatabaseIfNotExists(properties.getDatabaseId())
            .then(database().getContainer(containerId).read())
            .then()
            .onErrorResume(CosmosThrottling::isNotFound, e -> {
                log.info("Creating collection {}", containerId);
                return database()
                    .createContainer(new CosmosContainerProperties(containerId, properties.getPartitionKeyPath()))
                    .then()
                    // Another instance created it between the read and the create
                    .onErrorResume(CosmosThrottling::isConflict, conflict -> {
                        log.info("Collection {} created concurrently, using existing", containerId);
                        return Mono.empty();
                    });
            })
            .toFuture();
    }

    // ---------------------------------------------------------------- insert

    public <T extends ViewModel> CompletableFuture<Void> insertAsync(T item) {
        return getContainerAsync(item.getClass())
            .thenCompose(container -> insertExecutor.insertAsync(container, item));
    }

    public <T extends ViewModel> void insert(T item) {
        Futures.await(insertAsync(item));
    }

    public <T extends ViewModel> CompletableFuture<Void> insertAsync(Iterable<T> items) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (T item : items) {
            chain = chain.thenCompose(ignored -> insertAsync(item));
        }
        return chain;
    }

    public <T extends ViewModel> void insert(Iterable<T> items) {
        Futures.await(insertAsync(items));
    }

    // --------------------------------------------------------- replace/delete

    public <T extends ViewModel> CompletableFuture<Void> saveAsync(T item) {
        return getContainerAsync(item.getClass())
            .thenCompose(container -> container
                .replaceItem(item, item.getId(), new PartitionKey(item.partitionKey()))
                .then()
                .toFuture());
    }

    public <T extends ViewModel> void save(T item) {
        Futures.await(saveAsync(item));
    }

    public <T extends ViewModel> CompletableFuture<Void> updateAsync(T item) {
        return saveAsync(item);
    }

    public <T extends ViewModel> void update(T item) {
        Futures.await(updateAsync(item));
    }

    public <T extends ViewModel> CompletableFuture<Void> deleteAsync(T item) {
        return getContainerAsync(item.getClass())
            .thenCompose(container -> container
                .deleteItem(item.getId(), new PartitionKey(item.partitionKey()))
                .then()
                .toFuture());
    }

    public <T extends ViewModel> void delete(T item) {
        Futures.await(deleteAsync(item));
    }

    // ------------------------------------------------------------- lifecycle

    /**
     * Drops the type's container. The next write recreates it.
     */
    public CompletableFuture<Void> truncateAsync(Class<? extends ViewModel> type) {
        String containerId = containerId(type);
        log.info("Deleting collection {}", containerId);
        // Invalidate on both sides of the delete so an in-flight resolution cannot keep the old handle
        containerCache.invalidate(type);
        return database().getContainer(containerId).delete()
            .then()
            .toFuture()
            .thenRun(() -> containerCache.invalidate(type));
    }

    public void truncate(Class<? extends ViewModel> type) {
        Futures.await(truncateAsync(type));
    }

    public CompletableFuture<Void> deleteDatabaseAsync() {
        log.info("Deleting database {}", properties.getDatabaseId());
        return database().delete()
            .then()
            .toFuture()
            .thenRun(containerCache::clear);
    }

    public void deleteDatabase() {
        Futures.await(deleteDatabaseAsync());
    }
}
