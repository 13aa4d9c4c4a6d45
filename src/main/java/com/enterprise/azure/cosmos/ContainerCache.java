package com.enterprise.azure.cosmos;

import com.azure.cosmos.CosmosAsyncContainer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Resolved container per view-model type.
 *
 * The map holds futures, so concurrent first use of a type shares one
 * resolution instead of racing. A resolution that fails is evicted and the
 * next caller tries again.
 */
public class ContainerCache {

    private final ConcurrentMap<Class<?>, CompletableFuture<CosmosAsyncContainer>> containers =
        new ConcurrentHashMap<>();

    public CompletableFuture<CosmosAsyncContainer> get(
            Class<?> type, Function<Class<?>, CompletableFuture<CosmosAsyncContainer>> resolver) {
        CompletableFuture<CosmosAsyncContainer> container = containers.computeIfAbsent(type, resolver);
        container.whenComplete((resolved, error) -> {
            if (error != null) {
                containers.remove(type, container);
            }
        });
        return container;
    }

    public void invalidate(Class<?> type) {
        containers.remove(type);
    }

    public void clear() {
        containers.clear();
    }

    public boolean contains(Class<?> type) {
        return containers.containsKey(type);
    }
}
