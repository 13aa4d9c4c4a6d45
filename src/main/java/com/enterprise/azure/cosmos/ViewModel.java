package com.enterprise.azure.cosmos;

/**
 * A document projected into Cosmos DB. One container per view-model type,
 * named after the type's simple class name.
 */
public interface ViewModel {

    String getId();

    /**
     * Value of the container's partition key for this document. Defaults to
     * the id, matching the default "/id" partition key path.
     */
    default String partitionKey() {
        return getId();
    }
}
