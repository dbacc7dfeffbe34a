package com.logstore.storage.registry;

import com.logstore.common.model.AssignedUnits;
import com.logstore.common.model.UnitMetadata;

import java.util.concurrent.CompletableFuture;

/**
 * Client of the stream storage registry.
 */
public interface RegistryClient {

    /**
     * Full-state query: every stream assigned to the given node, with the
     * registry watermark the answer reflects.
     */
    CompletableFuture<AssignedUnits> fetchAssignedUnits(String nodeAddress);

    /**
     * Resolve a stream id (or path) into its descriptor.
     */
    CompletableFuture<UnitMetadata> getUnitMetadata(String streamIdOrPath);

    void on(RegistryEventType type, AssignmentEventHandler handler);

    void off(RegistryEventType type, AssignmentEventHandler handler);
}
