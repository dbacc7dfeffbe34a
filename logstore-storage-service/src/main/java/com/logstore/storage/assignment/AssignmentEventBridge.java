package com.logstore.storage.assignment;

import com.logstore.common.model.AssignmentEvent;
import com.logstore.common.model.ChangeType;
import com.logstore.common.model.UnitMetadata;
import com.logstore.common.util.AddressUtil;
import com.logstore.storage.registry.AssignmentEventHandler;
import com.logstore.storage.registry.RegistryClient;
import com.logstore.storage.registry.RegistryEventType;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listens to the registry's add/remove feed and forwards the changes meant
 * for this node, with the stream resolved into its partition layout.
 *
 * Events addressed to other nodes are dropped. A failed lookup drops the
 * event; the next full poll of the owner repairs the gap.
 */
@Slf4j
public class AssignmentEventBridge {

    private final String nodeAddress;
    private final RegistryClient registryClient;
    private final AssignmentEventCallback callback;

    private final AssignmentEventHandler onUnitAdded;
    private final AssignmentEventHandler onUnitRemoved;

    private final Set<CompletableFuture<?>> pendingLookups = ConcurrentHashMap.newKeySet();
    private volatile boolean started = false;

    public AssignmentEventBridge(String nodeAddress, RegistryClient registryClient,
                                 AssignmentEventCallback callback) {
        this.nodeAddress = AddressUtil.normalize(nodeAddress);
        this.registryClient = registryClient;
        this.callback = callback;
        this.onUnitAdded = event -> handleEvent(event, ChangeType.ADDED);
        this.onUnitRemoved = event -> handleEvent(event, ChangeType.REMOVED);
    }

    /**
     * Subscribe to both event kinds. Call at most once per lifecycle.
     */
    public void start() {
        started = true;
        registryClient.on(RegistryEventType.UNIT_ADDED, onUnitAdded);
        registryClient.on(RegistryEventType.UNIT_REMOVED, onUnitRemoved);
        log.info("Assignment event bridge subscribed for node {}", nodeAddress);
    }

    /**
     * Unsubscribe. The returned future completes once lookups that were
     * in flight have settled; none of them reaches the callback.
     */
    public CompletableFuture<Void> destroy() {
        if (!started) {
            return CompletableFuture.completedFuture(null);
        }
        started = false;
        registryClient.off(RegistryEventType.UNIT_ADDED, onUnitAdded);
        registryClient.off(RegistryEventType.UNIT_REMOVED, onUnitRemoved);
        log.info("Assignment event bridge unsubscribed for node {}", nodeAddress);

        CompletableFuture<?>[] pending = pendingLookups.toArray(new CompletableFuture[0]);
        return CompletableFuture.allOf(pending).handle((ignored, error) -> null);
    }

    private void handleEvent(AssignmentEvent event, ChangeType changeType) {
        if (!AddressUtil.sameAddress(nodeAddress, event.getNodeAddress())) {
            log.debug("Ignoring {} event for node {}", changeType, event.getNodeAddress());
            return;
        }
        if (!started) {
            return;
        }
        log.info("Received assignment event type={}: stream={}, watermark={}",
                changeType, event.getStreamId(), event.getWatermark());

        long watermark = event.getWatermark() != null ? event.getWatermark() : -1L;
        CompletableFuture<UnitMetadata> lookup;
        try {
            lookup = registryClient.getUnitMetadata(event.getStreamId());
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> delivery = lookup.handle((unit, error) -> {
            if (error != null) {
                log.warn("Dropping {} event for stream {}: metadata lookup failed: {}",
                        changeType, event.getStreamId(), error.getMessage());
                return null;
            }
            if (unit == null) {
                log.warn("Dropping {} event for stream {}: registry returned no metadata",
                        changeType, event.getStreamId());
                return null;
            }
            if (!started) {
                log.debug("Bridge stopped, dropping resolved {} event for stream {}",
                        changeType, event.getStreamId());
                return null;
            }
            callback.onAssignmentChange(unit, changeType, watermark);
            return null;
        });

        pendingLookups.add(delivery);
        delivery.whenComplete((ignored, error) -> {
            pendingLookups.remove(delivery);
            if (error != null) {
                log.warn("Delivery of {} event for stream {} failed: {}",
                        changeType, event.getStreamId(), error.getMessage(), error);
            }
        });
    }
}
