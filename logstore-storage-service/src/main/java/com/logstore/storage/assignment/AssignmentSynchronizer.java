package com.logstore.storage.assignment;

import com.logstore.common.model.AssignedUnits;
import com.logstore.common.model.ChangeType;
import com.logstore.common.model.ShardingParams;
import com.logstore.common.model.UnitKey;
import com.logstore.common.model.UnitMetadata;
import com.logstore.storage.registry.RegistryClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the set of stream partitions this node is responsible for in sync with the registry.
 *
 * Two inputs feed the set:
 * - a periodic full poll of the registry (source of truth, repairs missed events)
 * - the registry's add/remove push feed, via {@link AssignmentEventBridge}
 *
 * Both are applied under one lock, so listeners see every effective transition
 * exactly once. Watermarks are recorded but not used for ordering: the last
 * applied input wins until the next poll.
 *
 * Lifecycle: {@link #start()}, then {@link #destroy()}. The instance may be started
 * again after destroy(); work left over from an earlier run is discarded. Calling
 * start() on a running synchronizer is not supported and is not checked.
 */
@Slf4j
public class AssignmentSynchronizer {

    private final String nodeAddress;
    private final ShardingParams shardingParams;
    private final long pollIntervalMs;
    private final long shutdownTimeoutMs;
    private final RegistryClient registryClient;
    private final UnitAssignmentListener listener;
    private final AssignmentEventBridge eventBridge;

    private final Object stateLock = new Object();

    // guarded by stateLock
    private final TreeSet<UnitKey> currentUnits = new TreeSet<>();
    private boolean running = false;
    private long generation = 0L;
    private long lastWatermark = -1L;
    private ScheduledFuture<?> nextPoll;

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile ScheduledExecutorService poller;
    private volatile CompletableFuture<Void> firstPoll = new CompletableFuture<>();

    public AssignmentSynchronizer(String nodeAddress,
                                  ShardingParams shardingParams,
                                  long pollIntervalMs,
                                  long shutdownTimeoutMs,
                                  RegistryClient registryClient,
                                  UnitAssignmentListener listener) {
        if (nodeAddress == null || nodeAddress.isBlank()) {
            throw new IllegalArgumentException("nodeAddress must not be blank");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive: " + pollIntervalMs);
        }
        this.nodeAddress = nodeAddress;
        this.shardingParams = shardingParams != null ? shardingParams : ShardingParams.singleShard();
        this.pollIntervalMs = pollIntervalMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.registryClient = registryClient;
        this.listener = listener;
        this.eventBridge = new AssignmentEventBridge(nodeAddress, registryClient, this::onAssignmentChange);
    }

    /**
     * Start polling (first poll immediately) and listening to assignment events.
     *
     * @return completes once the first poll attempt has settled, whether or not it succeeded
     */
    public CompletableFuture<Void> start() {
        log.info("Starting assignment synchronizer: node={}, shard={}/{}, pollInterval={}ms",
                nodeAddress, shardingParams.getShardIndex(), shardingParams.getShardCount(), pollIntervalMs);

        CompletableFuture<Void> started = new CompletableFuture<>();
        synchronized (stateLock) {
            firstPoll = started;
            poller = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setName("assignment-poller");
                t.setDaemon(true);
                return t;
            });
            running = true;
            generation++;
            schedulePoll(generation, started, 0L);
        }
        eventBridge.start();
        return started;
    }

    /**
     * Stop polling and listening. No mutation and no listener call happens once this
     * method has returned. The future completes when in-flight registry calls have
     * settled, or after the shutdown timeout.
     */
    public CompletableFuture<Void> destroy() {
        ScheduledExecutorService executor;
        synchronized (stateLock) {
            if (!running) {
                return CompletableFuture.completedFuture(null);
            }
            running = false;
            if (nextPoll != null) {
                nextPoll.cancel(false);
                nextPoll = null;
            }
            executor = poller;
            poller = null;
        }
        executor.shutdown();
        firstPoll.complete(null);

        CompletableFuture<Void> bridgeStopped = eventBridge.destroy();
        CompletableFuture<?>[] pending = inFlight.toArray(new CompletableFuture[0]);
        log.info("Assignment synchronizer stopping, awaiting {} in-flight poll(s)", pending.length);

        return CompletableFuture.allOf(bridgeStopped, CompletableFuture.allOf(pending))
                .handle((ignored, error) -> (Void) null)
                .completeOnTimeout(null, shutdownTimeoutMs, TimeUnit.MILLISECONDS)
                .thenRun(() -> log.info("Assignment synchronizer stopped with {} assigned unit(s)",
                        getAssignedUnits().size()));
    }

    public SortedSet<UnitKey> getAssignedUnits() {
        synchronized (stateLock) {
            return Collections.unmodifiableSortedSet(new TreeSet<>(currentUnits));
        }
    }

    public boolean hasAssignedUnit(UnitKey key) {
        synchronized (stateLock) {
            return currentUnits.contains(key);
        }
    }

    /**
     * Highest watermark seen in an applied poll or event; -1 if none yet.
     */
    public long getLastWatermark() {
        synchronized (stateLock) {
            return lastWatermark;
        }
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return running;
        }
    }

    public String getNodeAddress() {
        return nodeAddress;
    }

    public ShardingParams getShardingParams() {
        return shardingParams;
    }

    // caller holds stateLock
    private boolean isCurrent(long pollGeneration) {
        return running && generation == pollGeneration;
    }

    // caller holds stateLock
    private void schedulePoll(long pollGeneration, CompletableFuture<Void> first, long delayMs) {
        if (!isCurrent(pollGeneration)) {
            return;
        }
        nextPoll = poller.schedule(() -> poll(pollGeneration, first), delayMs, TimeUnit.MILLISECONDS);
    }

    private void poll(long pollGeneration, CompletableFuture<Void> first) {
        CompletableFuture<Void> cycle = new CompletableFuture<>();
        CompletableFuture<AssignedUnits> fetch;
        // the fetch is issued under the lock so that none starts once destroy() has returned
        synchronized (stateLock) {
            if (!isCurrent(pollGeneration)) {
                first.complete(null);
                return;
            }
            inFlight.add(cycle);
            try {
                fetch = registryClient.fetchAssignedUnits(nodeAddress);
            } catch (RuntimeException e) {
                fetch = CompletableFuture.failedFuture(e);
            }
        }

        fetch.handle((result, error) -> {
            if (error != null) {
                log.warn("Failed to fetch assigned streams, retrying in {}ms: {}",
                        pollIntervalMs, error.getMessage());
            } else if (result == null) {
                log.warn("Registry returned no assignment result, retrying in {}ms", pollIntervalMs);
            } else {
                applyPollResult(result, pollGeneration);
            }
            return null;
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Assignment poll failed: {}", error.getMessage(), error);
            }
            cycle.complete(null);
        });

        cycle.whenComplete((ignored, error) -> {
            inFlight.remove(cycle);
            first.complete(null);
            synchronized (stateLock) {
                schedulePoll(pollGeneration, first, pollIntervalMs);
            }
        });
    }

    private void applyPollResult(AssignedUnits result, long pollGeneration) {
        TreeSet<UnitKey> expanded = new TreeSet<>();
        List<UnitMetadata> units = result.getUnits() != null ? result.getUnits() : Collections.emptyList();
        for (UnitMetadata unit : units) {
            if (unit != null) {
                addInScope(unit, expanded);
            }
        }

        synchronized (stateLock) {
            if (!isCurrent(pollGeneration)) {
                return;
            }
            TreeSet<UnitKey> toRemove = new TreeSet<>(currentUnits);
            toRemove.removeAll(expanded);
            TreeSet<UnitKey> toAdd = new TreeSet<>(expanded);
            toAdd.removeAll(currentUnits);

            updateWatermark(result.getWatermark());
            if (toAdd.isEmpty() && toRemove.isEmpty()) {
                log.debug("Poll at watermark {}: assignments unchanged ({} units)",
                        result.getWatermark(), currentUnits.size());
                return;
            }
            log.info("Poll at watermark {}: {} unit(s) added, {} unit(s) removed",
                    result.getWatermark(), toAdd.size(), toRemove.size());

            for (UnitKey key : toRemove) {
                currentUnits.remove(key);
                notifyRemoved(key);
            }
            for (UnitKey key : toAdd) {
                currentUnits.add(key);
                notifyAdded(key);
            }
        }
    }

    private void onAssignmentChange(UnitMetadata unit, ChangeType changeType, long watermark) {
        TreeSet<UnitKey> keys = new TreeSet<>();
        addInScope(unit, keys);

        synchronized (stateLock) {
            if (!running) {
                return;
            }
            updateWatermark(watermark);
            int changed = 0;
            for (UnitKey key : keys) {
                if (changeType == ChangeType.ADDED) {
                    if (currentUnits.add(key)) {
                        notifyAdded(key);
                        changed++;
                    }
                } else if (currentUnits.remove(key)) {
                    notifyRemoved(key);
                    changed++;
                }
            }
            log.info("Applied {} event for stream {} at watermark {}: {} unit(s) changed",
                    changeType, unit.getStreamId(), watermark, changed);
        }
    }

    private void addInScope(UnitMetadata unit, Collection<UnitKey> target) {
        for (UnitKey key : unit.toUnitKeys()) {
            if (shardingParams.isInScope(key)) {
                target.add(key);
            }
        }
    }

    private void updateWatermark(Long watermark) {
        if (watermark != null && watermark > lastWatermark) {
            lastWatermark = watermark;
        }
    }

    private void notifyAdded(UnitKey key) {
        try {
            listener.onUnitAdded(key);
        } catch (RuntimeException e) {
            log.error("Listener failed on added unit {}: {}", key, e.getMessage(), e);
        }
    }

    private void notifyRemoved(UnitKey key) {
        try {
            listener.onUnitRemoved(key);
        } catch (RuntimeException e) {
            log.error("Listener failed on removed unit {}: {}", key, e.getMessage(), e);
        }
    }
}
