package com.logstore.storage.service;

import com.logstore.common.model.ShardingParams;
import com.logstore.common.model.UnitKey;
import com.logstore.storage.assignment.AssignmentSynchronizer;
import com.logstore.storage.assignment.UnitAssignmentListener;
import com.logstore.storage.config.StorageConfig;
import com.logstore.storage.dto.AssignmentStatusResponse;
import com.logstore.storage.registry.RegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the assignment synchronizer for the lifetime of the application and
 * fans its notifications out to every {@link UnitAssignmentListener} bean.
 */
@Slf4j
@Service
public class AssignmentService {

    private final StorageConfig storageConfig;
    private final List<UnitAssignmentListener> listeners;
    private final AssignmentSynchronizer synchronizer;

    public AssignmentService(StorageConfig storageConfig,
                             RegistryClient registryClient,
                             List<UnitAssignmentListener> listeners) {
        this.storageConfig = storageConfig;
        this.listeners = List.copyOf(listeners);

        ShardingParams shardingParams = storageConfig.getShardingParams();
        this.synchronizer = new AssignmentSynchronizer(
                storageConfig.getNode().getAddress(),
                shardingParams,
                storageConfig.getAssignment().getPollIntervalMs(),
                storageConfig.getAssignment().getShutdownTimeoutMs(),
                registryClient,
                new FanOutListener(this.listeners));
    }

    @PostConstruct
    public void init() {
        if (!Boolean.TRUE.equals(storageConfig.getAssignment().getEnabled())) {
            log.info("Assignment synchronization disabled by configuration");
            return;
        }
        log.info("Assignment service starting for node {} with {} listener(s)",
                storageConfig.getNode().getAddress(), listeners.size());
        synchronizer.start().thenRun(() -> log.info("Initial assignment poll settled: {} unit(s) assigned",
                synchronizer.getAssignedUnits().size()));
    }

    @PreDestroy
    public void shutdown() {
        long timeoutMs = storageConfig.getAssignment().getShutdownTimeoutMs();
        try {
            synchronizer.destroy().get(timeoutMs + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping assignment synchronizer");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Assignment synchronizer did not stop cleanly: {}", e.getMessage());
        }
    }

    public SortedSet<UnitKey> getAssignedUnits() {
        return synchronizer.getAssignedUnits();
    }

    public boolean isAssigned(UnitKey key) {
        return synchronizer.hasAssignedUnit(key);
    }

    public AssignmentStatusResponse getStatus() {
        SortedSet<UnitKey> units = synchronizer.getAssignedUnits();
        ShardingParams shardingParams = synchronizer.getShardingParams();
        return AssignmentStatusResponse.builder()
                .nodeAddress(synchronizer.getNodeAddress())
                .running(synchronizer.isRunning())
                .lastWatermark(synchronizer.getLastWatermark())
                .unitCount(units.size())
                .units(units.stream().map(UnitKey::toString).collect(Collectors.toList()))
                .shardCount(shardingParams.getShardCount())
                .shardIndex(shardingParams.getShardIndex())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    AssignmentSynchronizer getSynchronizer() {
        return synchronizer;
    }

    private static final class FanOutListener implements UnitAssignmentListener {

        private final List<UnitAssignmentListener> delegates;

        private FanOutListener(List<UnitAssignmentListener> delegates) {
            this.delegates = delegates;
        }

        @Override
        public void onUnitAdded(UnitKey key) {
            for (UnitAssignmentListener delegate : delegates) {
                try {
                    delegate.onUnitAdded(key);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed on added unit {}", delegate.getClass().getSimpleName(), key, e);
                }
            }
        }

        @Override
        public void onUnitRemoved(UnitKey key) {
            for (UnitAssignmentListener delegate : delegates) {
                try {
                    delegate.onUnitRemoved(key);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed on removed unit {}", delegate.getClass().getSimpleName(), key, e);
                }
            }
        }
    }
}
