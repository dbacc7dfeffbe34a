package com.logstore.storage.registry;

import com.logstore.common.exception.ErrorCode;
import com.logstore.common.exception.LogStoreException;
import com.logstore.common.exception.RegistryException;
import com.logstore.common.model.AssignedUnits;
import com.logstore.common.model.AssignmentEvent;
import com.logstore.common.model.UnitMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Registry client backed by the registry's REST gateway.
 *
 * Queries run on the supplied executor so callers never block on HTTP.
 * Push events are delivered to this node over HTTP (see AssignmentController)
 * and handed to {@link #publish(AssignmentEvent)}.
 */
@Slf4j
public class RestRegistryClient implements RegistryClient {

    private final String registryUrl;
    private final RestTemplate restTemplate;
    private final Executor executor;
    private final long requestTimeoutMs;

    private final Map<RegistryEventType, List<AssignmentEventHandler>> handlers =
            new EnumMap<>(RegistryEventType.class);

    public RestRegistryClient(String registryUrl, RestTemplate restTemplate,
                              Executor executor, long requestTimeoutMs) {
        this.registryUrl = registryUrl.endsWith("/")
                ? registryUrl.substring(0, registryUrl.length() - 1)
                : registryUrl;
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.requestTimeoutMs = requestTimeoutMs;
        for (RegistryEventType type : RegistryEventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public CompletableFuture<AssignedUnits> fetchAssignedUnits(String nodeAddress) {
        return CompletableFuture.supplyAsync(() -> {
            String endpoint = registryUrl + "/api/v1/nodes/{nodeAddress}/streams";
            log.debug("Fetching assigned streams of node {} from {}", nodeAddress, registryUrl);
            try {
                AssignedUnits response = restTemplate.getForObject(endpoint, AssignedUnits.class, nodeAddress);
                if (response == null) {
                    throw new RegistryException(ErrorCode.REGISTRY_UNAVAILABLE,
                            "Empty response for assigned streams of node " + nodeAddress);
                }
                return response;
            } catch (RestClientException e) {
                throw new RegistryException(ErrorCode.REGISTRY_UNAVAILABLE,
                        "Failed to fetch assigned streams of node " + nodeAddress + ": " + e.getMessage(), e);
            }
        }, executor).orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<UnitMetadata> getUnitMetadata(String streamIdOrPath) {
        return CompletableFuture.supplyAsync(() -> {
            String endpoint = registryUrl + "/api/v1/streams/{streamId}";
            try {
                UnitMetadata metadata = restTemplate.getForObject(endpoint, UnitMetadata.class, streamIdOrPath);
                if (metadata == null || metadata.getPartitionCount() == null || metadata.getPartitionCount() <= 0) {
                    throw new RegistryException(ErrorCode.INVALID_STREAM_METADATA,
                            "Invalid metadata for stream " + streamIdOrPath + ": " + metadata);
                }
                if (metadata.getStreamId() == null) {
                    metadata.setStreamId(streamIdOrPath);
                }
                return metadata;
            } catch (HttpClientErrorException.NotFound e) {
                throw new RegistryException(ErrorCode.STREAM_NOT_FOUND,
                        "Stream not found: " + streamIdOrPath, e).withDetail("streamId", streamIdOrPath);
            } catch (RestClientException e) {
                throw new RegistryException(ErrorCode.REGISTRY_UNAVAILABLE,
                        "Failed to resolve stream " + streamIdOrPath + ": " + e.getMessage(), e);
            }
        }, executor).orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void on(RegistryEventType type, AssignmentEventHandler handler) {
        handlers.get(type).add(handler);
        log.debug("Registered handler for {} events", type.getEventName());
    }

    @Override
    public void off(RegistryEventType type, AssignmentEventHandler handler) {
        if (handlers.get(type).remove(handler)) {
            log.debug("Unregistered handler for {} events", type.getEventName());
        }
    }

    /**
     * Deliver a pushed registry event to the handlers registered for its kind.
     *
     * @return number of handlers notified
     */
    public int publish(AssignmentEvent event) {
        if (event == null || event.getChangeType() == null
                || event.getStreamId() == null || event.getStreamId().isBlank()
                || event.getNodeAddress() == null || event.getNodeAddress().isBlank()) {
            LogStoreException rejected = new LogStoreException(ErrorCode.INVALID_EVENT,
                    "Malformed assignment event: " + event);
            if (event != null) {
                rejected.withDetail("streamId", event.getStreamId())
                        .withDetail("nodeAddress", event.getNodeAddress())
                        .withDetail("changeType", event.getChangeType());
            }
            throw rejected;
        }

        List<AssignmentEventHandler> targets = handlers.get(RegistryEventType.forChangeType(event.getChangeType()));
        for (AssignmentEventHandler handler : targets) {
            try {
                handler.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Assignment event handler failed for {}: {}", event, e.getMessage(), e);
            }
        }
        return targets.size();
    }

    public int getHandlerCount(RegistryEventType type) {
        return handlers.get(type).size();
    }
}
