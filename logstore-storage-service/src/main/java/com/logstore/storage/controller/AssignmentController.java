package com.logstore.storage.controller;

import com.logstore.common.exception.ErrorCode;
import com.logstore.common.exception.LogStoreException;
import com.logstore.common.model.AssignmentEvent;
import com.logstore.common.model.UnitKey;
import com.logstore.storage.dto.AssignmentStatusResponse;
import com.logstore.storage.dto.RegistryEventResponse;
import com.logstore.storage.registry.RestRegistryClient;
import com.logstore.storage.service.AssignmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST Controller for assignment status and registry push events
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/storage")
@RequiredArgsConstructor
public class AssignmentController {

    private final AssignmentService assignmentService;
    private final RestRegistryClient registryClient;

    /**
     * Stream partitions currently stored by this node
     * Endpoint: GET /api/v1/storage/assignments
     */
    @GetMapping("/assignments")
    public ResponseEntity<AssignmentStatusResponse> getAssignments() {
        return ResponseEntity.ok(assignmentService.getStatus());
    }

    /**
     * Endpoint: GET /api/v1/storage/assignments/{streamId}/{partition}
     */
    @GetMapping("/assignments/{streamId}/{partition}")
    public ResponseEntity<Map<String, Object>> isAssigned(@PathVariable String streamId,
                                                          @PathVariable int partition) {
        UnitKey key;
        try {
            key = UnitKey.of(streamId, partition);
        } catch (IllegalArgumentException e) {
            throw new LogStoreException(ErrorCode.INVALID_UNIT_KEY, e.getMessage(), e)
                    .withDetail("streamId", streamId)
                    .withDetail("partition", partition);
        }
        return ResponseEntity.ok(Map.of(
                "unit", key.toString(),
                "assigned", assignmentService.isAssigned(key)));
    }

    /**
     * Assignment change pushed by the registry
     * Endpoint: POST /api/v1/storage/registry/events
     */
    @PostMapping("/registry/events")
    public ResponseEntity<RegistryEventResponse> receiveRegistryEvent(@RequestBody AssignmentEvent event) {
        log.debug("Received registry event: {}", event);
        int notified = registryClient.publish(event);
        return ResponseEntity.ok(RegistryEventResponse.builder()
                .accepted(true)
                .handlersNotified(notified)
                .message(notified > 0 ? "Event dispatched" : "No active subscribers")
                .build());
    }
}
