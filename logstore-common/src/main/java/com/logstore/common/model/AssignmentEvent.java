package com.logstore.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Push notification from the registry: a stream was added to or removed from a node
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssignmentEvent {
    private String streamId;

    /**
     * Address of the node the registry addressed this change to
     */
    private String nodeAddress;

    private ChangeType changeType;

    /**
     * Registry freshness marker (block number)
     */
    private Long watermark;
}
