package com.logstore.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot of the stream partitions this node is responsible for
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentStatusResponse {
    private String nodeAddress;
    private boolean running;
    private Long lastWatermark;
    private Integer unitCount;

    /**
     * Units in "streamId#partition" form, ascending
     */
    private List<String> units;

    private Integer shardCount;
    private Integer shardIndex;
    private Long timestamp;
}
