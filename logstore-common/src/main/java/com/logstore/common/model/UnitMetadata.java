package com.logstore.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stream descriptor as resolved from the registry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnitMetadata {
    private String streamId;
    private Integer partitionCount;

    /**
     * One key per partition, ascending. Empty when the descriptor is incomplete.
     */
    public List<UnitKey> toUnitKeys() {
        if (streamId == null || streamId.isBlank() || partitionCount == null || partitionCount <= 0) {
            return Collections.emptyList();
        }
        List<UnitKey> keys = new ArrayList<>(partitionCount);
        for (int p = 0; p < partitionCount; p++) {
            keys.add(new UnitKey(streamId, p));
        }
        return keys;
    }
}
