package com.logstore.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Full-state answer of the registry: every stream currently assigned to a node
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssignedUnits {
    @Builder.Default
    private List<UnitMetadata> units = new ArrayList<>();
    private Long watermark;
}
