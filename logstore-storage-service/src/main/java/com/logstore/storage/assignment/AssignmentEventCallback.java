package com.logstore.storage.assignment;

import com.logstore.common.model.ChangeType;
import com.logstore.common.model.UnitMetadata;

/**
 * Resolved assignment change addressed to this node
 */
@FunctionalInterface
public interface AssignmentEventCallback {

    void onAssignmentChange(UnitMetadata unit, ChangeType changeType, long watermark);
}
