package com.logstore.storage.registry;

import com.logstore.common.model.ChangeType;

/**
 * Assignment event kinds published by the registry
 */
public enum RegistryEventType {
    UNIT_ADDED("unitAdded", ChangeType.ADDED),
    UNIT_REMOVED("unitRemoved", ChangeType.REMOVED);

    private final String eventName;
    private final ChangeType changeType;

    RegistryEventType(String eventName, ChangeType changeType) {
        this.eventName = eventName;
        this.changeType = changeType;
    }

    public String getEventName() {
        return eventName;
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public static RegistryEventType forChangeType(ChangeType changeType) {
        return changeType == ChangeType.ADDED ? UNIT_ADDED : UNIT_REMOVED;
    }
}
