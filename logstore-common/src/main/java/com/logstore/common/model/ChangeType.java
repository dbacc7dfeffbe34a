package com.logstore.common.model;

/**
 * Direction of an assignment change announced by the registry.
 */
public enum ChangeType {
    ADDED,
    REMOVED
}
