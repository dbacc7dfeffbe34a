package com.logstore.storage.registry;

import com.logstore.common.model.AssignmentEvent;

/**
 * Receives raw assignment events from the registry feed.
 * Handlers are unregistered by identity.
 */
@FunctionalInterface
public interface AssignmentEventHandler {

    void onEvent(AssignmentEvent event);
}
