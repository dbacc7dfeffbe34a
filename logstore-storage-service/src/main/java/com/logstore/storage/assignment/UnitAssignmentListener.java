package com.logstore.storage.assignment;

import com.logstore.common.model.UnitKey;

/**
 * Notified once per effective change of the set of units this node stores.
 * Invoked while the synchronizer holds its state lock: implementations must return promptly.
 */
public interface UnitAssignmentListener {

    void onUnitAdded(UnitKey key);

    void onUnitRemoved(UnitKey key);
}
