package com.logstore.storage.service;

import com.logstore.common.model.UnitKey;
import com.logstore.storage.assignment.UnitAssignmentListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs every change of this node's storage responsibilities
 */
@Slf4j
@Component
public class AssignmentChangeLogger implements UnitAssignmentListener {

    @Override
    public void onUnitAdded(UnitKey key) {
        log.info("Now storing stream partition {}", key);
    }

    @Override
    public void onUnitRemoved(UnitKey key) {
        log.info("No longer storing stream partition {}", key);
    }
}
