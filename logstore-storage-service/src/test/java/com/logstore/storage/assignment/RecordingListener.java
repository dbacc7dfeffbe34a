package com.logstore.storage.assignment;

import com.logstore.common.model.UnitKey;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Records listener calls in arrival order
 */
class RecordingListener implements UnitAssignmentListener {

    final List<UnitKey> added = new CopyOnWriteArrayList<>();
    final List<UnitKey> removed = new CopyOnWriteArrayList<>();

    @Override
    public void onUnitAdded(UnitKey key) {
        added.add(key);
    }

    @Override
    public void onUnitRemoved(UnitKey key) {
        removed.add(key);
    }

    static List<UnitKey> keys(String... values) {
        return Arrays.stream(values).map(UnitKey::parse).collect(Collectors.toList());
    }
}
