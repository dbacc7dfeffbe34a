package com.logstore.common.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * Identifies one partition of a stream: the unit of storage responsibility.
 * Ordered by stream id, then partition index.
 */
@Getter
@EqualsAndHashCode
public final class UnitKey implements Comparable<UnitKey> {

    public static final char SEPARATOR = '#';

    private static final Comparator<UnitKey> ORDER = Comparator
            .comparing(UnitKey::getStreamId)
            .thenComparingInt(UnitKey::getPartition);

    private final String streamId;
    private final int partition;

    public UnitKey(String streamId, int partition) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId must not be blank");
        }
        if (partition < 0) {
            throw new IllegalArgumentException("partition must be non-negative: " + partition);
        }
        this.streamId = streamId;
        this.partition = partition;
    }

    public static UnitKey of(String streamId, int partition) {
        return new UnitKey(streamId, partition);
    }

    /**
     * Parse the {@code streamId#partition} form produced by {@link #toString()}.
     * Stream ids may themselves contain '#', so the last separator wins.
     */
    public static UnitKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("unit key must not be null");
        }
        int idx = value.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Invalid unit key: " + value);
        }
        try {
            return new UnitKey(value.substring(0, idx), Integer.parseInt(value.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid partition in unit key: " + value, e);
        }
    }

    @Override
    public int compareTo(UnitKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return streamId + SEPARATOR + partition;
    }
}
