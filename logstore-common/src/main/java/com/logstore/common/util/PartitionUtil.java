package com.logstore.common.util;

import com.logstore.common.model.UnitKey;

import java.nio.charset.StandardCharsets;

/**
 * Utility for shard placement of stream partitions
 */
public final class PartitionUtil {

    private PartitionUtil() {
    }

    /**
     * Shard owning the given unit. Stable across JVMs and releases.
     */
    public static int shardOf(UnitKey key, int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be positive: " + shardCount);
        }
        byte[] bytes = key.toString().getBytes(StandardCharsets.UTF_8);
        return Math.floorMod(murmur2(bytes), shardCount);
    }

    /**
     * Murmur2 hash algorithm (similar to Kafka)
     */
    public static int murmur2(byte[] data) {
        int length = data.length;
        int seed = 0x9747b28c;

        int m = 0x5bd1e995;
        int r = 24;

        int h = seed ^ length;
        int length4 = length / 4;

        for (int i = 0; i < length4; i++) {
            int i4 = i * 4;
            int k = (data[i4] & 0xff) + ((data[i4 + 1] & 0xff) << 8) +
                    ((data[i4 + 2] & 0xff) << 16) + ((data[i4 + 3] & 0xff) << 24);
            k *= m;
            k ^= k >>> r;
            k *= m;
            h *= m;
            h ^= k;
        }

        // trailing bytes
        switch (length % 4) {
            case 3:
                h ^= (data[(length & ~3) + 2] & 0xff) << 16;
            case 2:
                h ^= (data[(length & ~3) + 1] & 0xff) << 8;
            case 1:
                h ^= data[length & ~3] & 0xff;
                h *= m;
        }

        h ^= h >>> 13;
        h *= m;
        h ^= h >>> 15;

        return h;
    }
}
