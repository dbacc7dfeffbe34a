package com.logstore.common.model;

import com.logstore.common.util.PartitionUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shard filtering of stream partitions across a fleet
 */
public class ShardingParamsTest {

    private static List<UnitKey> sampleKeys() {
        List<UnitKey> keys = new ArrayList<>();
        for (int s = 0; s < 20; s++) {
            for (int p = 0; p < 8; p++) {
                keys.add(UnitKey.of("0x" + Integer.toHexString(s * 7919) + "/stream-" + s, p));
            }
        }
        return keys;
    }

    @Test
    void testSingleShardKeepsEverything() {
        ShardingParams single = ShardingParams.singleShard();
        for (UnitKey key : sampleKeys()) {
            assertTrue(single.isInScope(key));
        }
    }

    @Test
    void testEveryKeyBelongsToExactlyOneShard() {
        int shardCount = 3;
        List<ShardingParams> fleet = List.of(
                new ShardingParams(shardCount, 0),
                new ShardingParams(shardCount, 1),
                new ShardingParams(shardCount, 2));

        for (UnitKey key : sampleKeys()) {
            long owners = fleet.stream().filter(p -> p.isInScope(key)).count();
            assertEquals(1, owners, "Key " + key + " must have exactly one owner");
        }
    }

    @Test
    void testShardPlacementIsStable() {
        UnitKey key = UnitKey.of("stream-1", 1);
        int shard = PartitionUtil.shardOf(key, 5);
        for (int i = 0; i < 10; i++) {
            assertEquals(shard, PartitionUtil.shardOf(UnitKey.of("stream-1", 1), 5));
        }
        assertTrue(shard >= 0 && shard < 5);
    }

    @Test
    void testKeysSpreadOverShards() {
        int[] counts = new int[4];
        for (UnitKey key : sampleKeys()) {
            counts[PartitionUtil.shardOf(key, 4)]++;
        }
        for (int count : counts) {
            assertTrue(count > 0, "Every shard should receive some keys");
        }
    }

    @Test
    void testInvalidParamsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ShardingParams(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new ShardingParams(2, 2));
        assertThrows(IllegalArgumentException.class, () -> new ShardingParams(2, -1));
    }
}
