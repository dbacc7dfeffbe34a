package com.logstore.common.model;

import com.logstore.common.util.PartitionUtil;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Fleet partitioning of the unit space. A node only keeps the units whose
 * shard equals its own shard index.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ShardingParams {

    private static final ShardingParams SINGLE = new ShardingParams(1, 0);

    private final int shardCount;
    private final int shardIndex;

    public ShardingParams(int shardCount, int shardIndex) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be positive: " + shardCount);
        }
        if (shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException(
                    "shardIndex must be in [0, " + shardCount + "): " + shardIndex);
        }
        this.shardCount = shardCount;
        this.shardIndex = shardIndex;
    }

    public static ShardingParams singleShard() {
        return SINGLE;
    }

    public boolean isInScope(UnitKey key) {
        return shardCount == 1 || PartitionUtil.shardOf(key, shardCount) == shardIndex;
    }
}
