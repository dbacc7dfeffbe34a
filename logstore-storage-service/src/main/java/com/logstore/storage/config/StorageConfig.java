package com.logstore.storage.config;

import com.logstore.common.model.ShardingParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized configuration for the LogStore storage node
 */
@Configuration
@ConfigurationProperties(prefix = "logstore.storage")
@Data
public class StorageConfig {

    // ========== NODE CONFIGURATION ==========
    private NodeConfig node = new NodeConfig();

    @Data
    public static class NodeConfig {
        /**
         * Registry address of this storage node
         */
        private String address = "0x0000000000000000000000000000000000000000";
    }

    // ========== ASSIGNMENT SYNC CONFIGURATION ==========
    private AssignmentConfig assignment = new AssignmentConfig();

    @Data
    public static class AssignmentConfig {
        private Boolean enabled = true;
        private Long pollIntervalMs = 600000L;      // 10 minutes, measured from the end of the previous poll
        private Long shutdownTimeoutMs = 5000L;
    }

    // ========== SHARDING CONFIGURATION ==========
    private ShardingConfig sharding = new ShardingConfig();

    @Data
    public static class ShardingConfig {
        private Integer shardCount = 1;
        private Integer shardIndex = 0;
    }

    // ========== REGISTRY CONFIGURATION ==========
    private RegistryConfig registry = new RegistryConfig();

    @Data
    public static class RegistryConfig {
        private String url = "http://localhost:8801";
        private Long requestTimeoutMs = 10000L;
    }

    /**
     * Sharding parameters of this node; fails on out-of-range values
     */
    public ShardingParams getShardingParams() {
        return new ShardingParams(sharding.getShardCount(), sharding.getShardIndex());
    }
}
