package com.example.guardianservice.config;

import java.time.Duration;

/**
 * Time-to-live of the store caches, per record type.
 */
public record CacheSettings(
        Duration profileTtl,
        Duration tierTtl,
        Duration reactionRoleTtl,
        Duration panelTtl,
        Duration remoteStateTtl
) {
    public static CacheSettings defaults() {
        return new CacheSettings(Duration.ofMinutes(5), Duration.ofMinutes(10), Duration.ofMinutes(5),
                Duration.ofMinutes(10), Duration.ofMinutes(1));
    }
}
