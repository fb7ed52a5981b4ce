package com.example.guardianservice.overhaul.model;

import java.util.List;

/**
 * @param level     displayed tier number (1, 5, 10, ...)
 * @param threshold experience needed to reach the tier
 */
public record TierTemplate(
        int level,
        long threshold,
        String roleName,
        List<String> unlockedCapabilities
) {
    public TierTemplate {
        unlockedCapabilities = unlockedCapabilities == null ? List.of() : List.copyOf(unlockedCapabilities);
    }
}
