package com.example.guardianservice.config;

import java.time.Duration;

/**
 * Message experience policy.
 */
public record LevelingSettings(
        int xpMin,
        int xpMax,
        Duration cooldown,
        long dailyCap
) {
    public LevelingSettings {
        if (xpMin < 0 || xpMax < xpMin) {
            throw new IllegalArgumentException("Invalid message XP range: " + xpMin + ".." + xpMax);
        }
    }

    public static LevelingSettings defaults() {
        return new LevelingSettings(10, 20, Duration.ofSeconds(60), 500);
    }
}
