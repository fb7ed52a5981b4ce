package com.example.guardianservice.config;

import java.time.Duration;

/**
 * @param lockAtMostFor   upper bound a per-guild run lock is held if the process dies mid-run
 * @param barWidth        segments in the rendered progress bar
 * @param confirmationTtl lifetime of a confirmation token
 * @param statusTextLimit maximum characters of the rendered status and summary text
 */
public record OverhaulSettings(
        Duration lockAtMostFor,
        int barWidth,
        Duration confirmationTtl,
        int statusTextLimit
) {
    public static OverhaulSettings defaults() {
        return new OverhaulSettings(Duration.ofHours(2), 20, Duration.ofMinutes(5), 1900);
    }
}
