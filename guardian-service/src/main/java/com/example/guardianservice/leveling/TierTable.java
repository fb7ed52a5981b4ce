package com.example.guardianservice.leveling;

import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.exception.ConfigurationValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lookups over a tier ladder ordered by threshold ascending.
 */
public final class TierTable {

    private TierTable() {
    }

    /**
     * Highest tier whose threshold is at most {@code xp}, found by a linear scan.
     */
    public static Optional<TierDefinition> highestReached(List<TierDefinition> ladder, long xp) {
        TierDefinition reached = null;
        for (TierDefinition tier : ladder) {
            if (tier.getThreshold() <= xp) {
                reached = tier;
            } else {
                break;
            }
        }
        return Optional.ofNullable(reached);
    }

    /**
     * @throws ConfigurationValidationException unless thresholds and levels are non-negative and
     *         strictly increasing
     */
    public static void validate(List<TierDefinition> ladder) {
        List<String> violations = new ArrayList<>();
        TierDefinition previous = null;
        for (TierDefinition tier : ladder) {
            if (tier.getThreshold() < 0 || tier.getLevel() < 0) {
                violations.add("Tier " + tier.getLevel() + " has a negative level or threshold");
            }
            if (tier.getRoleName() == null || tier.getRoleName().isBlank()) {
                violations.add("Tier " + tier.getLevel() + " has no role name");
            }
            if (previous != null && tier.getThreshold() <= previous.getThreshold()) {
                violations.add("Tier thresholds must be strictly increasing: " + previous.getThreshold()
                        + " then " + tier.getThreshold());
            }
            if (previous != null && tier.getLevel() <= previous.getLevel()) {
                violations.add("Tier levels must be strictly increasing: " + previous.getLevel()
                        + " then " + tier.getLevel());
            }
            previous = tier;
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationValidationException(violations);
        }
    }
}
