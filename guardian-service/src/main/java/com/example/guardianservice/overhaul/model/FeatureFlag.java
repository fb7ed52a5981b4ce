package com.example.guardianservice.overhaul.model;

import com.example.guardianservice.exception.ConfigurationValidationException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Optional features an overhaul can set up. Declaration order is the order their
 * setup steps run in.
 */
public enum FeatureFlag {
    LEVELING("leveling"),
    REACTION_ROLES("reaction_roles"),
    WELCOME("welcome"),
    VIP_LOUNGE("vip_lounge"),
    GAMING("gaming");

    private final String key;

    FeatureFlag(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Parses a comma separated list such as {@code "leveling, reaction_roles"}.
     * Unknown tokens reject the whole list.
     */
    public static Set<FeatureFlag> parse(String raw) {
        EnumSet<FeatureFlag> flags = EnumSet.noneOf(FeatureFlag.class);
        if (raw == null || raw.isBlank()) {
            return flags;
        }
        List<String> unknown = new ArrayList<>();
        for (String token : raw.split(",")) {
            String normalized = token.trim()
                    .replaceAll("([a-z])([A-Z])", "$1_$2")
                    .replace('-', '_')
                    .replace(' ', '_')
                    .toLowerCase(Locale.ROOT);
            if (normalized.isEmpty()) {
                continue;
            }
            FeatureFlag match = null;
            for (FeatureFlag flag : values()) {
                if (flag.key.equals(normalized)) {
                    match = flag;
                    break;
                }
            }
            if (match == null) {
                unknown.add(token.trim());
            } else {
                flags.add(match);
            }
        }
        if (!unknown.isEmpty()) {
            throw ConfigurationValidationException.of("Unknown feature flag(s): " + String.join(", ", unknown));
        }
        return flags;
    }
}
