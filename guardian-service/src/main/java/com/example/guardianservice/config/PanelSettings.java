package com.example.guardianservice.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * @param protectedRoleNames roles never offered on a panel, compared case-insensitively
 */
public record PanelSettings(
        String channelName,
        int pageSize,
        String title,
        Set<String> protectedRoleNames
) {
    public PanelSettings {
        protectedRoleNames = protectedRoleNames.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isProtected(String roleName) {
        return roleName != null && protectedRoleNames.contains(roleName.trim().toLowerCase(Locale.ROOT));
    }

    public static PanelSettings defaults() {
        return new PanelSettings("🎭-reaction-roles", 25, "🎭 Pick your roles",
                Set.of("Owner", "Admin", "Moderator", "Support", "Bots"));
    }
}
