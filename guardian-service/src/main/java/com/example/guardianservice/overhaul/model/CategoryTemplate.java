package com.example.guardianservice.overhaul.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param visibility role name to can-view; {@code @everyone} addresses the default role
 */
public record CategoryTemplate(
        String name,
        List<ChannelTemplate> channels,
        Map<String, Boolean> visibility
) {
    public static final String EVERYONE = "@everyone";

    public CategoryTemplate {
        channels = channels == null ? List.of() : List.copyOf(channels);
        visibility = visibility == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(visibility));
    }

    public static CategoryTemplate open(String name, List<ChannelTemplate> channels) {
        return new CategoryTemplate(name, channels, Map.of());
    }
}
