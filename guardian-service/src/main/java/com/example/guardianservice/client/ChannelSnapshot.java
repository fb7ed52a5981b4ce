package com.example.guardianservice.client;

import java.util.List;

/**
 * @param parentId owning category, {@code null} for categories and top-level channels
 */
public record ChannelSnapshot(
        long id,
        String name,
        Type type,
        Long parentId,
        List<PermissionOverwrite> overwrites
) {
    public ChannelSnapshot {
        overwrites = overwrites == null ? List.of() : List.copyOf(overwrites);
    }

    public boolean isCategory() {
        return type == Type.CATEGORY;
    }

    public enum Type {
        CATEGORY,
        TEXT,
        VOICE
    }
}
