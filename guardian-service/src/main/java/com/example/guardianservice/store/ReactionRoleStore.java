package com.example.guardianservice.store;

import com.example.guardianservice.entity.ReactionRoleEntry;

import java.util.List;

public interface ReactionRoleStore {

    /**
     * Entries of a guild ordered by {@code orderIndex}.
     */
    List<ReactionRoleEntry> findByGuild(long guildId);

    /**
     * Replaces the role list of a guild with exactly the given entries, matched by role id.
     */
    void replaceAll(long guildId, List<ReactionRoleEntry> entries);

    void evictGuild(long guildId);
}
