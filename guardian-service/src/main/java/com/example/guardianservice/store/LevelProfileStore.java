package com.example.guardianservice.store;

import com.example.guardianservice.entity.LevelProfile;

import java.util.List;
import java.util.Optional;

/**
 * Keyed access to level profiles. Writes are upserts on (guildId, userId).
 */
public interface LevelProfileStore {

    Optional<LevelProfile> find(long guildId, long userId);

    void save(LevelProfile profile);

    /**
     * Profiles of a guild ordered by experience, highest first.
     */
    List<LevelProfile> top(long guildId, int limit);

    void evictGuild(long guildId);
}
