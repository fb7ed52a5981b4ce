package com.example.guardianservice.store;

import com.example.guardianservice.entity.TierDefinition;

import java.util.List;

public interface TierDefinitionStore {

    /**
     * Tiers of a guild ordered by threshold ascending; empty if none configured.
     */
    List<TierDefinition> findByGuild(long guildId);

    /**
     * Replaces the whole tier ladder of a guild in one transaction.
     */
    void replaceAll(long guildId, List<TierDefinition> tiers);

    /**
     * Maps the reward role of one tier.
     *
     * @return {@code false} if the guild has no tier with that level
     */
    boolean setRoleId(long guildId, int level, Long roleId);

    void evictGuild(long guildId);
}
