package com.example.guardianservice.support;

import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.store.TierDefinitionStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTierDefinitionStore implements TierDefinitionStore {

    private final Map<Long, List<TierDefinition>> ladders = new ConcurrentHashMap<>();
    private int replaceCount;

    @Override
    public List<TierDefinition> findByGuild(long guildId) {
        return List.copyOf(ladders.getOrDefault(guildId, List.of()));
    }

    @Override
    public synchronized void replaceAll(long guildId, List<TierDefinition> tiers) {
        List<TierDefinition> sorted = new ArrayList<>(tiers);
        sorted.forEach(tier -> tier.setGuildId(guildId));
        sorted.sort(Comparator.comparingLong(TierDefinition::getThreshold));
        ladders.put(guildId, sorted);
        replaceCount++;
    }

    @Override
    public synchronized boolean setRoleId(long guildId, int level, Long roleId) {
        for (TierDefinition tier : ladders.getOrDefault(guildId, List.of())) {
            if (tier.getLevel() == level) {
                tier.setRoleId(roleId);
                return true;
            }
        }
        return false;
    }

    @Override
    public void evictGuild(long guildId) {
    }

    public synchronized int replaceCount() {
        return replaceCount;
    }
}
