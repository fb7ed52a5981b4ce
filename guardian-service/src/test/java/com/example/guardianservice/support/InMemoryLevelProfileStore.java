package com.example.guardianservice.support;

import com.example.guardianservice.entity.LevelProfile;
import com.example.guardianservice.store.LevelProfileStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds copies, like a database row, so callers never share state with the store.
 */
public class InMemoryLevelProfileStore implements LevelProfileStore {

    private final Map<String, LevelProfile> rows = new ConcurrentHashMap<>();
    private volatile RuntimeException saveFailure;

    /**
     * Every later save throws {@code failure} until cleared with {@code null}.
     */
    public void failSaves(RuntimeException failure) {
        this.saveFailure = failure;
    }

    @Override
    public Optional<LevelProfile> find(long guildId, long userId) {
        return Optional.ofNullable(rows.get(guildId + ":" + userId)).map(LevelProfile::copy);
    }

    @Override
    public void save(LevelProfile profile) {
        RuntimeException failure = saveFailure;
        if (failure != null) {
            throw failure;
        }
        rows.put(profile.getGuildId() + ":" + profile.getUserId(), profile.copy());
    }

    @Override
    public List<LevelProfile> top(long guildId, int limit) {
        return rows.values().stream()
                .filter(p -> p.getGuildId() == guildId)
                .sorted(Comparator.comparingLong(LevelProfile::getXp).reversed())
                .limit(limit)
                .map(LevelProfile::copy)
                .toList();
    }

    @Override
    public void evictGuild(long guildId) {
    }
}
