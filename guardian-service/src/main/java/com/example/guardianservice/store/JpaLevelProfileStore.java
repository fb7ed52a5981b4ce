package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.LevelProfile;
import com.example.guardianservice.repository.LevelProfileRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Level profiles fronted by a Caffeine cache. The cache only ever holds copies of rows the
 * database accepted; callers get their own copies to modify.
 */
@Component
@Slf4j
public class JpaLevelProfileStore implements LevelProfileStore {

    private final LevelProfileRepository repository;
    private final Cache<ProfileKey, LevelProfile> cache;

    public JpaLevelProfileStore(LevelProfileRepository repository, CacheSettings cacheSettings) {
        this.repository = repository;
        this.cache = Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(cacheSettings.profileTtl())
                .build();
    }

    @Override
    public Optional<LevelProfile> find(long guildId, long userId) {
        ProfileKey key = new ProfileKey(guildId, userId);
        LevelProfile cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached.copy());
        }
        Optional<LevelProfile> loaded = repository.findByGuildIdAndUserId(guildId, userId);
        loaded.ifPresent(profile -> cache.put(key, profile.copy()));
        return loaded;
    }

    @Override
    public void save(LevelProfile profile) {
        ProfileKey key = new ProfileKey(profile.getGuildId(), profile.getUserId());
        try {
            repository.upsert(profile);
        } catch (RuntimeException e) {
            cache.invalidate(key);
            log.warn("Level profile upsert failed, cache entry dropped: guildId={} userId={}",
                    profile.getGuildId(), profile.getUserId());
            throw e;
        }
        cache.put(key, profile.copy());
    }

    @Override
    public List<LevelProfile> top(long guildId, int limit) {
        return repository.findByGuildIdOrderByXpDesc(guildId, PageRequest.of(0, limit));
    }

    @Override
    public void evictGuild(long guildId) {
        cache.asMap().keySet().removeIf(key -> key.guildId() == guildId);
        log.debug("Evicted cached level profiles for guildId={}", guildId);
    }

    private record ProfileKey(long guildId, long userId) {
    }
}
