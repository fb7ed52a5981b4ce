package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.RemoteResource;
import com.example.guardianservice.repository.RemoteResourceRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@Slf4j
public class JpaRemoteStateStore implements RemoteStateStore {

    private final RemoteResourceRepository repository;
    private final Cache<Long, List<RemoteResource>> cache;

    public JpaRemoteStateStore(RemoteResourceRepository repository, CacheSettings cacheSettings) {
        this.repository = repository;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1_000)
                .expireAfterWrite(cacheSettings.remoteStateTtl())
                .build();
    }

    @Override
    public List<RemoteResource> findByGuild(long guildId) {
        return cache.get(guildId, id -> List.copyOf(repository.findByGuildId(id)));
    }

    @Override
    @Transactional
    public void record(long guildId, RemoteResource.Kind kind, String templateKey, long remoteId) {
        repository.upsert(guildId, kind.name(), templateKey, remoteId);
        cache.invalidate(guildId);
        log.debug("Recorded remote resource guildId={} kind={} key='{}' id={}", guildId, kind, templateKey, remoteId);
    }

    @Override
    @Transactional
    public void forget(long guildId, RemoteResource.Kind kind, String templateKey) {
        repository.deleteOne(guildId, kind, templateKey);
        cache.invalidate(guildId);
    }

    @Override
    public void evictGuild(long guildId) {
        cache.invalidate(guildId);
    }
}
