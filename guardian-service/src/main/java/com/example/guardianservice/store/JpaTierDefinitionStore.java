package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.repository.TierDefinitionRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class JpaTierDefinitionStore implements TierDefinitionStore {

    private final TierDefinitionRepository repository;
    private final Cache<Long, List<TierDefinition>> cache;

    public JpaTierDefinitionStore(TierDefinitionRepository repository, CacheSettings cacheSettings) {
        this.repository = repository;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(cacheSettings.tierTtl())
                .build();
    }

    @Override
    public List<TierDefinition> findByGuild(long guildId) {
        return cache.get(guildId, id -> List.copyOf(repository.findByGuildIdOrderByThresholdAsc(id)));
    }

    @Override
    @Transactional
    public void replaceAll(long guildId, List<TierDefinition> tiers) {
        int removed = repository.deleteAllByGuildId(guildId);
        repository.flush();
        tiers.forEach(tier -> tier.setGuildId(guildId));
        repository.saveAll(tiers);
        cache.invalidate(guildId);
        log.info("Replaced tier ladder guildId={} removed={} added={}", guildId, removed, tiers.size());
    }

    @Override
    @Transactional
    public boolean setRoleId(long guildId, int level, Long roleId) {
        Optional<TierDefinition> tier = repository.findByGuildIdAndLevel(guildId, level);
        if (tier.isEmpty()) {
            return false;
        }
        tier.get().setRoleId(roleId);
        repository.save(tier.get());
        cache.invalidate(guildId);
        return true;
    }

    @Override
    public void evictGuild(long guildId) {
        cache.invalidate(guildId);
    }
}
