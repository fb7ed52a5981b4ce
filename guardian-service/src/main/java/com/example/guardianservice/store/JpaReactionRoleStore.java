package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.ReactionRoleEntry;
import com.example.guardianservice.repository.ReactionRoleEntryRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class JpaReactionRoleStore implements ReactionRoleStore {

    private final ReactionRoleEntryRepository repository;
    private final Cache<Long, List<ReactionRoleEntry>> cache;

    public JpaReactionRoleStore(ReactionRoleEntryRepository repository, CacheSettings cacheSettings) {
        this.repository = repository;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(cacheSettings.reactionRoleTtl())
                .build();
    }

    @Override
    public List<ReactionRoleEntry> findByGuild(long guildId) {
        return cache.get(guildId, id -> List.copyOf(repository.findByGuildIdOrderByOrderIndexAsc(id)));
    }

    @Override
    @Transactional
    public void replaceAll(long guildId, List<ReactionRoleEntry> entries) {
        Map<Long, ReactionRoleEntry> existing = new HashMap<>();
        repository.findByGuildIdOrderByOrderIndexAsc(guildId).forEach(e -> existing.put(e.getRoleId(), e));

        List<ReactionRoleEntry> toSave = new ArrayList<>();
        for (ReactionRoleEntry entry : entries) {
            ReactionRoleEntry row = existing.remove(entry.getRoleId());
            if (row == null) {
                row = entry.toBuilder().id(null).guildId(guildId).build();
            } else {
                row.setGroupKey(entry.getGroupKey());
                row.setEnabled(entry.isEnabled());
                row.setOrderIndex(entry.getOrderIndex());
                row.setLabel(entry.getLabel());
                row.setEmoji(entry.getEmoji());
            }
            toSave.add(row);
        }
        repository.deleteAll(existing.values());
        repository.saveAll(toSave);
        cache.invalidate(guildId);
        log.debug("Saved reaction-role list guildId={} entries={} removed={}",
                guildId, toSave.size(), existing.size());
    }

    @Override
    public void evictGuild(long guildId) {
        cache.invalidate(guildId);
    }
}
