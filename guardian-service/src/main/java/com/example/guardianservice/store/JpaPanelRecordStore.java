package com.example.guardianservice.store;

import com.example.guardianservice.config.CacheSettings;
import com.example.guardianservice.entity.PanelRecord;
import com.example.guardianservice.repository.PanelRecordRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
public class JpaPanelRecordStore implements PanelRecordStore {

    private final PanelRecordRepository repository;
    private final Cache<String, PanelRecord> cache;

    public JpaPanelRecordStore(PanelRecordRepository repository, CacheSettings cacheSettings) {
        this.repository = repository;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(cacheSettings.panelTtl())
                .build();
    }

    @Override
    public Optional<PanelRecord> find(String panelKey) {
        PanelRecord cached = cache.getIfPresent(panelKey);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<PanelRecord> loaded = repository.findByPanelKey(panelKey);
        loaded.ifPresent(record -> cache.put(panelKey, record));
        return loaded;
    }

    @Override
    public List<PanelRecord> findAll() {
        return repository.findAll();
    }

    @Override
    @Transactional
    public void save(PanelRecord record) {
        PanelRecord row = repository.findByPanelKey(record.getPanelKey()).orElse(record);
        row.setGuildId(record.getGuildId());
        row.setChannelId(record.getChannelId());
        row.setMessageId(record.getMessageId());
        row.setContentHash(record.getContentHash());
        cache.put(record.getPanelKey(), repository.save(row));
    }

    @Override
    @Transactional
    public void delete(String panelKey) {
        repository.deleteByPanelKey(panelKey);
        cache.invalidate(panelKey);
    }

    @Override
    public void evictGuild(long guildId) {
        cache.asMap().values().removeIf(record -> record.getGuildId() == guildId);
    }
}
