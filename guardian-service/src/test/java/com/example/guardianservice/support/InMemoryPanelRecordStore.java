package com.example.guardianservice.support;

import com.example.guardianservice.entity.PanelRecord;
import com.example.guardianservice.store.PanelRecordStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPanelRecordStore implements PanelRecordStore {

    private final Map<String, PanelRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<PanelRecord> find(String panelKey) {
        return Optional.ofNullable(records.get(panelKey));
    }

    @Override
    public List<PanelRecord> findAll() {
        return List.copyOf(records.values());
    }

    @Override
    public void save(PanelRecord record) {
        records.put(record.getPanelKey(), record);
    }

    @Override
    public void delete(String panelKey) {
        records.remove(panelKey);
    }

    @Override
    public void evictGuild(long guildId) {
    }
}
