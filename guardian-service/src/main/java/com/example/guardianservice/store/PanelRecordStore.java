package com.example.guardianservice.store;

import com.example.guardianservice.entity.PanelRecord;

import java.util.List;
import java.util.Optional;

public interface PanelRecordStore {

    Optional<PanelRecord> find(String panelKey);

    List<PanelRecord> findAll();

    /**
     * Insert or overwrite the record with the same panel key.
     */
    void save(PanelRecord record);

    void delete(String panelKey);

    void evictGuild(long guildId);
}
