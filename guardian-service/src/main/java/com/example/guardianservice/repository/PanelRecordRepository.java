package com.example.guardianservice.repository;

import com.example.guardianservice.entity.PanelRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PanelRecordRepository extends JpaRepository<PanelRecord, Long> {

    Optional<PanelRecord> findByPanelKey(String panelKey);

    void deleteByPanelKey(String panelKey);
}
