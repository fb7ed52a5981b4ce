package com.example.guardianservice.repository;

import com.example.guardianservice.entity.LevelProfile;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for LevelProfile entity.
 * Extends custom interface for UPSERT operations.
 */
@Repository
public interface LevelProfileRepository extends JpaRepository<LevelProfile, Long>, LevelProfileRepositoryCustom {

    Optional<LevelProfile> findByGuildIdAndUserId(long guildId, long userId);

    List<LevelProfile> findByGuildIdOrderByXpDesc(long guildId, Pageable pageable);
}
