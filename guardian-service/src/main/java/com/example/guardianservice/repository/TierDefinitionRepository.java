package com.example.guardianservice.repository;

import com.example.guardianservice.entity.TierDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TierDefinitionRepository extends JpaRepository<TierDefinition, Long> {

    List<TierDefinition> findByGuildIdOrderByThresholdAsc(long guildId);

    Optional<TierDefinition> findByGuildIdAndLevel(long guildId, int level);

    @Modifying
    @Query("DELETE FROM TierDefinition t WHERE t.guildId = :guildId")
    int deleteAllByGuildId(@Param("guildId") long guildId);
}
