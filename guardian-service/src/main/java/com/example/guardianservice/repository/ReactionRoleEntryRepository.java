package com.example.guardianservice.repository;

import com.example.guardianservice.entity.ReactionRoleEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReactionRoleEntryRepository extends JpaRepository<ReactionRoleEntry, Long> {

    List<ReactionRoleEntry> findByGuildIdOrderByOrderIndexAsc(long guildId);
}
