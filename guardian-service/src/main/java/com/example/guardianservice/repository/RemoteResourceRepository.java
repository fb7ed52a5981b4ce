package com.example.guardianservice.repository;

import com.example.guardianservice.entity.RemoteResource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for identifiers recorded while an overhaul runs.
 * Recording the same template twice overwrites the identifier (idempotent).
 */
@Repository
public interface RemoteResourceRepository extends JpaRepository<RemoteResource, Long> {

    List<RemoteResource> findByGuildId(long guildId);

    @Modifying
    @Query(value = """
            INSERT INTO remote_resources (guild_id, kind, template_key, remote_id, created_at, updated_at)
            VALUES (:guildId, :kind, :templateKey, :remoteId, now(), now())
            ON CONFLICT (guild_id, kind, template_key)
            DO UPDATE SET remote_id = EXCLUDED.remote_id, updated_at = now()
            """, nativeQuery = true)
    int upsert(@Param("guildId") long guildId,
               @Param("kind") String kind,
               @Param("templateKey") String templateKey,
               @Param("remoteId") long remoteId);

    @Modifying
    @Query("DELETE FROM RemoteResource r WHERE r.guildId = :guildId AND r.kind = :kind AND r.templateKey = :templateKey")
    int deleteOne(@Param("guildId") long guildId,
                  @Param("kind") RemoteResource.Kind kind,
                  @Param("templateKey") String templateKey);
}
