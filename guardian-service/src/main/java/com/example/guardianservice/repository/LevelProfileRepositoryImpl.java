package com.example.guardianservice.repository;

import com.example.guardianservice.entity.LevelProfile;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Native PostgreSQL ON CONFLICT upsert for LevelProfile.
 * <p>
 * XP grants for one profile are serialized by the level engine, so the row written here is
 * always the latest state; concurrent grants to different profiles touch different rows.
 */
@Repository
@Slf4j
public class LevelProfileRepositoryImpl implements LevelProfileRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int upsert(LevelProfile profile) {
        String sql = """
                INSERT INTO level_profiles (
                    guild_id, user_id, xp, current_tier,
                    last_message_xp_at, daily_xp, daily_xp_date,
                    created_at, updated_at
                ) VALUES (
                    :guildId, :userId, :xp, :currentTier,
                    :lastMessageXpAt, :dailyXp, :dailyXpDate,
                    :now, :now
                )
                ON CONFLICT (guild_id, user_id)
                DO UPDATE SET
                    xp = GREATEST(level_profiles.xp, EXCLUDED.xp),
                    current_tier = EXCLUDED.current_tier,
                    last_message_xp_at = EXCLUDED.last_message_xp_at,
                    daily_xp = EXCLUDED.daily_xp,
                    daily_xp_date = EXCLUDED.daily_xp_date,
                    updated_at = EXCLUDED.updated_at
                """;

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("guildId", profile.getGuildId());
        query.setParameter("userId", profile.getUserId());
        query.setParameter("xp", profile.getXp());
        query.setParameter("currentTier", profile.getCurrentTier());
        query.setParameter("lastMessageXpAt", profile.getLastMessageXpAt() != null
                ? Timestamp.from(profile.getLastMessageXpAt())
                : null);
        query.setParameter("dailyXp", profile.getDailyXp());
        query.setParameter("dailyXpDate", profile.getDailyXpDate() != null
                ? Date.valueOf(profile.getDailyXpDate())
                : null);
        query.setParameter("now", Timestamp.valueOf(LocalDateTime.now()));

        int affected = query.executeUpdate();
        log.debug("Upserted level profile guildId={} userId={} xp={} tier={}",
                profile.getGuildId(), profile.getUserId(), profile.getXp(), profile.getCurrentTier());
        return affected;
    }
}
