package com.example.guardianservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Experience state of one member in one guild.
 * Written only by the level engine; {@code currentTier} is derived from {@code xp}.
 */
@Entity
@Table(name = "level_profiles",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_level_profiles_guild_user", columnNames = {"guild_id", "user_id"})
        },
        indexes = {
                @Index(name = "idx_level_profiles_guild_xp", columnList = "guild_id,xp")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LevelProfile extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "user_id", nullable = false)
    private long userId;

    @Column(name = "xp", nullable = false)
    private long xp;

    /**
     * Level of the highest tier reached, 0 when no tier applies.
     */
    @Column(name = "current_tier", nullable = false)
    private int currentTier;

    @Column(name = "last_message_xp_at")
    private Instant lastMessageXpAt;

    @Column(name = "daily_xp", nullable = false)
    private long dailyXp;

    @Column(name = "daily_xp_date")
    private LocalDate dailyXpDate;

    public static LevelProfile fresh(long guildId, long userId) {
        return LevelProfile.builder()
                .guildId(guildId)
                .userId(userId)
                .build();
    }

    /**
     * Detached copy, including the audit timestamps.
     */
    public LevelProfile copy() {
        LevelProfile copy = toBuilder().build();
        copy.setCreatedAt(getCreatedAt());
        copy.setUpdatedAt(getUpdatedAt());
        return copy;
    }
}
