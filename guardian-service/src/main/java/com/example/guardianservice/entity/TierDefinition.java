package com.example.guardianservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * One rung of a guild's tier ladder, with the role granted on reaching it.
 */
@Entity
@Table(name = "tier_definitions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tier_definitions_guild_level", columnNames = {"guild_id", "level"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TierDefinition extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "level", nullable = false)
    private int level;

    @Column(name = "threshold", nullable = false)
    private long threshold;

    @Column(name = "role_name", nullable = false, length = 100)
    private String roleName;

    /**
     * Reward role, {@code null} until a role is mapped to the tier.
     */
    @Column(name = "role_id")
    private Long roleId;

    @Convert(converter = StringListConverter.class)
    @Column(name = "capabilities", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();
}
