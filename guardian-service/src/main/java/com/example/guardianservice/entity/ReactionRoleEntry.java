package com.example.guardianservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A role members may pick from the reaction panel.
 * {@code orderIndex} is dense (0..n-1) within a guild.
 */
@Entity
@Table(name = "reaction_role_entries",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_reaction_role_entries_guild_role", columnNames = {"guild_id", "role_id"})
        },
        indexes = {
                @Index(name = "idx_reaction_role_entries_guild_order", columnList = "guild_id,order_index")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ReactionRoleEntry extends BaseEntity {

    public static final String DEFAULT_GROUP = "general";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "role_id", nullable = false)
    private long roleId;

    @Column(name = "group_key", nullable = false, length = 50)
    @Builder.Default
    private String groupKey = DEFAULT_GROUP;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "label", length = 100)
    private String label;

    @Column(name = "emoji", length = 64)
    private String emoji;
}
