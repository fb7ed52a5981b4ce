package com.example.guardianservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Identifier of a remote role, category or channel created by an overhaul, keyed by the
 * template it was created from. Lets a repair pass recognize what already exists.
 */
@Entity
@Table(name = "remote_resources",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_remote_resources_guild_kind_key",
                        columnNames = {"guild_id", "kind", "template_key"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RemoteResource extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private Kind kind;

    /**
     * Role or category name, or {@code category/channel} for channels.
     */
    @Column(name = "template_key", nullable = false, length = 210)
    private String templateKey;

    @Column(name = "remote_id", nullable = false)
    private long remoteId;

    public enum Kind {
        ROLE,
        CATEGORY,
        CHANNEL
    }
}
