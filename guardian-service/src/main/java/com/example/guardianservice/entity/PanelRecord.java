package com.example.guardianservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Location of the single live reaction panel of a guild.
 */
@Entity
@Table(name = "panel_records",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_panel_records_panel_key", columnNames = {"panel_key"})
        },
        indexes = {
                @Index(name = "idx_panel_records_guild", columnList = "guild_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PanelRecord extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "panel_key", nullable = false, length = 100)
    private String panelKey;

    @Column(name = "guild_id", nullable = false)
    private long guildId;

    @Column(name = "channel_id", nullable = false)
    private long channelId;

    @Column(name = "message_id", nullable = false)
    private long messageId;

    /**
     * Digest of the rendered content last written, used to skip no-op edits.
     */
    @Column(name = "content_hash", length = 64)
    private String contentHash;
}
