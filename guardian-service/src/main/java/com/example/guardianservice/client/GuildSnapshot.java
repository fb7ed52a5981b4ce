package com.example.guardianservice.client;

import com.example.guardianservice.overhaul.model.IdentitySettings;

/**
 * Current guild-wide settings. The id of the default {@code @everyone} role equals the guild id.
 */
public record GuildSnapshot(long guildId, IdentitySettings settings) {

    public long everyoneRoleId() {
        return guildId;
    }
}
