package com.example.guardianservice.client;

/**
 * Guild-wide permissions the bot needs before an overhaul may touch anything.
 */
public enum GuildPermission {
    MANAGE_ROLES,
    MANAGE_CHANNELS,
    MANAGE_GUILD
}
