package com.example.guardianservice.client;

import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.model.RoleTemplate;

import java.util.List;
import java.util.Set;

/**
 * Remote platform operations used by the overhaul engine, leveling and reaction panels.
 * <p>
 * Every call may fail with {@link com.example.guardianservice.exception.TransientRemoteException}
 * (retryable, possibly carrying the wait the platform asked for) or
 * {@link com.example.guardianservice.exception.PermanentRemoteException} (never retried).
 */
public interface DiscordPlatformClient {

    // mutations

    void updateGuildSettings(long guildId, IdentitySettings settings);

    RoleSnapshot createRole(long guildId, RoleTemplate template);

    /**
     * Places the given roles in this relative order, highest first, without moving unrelated roles.
     */
    void reorderRoles(long guildId, List<Long> roleIdsHighestFirst);

    long createCategory(long guildId, String name);

    long createChannel(long guildId, Long parentId, String name, ChannelKind kind);

    /**
     * Replaces the role overwrites of a channel or category with exactly the given ones.
     */
    void setChannelOverwrites(long guildId, long channelId, List<PermissionOverwrite> overwrites);

    long createMessage(long channelId, MessageContent content);

    void editMessage(long channelId, long messageId, MessageContent content);

    void addMemberRole(long guildId, long userId, long roleId);

    void removeMemberRole(long guildId, long userId, long roleId);

    // reads

    GuildSnapshot getGuild(long guildId);

    List<RoleSnapshot> listRoles(long guildId);

    List<ChannelSnapshot> listChannels(long guildId);

    MemberSnapshot getMember(long guildId, long userId);

    MemberSnapshot getSelfMember(long guildId);

    /**
     * Guild-wide permissions the bot currently has, limited to those in {@link GuildPermission}.
     */
    Set<GuildPermission> getSelfPermissions(long guildId);

    boolean messageExists(long channelId, long messageId);
}
