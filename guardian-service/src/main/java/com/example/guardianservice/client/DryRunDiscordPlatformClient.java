package com.example.guardianservice.client;

import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.ContentFilterTier;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.model.NotificationDefault;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import com.example.guardianservice.overhaul.model.VerificationTier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory guild model used when no bot token is configured.
 * <p>
 * Mutations are logged and applied to the local model only, so reads reflect what a real run
 * would have produced. Identifiers are synthetic.
 */
@Slf4j
public class DryRunDiscordPlatformClient implements DiscordPlatformClient {

    public static final long SELF_USER_ID = 1L;
    public static final String SELF_ROLE_NAME = "Guardian";

    private final AtomicLong idSequence = new AtomicLong(1_000_000L);
    private final AtomicInteger mutations = new AtomicInteger();
    private final Map<Long, GuildModel> guilds = new ConcurrentHashMap<>();
    private final Map<Long, Map<Long, MessageContent>> messages = new ConcurrentHashMap<>();

    /**
     * Called before every operation. Subclasses may throw to simulate platform failures.
     */
    protected void beforeCall(String operation) {
    }

    public int mutationCount() {
        return mutations.get();
    }

    private void mutation(String operation, Object... details) {
        mutations.incrementAndGet();
        log.info("[DRY RUN] {} {}", operation, List.of(details));
    }

    private GuildModel guild(long guildId) {
        return guilds.computeIfAbsent(guildId, id -> new GuildModel(id, idSequence.incrementAndGet()));
    }

    @Override
    public void updateGuildSettings(long guildId, IdentitySettings settings) {
        beforeCall("updateGuildSettings");
        mutation("updateGuildSettings", guildId, settings);
        GuildModel guild = guild(guildId);
        synchronized (guild) {
            guild.settings = settings;
        }
    }

    @Override
    public RoleSnapshot createRole(long guildId, RoleTemplate template) {
        beforeCall("createRole");
        mutation("createRole", guildId, template.name());
        return guild(guildId).addRole(idSequence.incrementAndGet(), template.name(), template.color(),
                template.hoisted(), template.mentionable(), false);
    }

    @Override
    public void reorderRoles(long guildId, List<Long> roleIdsHighestFirst) {
        beforeCall("reorderRoles");
        mutation("reorderRoles", guildId, roleIdsHighestFirst);
        guild(guildId).reorder(roleIdsHighestFirst);
    }

    @Override
    public long createCategory(long guildId, String name) {
        beforeCall("createCategory");
        mutation("createCategory", guildId, name);
        long id = idSequence.incrementAndGet();
        guild(guildId).putChannel(new ChannelSnapshot(id, name, ChannelSnapshot.Type.CATEGORY, null, List.of()));
        return id;
    }

    @Override
    public long createChannel(long guildId, Long parentId, String name, ChannelKind kind) {
        beforeCall("createChannel");
        GuildModel guild = guild(guildId);
        if (parentId != null && !guild.hasChannel(parentId)) {
            throw PermanentRemoteException.unknownResource("category " + parentId);
        }
        mutation("createChannel", guildId, parentId, name, kind);
        long id = idSequence.incrementAndGet();
        ChannelSnapshot.Type type = kind == ChannelKind.VOICE ? ChannelSnapshot.Type.VOICE : ChannelSnapshot.Type.TEXT;
        guild.putChannel(new ChannelSnapshot(id, name, type, parentId, List.of()));
        return id;
    }

    @Override
    public void setChannelOverwrites(long guildId, long channelId, List<PermissionOverwrite> overwrites) {
        beforeCall("setChannelOverwrites");
        GuildModel guild = guild(guildId);
        ChannelSnapshot channel = guild.channel(channelId);
        mutation("setChannelOverwrites", guildId, channelId, overwrites.size());
        guild.putChannel(new ChannelSnapshot(channel.id(), channel.name(), channel.type(), channel.parentId(), overwrites));
    }

    @Override
    public long createMessage(long channelId, MessageContent content) {
        beforeCall("createMessage");
        mutation("createMessage", channelId);
        long id = idSequence.incrementAndGet();
        messages.computeIfAbsent(channelId, c -> new ConcurrentHashMap<>()).put(id, content);
        return id;
    }

    @Override
    public void editMessage(long channelId, long messageId, MessageContent content) {
        beforeCall("editMessage");
        Map<Long, MessageContent> channelMessages = messages.get(channelId);
        if (channelMessages == null || !channelMessages.containsKey(messageId)) {
            throw PermanentRemoteException.unknownResource("message " + messageId);
        }
        mutation("editMessage", channelId, messageId);
        channelMessages.put(messageId, content);
    }

    @Override
    public void addMemberRole(long guildId, long userId, long roleId) {
        beforeCall("addMemberRole");
        GuildModel guild = guild(guildId);
        guild.role(roleId);
        mutation("addMemberRole", guildId, userId, roleId);
        guild.memberRoles(userId).add(roleId);
    }

    @Override
    public void removeMemberRole(long guildId, long userId, long roleId) {
        beforeCall("removeMemberRole");
        GuildModel guild = guild(guildId);
        guild.role(roleId);
        mutation("removeMemberRole", guildId, userId, roleId);
        guild.memberRoles(userId).remove(roleId);
    }

    @Override
    public GuildSnapshot getGuild(long guildId) {
        beforeCall("getGuild");
        GuildModel guild = guild(guildId);
        synchronized (guild) {
            return new GuildSnapshot(guildId, guild.settings);
        }
    }

    @Override
    public List<RoleSnapshot> listRoles(long guildId) {
        beforeCall("listRoles");
        return guild(guildId).roles();
    }

    @Override
    public List<ChannelSnapshot> listChannels(long guildId) {
        beforeCall("listChannels");
        return guild(guildId).channels();
    }

    @Override
    public MemberSnapshot getMember(long guildId, long userId) {
        beforeCall("getMember");
        return new MemberSnapshot(userId, Set.copyOf(guild(guildId).memberRoles(userId)));
    }

    @Override
    public MemberSnapshot getSelfMember(long guildId) {
        beforeCall("getSelfMember");
        return new MemberSnapshot(SELF_USER_ID, Set.copyOf(guild(guildId).memberRoles(SELF_USER_ID)));
    }

    @Override
    public Set<GuildPermission> getSelfPermissions(long guildId) {
        beforeCall("getSelfPermissions");
        GuildModel guild = guild(guildId);
        synchronized (guild) {
            return EnumSet.copyOf(guild.selfPermissions);
        }
    }

    @Override
    public boolean messageExists(long channelId, long messageId) {
        beforeCall("messageExists");
        Map<Long, MessageContent> channelMessages = messages.get(channelId);
        return channelMessages != null && channelMessages.containsKey(messageId);
    }

    // local model manipulation, for simulations

    /**
     * Adds a pre-existing role at the bottom of the hierarchy without counting a mutation.
     */
    public RoleSnapshot seedRole(long guildId, String name, boolean managed) {
        return guild(guildId).addRole(idSequence.incrementAndGet(), name, 0, false, false, managed);
    }

    public MessageContent messageContent(long channelId, long messageId) {
        Map<Long, MessageContent> channelMessages = messages.get(channelId);
        return channelMessages == null ? null : channelMessages.get(messageId);
    }

    public void deleteMessage(long channelId, long messageId) {
        Map<Long, MessageContent> channelMessages = messages.get(channelId);
        if (channelMessages != null) {
            channelMessages.remove(messageId);
        }
    }

    public void revokeSelfPermission(long guildId, GuildPermission permission) {
        GuildModel guild = guild(guildId);
        synchronized (guild) {
            guild.selfPermissions.remove(permission);
        }
    }

    public void deleteChannel(long guildId, long channelId) {
        guild(guildId).removeChannel(channelId);
        messages.remove(channelId);
    }

    private static final class GuildModel {

        private final long guildId;
        private IdentitySettings settings;
        private final Set<GuildPermission> selfPermissions = EnumSet.allOf(GuildPermission.class);
        private final List<RoleSnapshot> rolesHighestFirst = new ArrayList<>();
        private final Map<Long, ChannelSnapshot> channels = new LinkedHashMap<>();
        private final Map<Long, Set<Long>> members = new ConcurrentHashMap<>();

        private GuildModel(long guildId, long selfRoleId) {
            this.guildId = guildId;
            this.settings = new IdentitySettings("Guild " + guildId, VerificationTier.NONE,
                    ContentFilterTier.OFF, NotificationDefault.ALL_MESSAGES);
            rolesHighestFirst.add(new RoleSnapshot(selfRoleId, SELF_ROLE_NAME, 1, 0, false, false, true));
            memberRoles(SELF_USER_ID).add(selfRoleId);
        }

        synchronized RoleSnapshot addRole(long id, String name, int color, boolean hoisted,
                                          boolean mentionable, boolean managed) {
            rolesHighestFirst.add(new RoleSnapshot(id, name, 0, color, hoisted, mentionable, managed));
            renumber();
            return role(id);
        }

        synchronized RoleSnapshot role(long roleId) {
            return rolesHighestFirst.stream()
                    .filter(r -> r.id() == roleId)
                    .findFirst()
                    .orElseThrow(() -> PermanentRemoteException.unknownResource("role " + roleId));
        }

        synchronized List<RoleSnapshot> roles() {
            return List.copyOf(rolesHighestFirst);
        }

        synchronized void reorder(List<Long> roleIdsHighestFirst) {
            List<Integer> slots = new ArrayList<>();
            List<RoleSnapshot> moved = new ArrayList<>();
            for (Long roleId : roleIdsHighestFirst) {
                RoleSnapshot role = role(roleId);
                slots.add(rolesHighestFirst.indexOf(role));
                moved.add(role);
            }
            slots.sort(null);
            for (int i = 0; i < moved.size(); i++) {
                rolesHighestFirst.set(slots.get(i), moved.get(i));
            }
            renumber();
        }

        private void renumber() {
            int size = rolesHighestFirst.size();
            for (int i = 0; i < size; i++) {
                RoleSnapshot r = rolesHighestFirst.get(i);
                rolesHighestFirst.set(i, new RoleSnapshot(r.id(), r.name(), size - i, r.color(),
                        r.hoisted(), r.mentionable(), r.managed()));
            }
        }

        synchronized void putChannel(ChannelSnapshot channel) {
            channels.put(channel.id(), channel);
        }

        synchronized void removeChannel(long channelId) {
            channels.remove(channelId);
        }

        synchronized boolean hasChannel(long channelId) {
            return channels.containsKey(channelId);
        }

        synchronized ChannelSnapshot channel(long channelId) {
            ChannelSnapshot channel = channels.get(channelId);
            if (channel == null) {
                throw PermanentRemoteException.unknownResource("channel " + channelId + " in guild " + guildId);
            }
            return channel;
        }

        synchronized List<ChannelSnapshot> channels() {
            return List.copyOf(channels.values());
        }

        Set<Long> memberRoles(long userId) {
            return members.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet());
        }
    }
}
