package com.example.guardianservice.client;

import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.exception.TransientRemoteException;
import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.ContentFilterTier;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.model.NotificationDefault;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import com.example.guardianservice.overhaul.model.VerificationTier;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.PermissionOverride;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.ChannelType;
import net.dv8tion.jda.api.entities.channel.attribute.ICategorizableChannel;
import net.dv8tion.jda.api.entities.channel.attribute.IPermissionContainer;
import net.dv8tion.jda.api.entities.channel.concrete.Category;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.HierarchyException;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.exceptions.RateLimitedException;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import net.dv8tion.jda.api.interactions.components.LayoutComponent;
import net.dv8tion.jda.api.interactions.components.selections.SelectOption;
import net.dv8tion.jda.api.interactions.components.selections.StringSelectMenu;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.RestAction;
import net.dv8tion.jda.api.requests.restaction.order.RoleOrderAction;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import net.dv8tion.jda.api.utils.messages.MessageEditBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link DiscordPlatformClient} backed by JDA.
 * <p>
 * Actions run with {@code complete(false)} so JDA reports rate limits to us instead of
 * waiting on its own; waiting and retrying is left to {@link ResilientDiscordClient}.
 */
@Slf4j
public class JdaDiscordPlatformClient implements DiscordPlatformClient, AutoCloseable {

    private static final Map<ChannelPermission, Permission> PERMISSIONS = Map.of(
            ChannelPermission.VIEW_CHANNEL, Permission.VIEW_CHANNEL,
            ChannelPermission.SEND_MESSAGES, Permission.MESSAGE_SEND,
            ChannelPermission.CONNECT, Permission.VOICE_CONNECT);

    private static final Map<GuildPermission, Permission> GUILD_PERMISSIONS = Map.of(
            GuildPermission.MANAGE_ROLES, Permission.MANAGE_ROLES,
            GuildPermission.MANAGE_CHANNELS, Permission.MANAGE_CHANNEL,
            GuildPermission.MANAGE_GUILD, Permission.MANAGE_SERVER);

    private final JDA jda;

    public JdaDiscordPlatformClient(JDA jda) {
        this.jda = jda;
    }

    private <T> T execute(String operation, Supplier<RestAction<T>> action) {
        try {
            return action.get().complete(false);
        } catch (RateLimitedException e) {
            log.warn("Rate limited: operation={} retryAfter={}ms", operation, e.getRetryAfter());
            throw TransientRemoteException.rateLimited(Duration.ofMillis(e.getRetryAfter()));
        } catch (HierarchyException e) {
            throw new PermanentRemoteException(PermanentRemoteException.Reason.HIERARCHY,
                    operation + ": " + e.getMessage(), e);
        } catch (InsufficientPermissionException e) {
            throw new PermanentRemoteException(PermanentRemoteException.Reason.MISSING_PERMISSION,
                    operation + ": missing " + e.getPermission().getName(), e);
        } catch (ErrorResponseException e) {
            throw translate(operation, e);
        } catch (UncheckedIOException e) {
            throw new TransientRemoteException(operation + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof IOException) {
                throw new TransientRemoteException(operation + ": " + e.getCause().getMessage(), e);
            }
            throw e;
        }
    }

    private RuntimeException translate(String operation, ErrorResponseException e) {
        if (e.isServerError()) {
            return new TransientRemoteException(operation + ": server error " + e.getErrorCode(), e);
        }
        ErrorResponse response = e.getErrorResponse();
        String message = operation + ": " + e.getMeaning();
        return switch (response) {
            case MISSING_PERMISSIONS, MISSING_ACCESS ->
                    new PermanentRemoteException(PermanentRemoteException.Reason.MISSING_PERMISSION, message, e);
            case UNKNOWN_CHANNEL, UNKNOWN_GUILD, UNKNOWN_MEMBER, UNKNOWN_MESSAGE, UNKNOWN_ROLE, UNKNOWN_USER ->
                    new PermanentRemoteException(PermanentRemoteException.Reason.UNKNOWN_RESOURCE, message, e);
            default -> new PermanentRemoteException(PermanentRemoteException.Reason.INVALID_PAYLOAD, message, e);
        };
    }

    private Guild guild(long guildId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            throw PermanentRemoteException.unknownResource("guild " + guildId);
        }
        return guild;
    }

    private Role role(Guild guild, long roleId) {
        Role role = guild.getRoleById(roleId);
        if (role == null) {
            throw PermanentRemoteException.unknownResource("role " + roleId);
        }
        return role;
    }

    private TextChannel textChannel(long channelId) {
        TextChannel channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            throw PermanentRemoteException.unknownResource("channel " + channelId);
        }
        return channel;
    }

    @Override
    public void updateGuildSettings(long guildId, IdentitySettings settings) {
        Guild guild = guild(guildId);
        execute("updateGuildSettings", () -> guild.getManager()
                .setName(settings.name())
                .setVerificationLevel(Guild.VerificationLevel.valueOf(settings.verificationTier().name()))
                .setExplicitContentLevel(toJda(settings.contentFilterTier()))
                .setDefaultNotificationLevel(toJda(settings.notificationDefault())));
    }

    @Override
    public RoleSnapshot createRole(long guildId, RoleTemplate template) {
        Guild guild = guild(guildId);
        Role role = execute("createRole", () -> guild.createRole()
                .setName(template.name())
                .setColor(template.color())
                .setHoisted(template.hoisted())
                .setMentionable(template.mentionable()));
        return toSnapshot(role);
    }

    @Override
    public void reorderRoles(long guildId, List<Long> roleIdsHighestFirst) {
        Guild guild = guild(guildId);
        execute("reorderRoles", () -> {
            RoleOrderAction action = guild.modifyRolePositions(false);
            List<Role> wanted = new ArrayList<>();
            List<Integer> slots = new ArrayList<>();
            for (Long roleId : roleIdsHighestFirst) {
                Role role = role(guild, roleId);
                wanted.add(role);
                slots.add(action.getCurrentOrder().indexOf(role));
            }
            slots.sort(null);
            // swapping inside the slot set leaves every other role where it was
            for (int i = 0; i < wanted.size(); i++) {
                int current = action.getCurrentOrder().indexOf(wanted.get(i));
                if (current != slots.get(i)) {
                    action.selectPosition(current).swapPosition(slots.get(i));
                }
            }
            return action;
        });
    }

    @Override
    public long createCategory(long guildId, String name) {
        Guild guild = guild(guildId);
        return execute("createCategory", () -> guild.createCategory(name)).getIdLong();
    }

    @Override
    public long createChannel(long guildId, Long parentId, String name, ChannelKind kind) {
        Guild guild = guild(guildId);
        Category parent = null;
        if (parentId != null) {
            parent = guild.getCategoryById(parentId);
            if (parent == null) {
                throw PermanentRemoteException.unknownResource("category " + parentId);
            }
        }
        Category category = parent;
        GuildChannel channel = kind == ChannelKind.VOICE
                ? execute("createChannel", () -> guild.createVoiceChannel(name, category))
                : execute("createChannel", () -> guild.createTextChannel(name, category));
        return channel.getIdLong();
    }

    @Override
    public void setChannelOverwrites(long guildId, long channelId, List<PermissionOverwrite> overwrites) {
        Guild guild = guild(guildId);
        GuildChannel channel = guild.getGuildChannelById(channelId);
        if (!(channel instanceof IPermissionContainer container)) {
            throw PermanentRemoteException.unknownResource("channel " + channelId);
        }
        Set<Long> wanted = new HashSet<>();
        for (PermissionOverwrite overwrite : overwrites) {
            Role role = role(guild, overwrite.roleId());
            wanted.add(role.getIdLong());
            execute("setChannelOverwrites", () -> container.upsertPermissionOverride(role)
                    .setPermissions(Permission.getRaw(toJda(overwrite.allow())), Permission.getRaw(toJda(overwrite.deny()))));
        }
        for (PermissionOverride existing : container.getRolePermissionOverrides()) {
            if (!wanted.contains(existing.getIdLong())) {
                execute("setChannelOverwrites", existing::delete);
            }
        }
    }

    @Override
    public long createMessage(long channelId, MessageContent content) {
        TextChannel channel = textChannel(channelId);
        return execute("createMessage", () -> channel.sendMessage(new MessageCreateBuilder()
                .setContent(content.text())
                .setComponents(toComponents(content))
                .build())).getIdLong();
    }

    @Override
    public void editMessage(long channelId, long messageId, MessageContent content) {
        TextChannel channel = textChannel(channelId);
        execute("editMessage", () -> channel.editMessageById(messageId, new MessageEditBuilder()
                .setContent(content.text())
                .setComponents(toComponents(content))
                .build()));
    }

    @Override
    public void addMemberRole(long guildId, long userId, long roleId) {
        Guild guild = guild(guildId);
        Role role = role(guild, roleId);
        execute("addMemberRole", () -> guild.addRoleToMember(UserSnowflake.fromId(userId), role));
    }

    @Override
    public void removeMemberRole(long guildId, long userId, long roleId) {
        Guild guild = guild(guildId);
        Role role = role(guild, roleId);
        execute("removeMemberRole", () -> guild.removeRoleFromMember(UserSnowflake.fromId(userId), role));
    }

    @Override
    public GuildSnapshot getGuild(long guildId) {
        Guild guild = guild(guildId);
        return new GuildSnapshot(guildId, new IdentitySettings(
                guild.getName(),
                fromJda(guild.getVerificationLevel()),
                fromJda(guild.getExplicitContentLevel()),
                guild.getDefaultNotificationLevel() == Guild.NotificationLevel.MENTIONS_ONLY
                        ? NotificationDefault.ONLY_MENTIONS
                        : NotificationDefault.ALL_MESSAGES));
    }

    @Override
    public List<RoleSnapshot> listRoles(long guildId) {
        return guild(guildId).getRoles().stream()
                .filter(role -> !role.isPublicRole())
                .map(this::toSnapshot)
                .toList();
    }

    @Override
    public List<ChannelSnapshot> listChannels(long guildId) {
        List<ChannelSnapshot> result = new ArrayList<>();
        for (GuildChannel channel : guild(guildId).getChannels()) {
            ChannelSnapshot.Type type;
            if (channel.getType() == ChannelType.CATEGORY) {
                type = ChannelSnapshot.Type.CATEGORY;
            } else if (channel.getType() == ChannelType.VOICE) {
                type = ChannelSnapshot.Type.VOICE;
            } else if (channel.getType() == ChannelType.TEXT) {
                type = ChannelSnapshot.Type.TEXT;
            } else {
                continue;
            }
            Long parentId = null;
            if (channel instanceof ICategorizableChannel categorizable && categorizable.getParentCategory() != null) {
                parentId = categorizable.getParentCategory().getIdLong();
            }
            List<PermissionOverwrite> overwrites = List.of();
            if (channel instanceof IPermissionContainer container) {
                overwrites = container.getRolePermissionOverrides().stream()
                        .map(o -> new PermissionOverwrite(o.getIdLong(), fromJda(o.getAllowed()), fromJda(o.getDenied())))
                        .filter(o -> !o.allow().isEmpty() || !o.deny().isEmpty())
                        .toList();
            }
            result.add(new ChannelSnapshot(channel.getIdLong(), channel.getName(), type, parentId, overwrites));
        }
        return result;
    }

    @Override
    public MemberSnapshot getMember(long guildId, long userId) {
        Guild guild = guild(guildId);
        Member member = execute("getMember", () -> guild.retrieveMemberById(userId));
        return toSnapshot(member);
    }

    @Override
    public MemberSnapshot getSelfMember(long guildId) {
        return toSnapshot(guild(guildId).getSelfMember());
    }

    @Override
    public Set<GuildPermission> getSelfPermissions(long guildId) {
        Member self = guild(guildId).getSelfMember();
        Set<GuildPermission> granted = EnumSet.noneOf(GuildPermission.class);
        GUILD_PERMISSIONS.forEach((permission, jdaPermission) -> {
            if (self.hasPermission(jdaPermission)) {
                granted.add(permission);
            }
        });
        return granted;
    }

    @Override
    public boolean messageExists(long channelId, long messageId) {
        TextChannel channel = jda.getTextChannelById(channelId);
        if (channel == null) {
            return false;
        }
        try {
            execute("messageExists", () -> channel.retrieveMessageById(messageId));
            return true;
        } catch (PermanentRemoteException e) {
            if (e.isUnknownResource()) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void close() {
        log.info("Shutting down JDA session");
        jda.shutdown();
    }

    private RoleSnapshot toSnapshot(Role role) {
        return new RoleSnapshot(role.getIdLong(), role.getName(), role.getPosition(), role.getColorRaw(),
                role.isHoisted(), role.isMentionable(), role.isManaged());
    }

    private MemberSnapshot toSnapshot(Member member) {
        return new MemberSnapshot(member.getIdLong(), member.getRoles().stream()
                .map(Role::getIdLong)
                .collect(Collectors.toSet()));
    }

    private static List<LayoutComponent> toComponents(MessageContent content) {
        List<LayoutComponent> rows = new ArrayList<>();
        for (MessageContent.SelectMenu menu : content.menus()) {
            List<SelectOption> options = new ArrayList<>();
            for (MessageContent.SelectOption option : menu.options()) {
                SelectOption jdaOption = SelectOption.of(option.label(), option.value());
                if (option.emoji() != null && !option.emoji().isBlank()) {
                    jdaOption = jdaOption.withEmoji(Emoji.fromFormatted(option.emoji()));
                }
                options.add(jdaOption);
            }
            rows.add(ActionRow.of(StringSelectMenu.create(menu.customId())
                    .setPlaceholder(menu.placeholder())
                    .setMinValues(0)
                    .setMaxValues(options.size())
                    .addOptions(options)
                    .build()));
        }
        return rows;
    }

    private static EnumSet<Permission> toJda(Set<ChannelPermission> permissions) {
        EnumSet<Permission> result = EnumSet.noneOf(Permission.class);
        permissions.forEach(p -> result.add(PERMISSIONS.get(p)));
        return result;
    }

    private static Set<ChannelPermission> fromJda(Set<Permission> permissions) {
        Map<Permission, ChannelPermission> reverse = new HashMap<>();
        PERMISSIONS.forEach((ours, theirs) -> reverse.put(theirs, ours));
        return permissions.stream()
                .map(reverse::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static VerificationTier fromJda(Guild.VerificationLevel level) {
        return switch (level) {
            case LOW -> VerificationTier.LOW;
            case MEDIUM -> VerificationTier.MEDIUM;
            case HIGH -> VerificationTier.HIGH;
            case VERY_HIGH -> VerificationTier.VERY_HIGH;
            default -> VerificationTier.NONE;
        };
    }

    private static Guild.ExplicitContentLevel toJda(ContentFilterTier tier) {
        return switch (tier) {
            case OFF -> Guild.ExplicitContentLevel.OFF;
            case MEMBERS_WITHOUT_ROLES -> Guild.ExplicitContentLevel.NO_ROLE;
            case ALL_MEMBERS -> Guild.ExplicitContentLevel.ALL;
        };
    }

    private static ContentFilterTier fromJda(Guild.ExplicitContentLevel level) {
        return switch (level) {
            case NO_ROLE -> ContentFilterTier.MEMBERS_WITHOUT_ROLES;
            case ALL -> ContentFilterTier.ALL_MEMBERS;
            default -> ContentFilterTier.OFF;
        };
    }

    private static Guild.NotificationLevel toJda(NotificationDefault notificationDefault) {
        return notificationDefault == NotificationDefault.ONLY_MENTIONS
                ? Guild.NotificationLevel.MENTIONS_ONLY
                : Guild.NotificationLevel.ALL_MESSAGES;
    }
}
