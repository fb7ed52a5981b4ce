package com.example.guardianservice.client;

import com.example.guardianservice.exception.TransientRemoteException;
import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Platform client wrapper with a shared rate limiter and retry.
 * <p>
 * Every call, from any caller, first takes a permit from the process-wide limiter (fair, so
 * waiting callers are served in arrival order) and is then retried on transient failures only.
 * Each retry attempt takes a fresh permit.
 */
@Slf4j
public class ResilientDiscordClient implements DiscordPlatformClient, AutoCloseable {

    private final DiscordPlatformClient delegate;
    private final RateLimiter rateLimiter;
    private final Retry retry;

    public ResilientDiscordClient(DiscordPlatformClient delegate, RateLimiter rateLimiter, Retry retry) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
    }

    private <T> T call(String operation, Supplier<T> supplier) {
        Supplier<T> limited = () -> {
            try {
                RateLimiter.waitForPermission(rateLimiter);
            } catch (RequestNotPermitted e) {
                log.warn("Rate budget wait timed out: operation={}", operation);
                throw new TransientRemoteException("Timed out waiting for rate budget: " + operation, e);
            }
            return supplier.get();
        };
        return Retry.decorateSupplier(retry, limited).get();
    }

    private void run(String operation, Runnable runnable) {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }

    @Override
    public void updateGuildSettings(long guildId, IdentitySettings settings) {
        run("updateGuildSettings", () -> delegate.updateGuildSettings(guildId, settings));
    }

    @Override
    public RoleSnapshot createRole(long guildId, RoleTemplate template) {
        return call("createRole", () -> delegate.createRole(guildId, template));
    }

    @Override
    public void reorderRoles(long guildId, List<Long> roleIdsHighestFirst) {
        run("reorderRoles", () -> delegate.reorderRoles(guildId, roleIdsHighestFirst));
    }

    @Override
    public long createCategory(long guildId, String name) {
        return call("createCategory", () -> delegate.createCategory(guildId, name));
    }

    @Override
    public long createChannel(long guildId, Long parentId, String name, ChannelKind kind) {
        return call("createChannel", () -> delegate.createChannel(guildId, parentId, name, kind));
    }

    @Override
    public void setChannelOverwrites(long guildId, long channelId, List<PermissionOverwrite> overwrites) {
        run("setChannelOverwrites", () -> delegate.setChannelOverwrites(guildId, channelId, overwrites));
    }

    @Override
    public long createMessage(long channelId, MessageContent content) {
        return call("createMessage", () -> delegate.createMessage(channelId, content));
    }

    @Override
    public void editMessage(long channelId, long messageId, MessageContent content) {
        run("editMessage", () -> delegate.editMessage(channelId, messageId, content));
    }

    @Override
    public void addMemberRole(long guildId, long userId, long roleId) {
        run("addMemberRole", () -> delegate.addMemberRole(guildId, userId, roleId));
    }

    @Override
    public void removeMemberRole(long guildId, long userId, long roleId) {
        run("removeMemberRole", () -> delegate.removeMemberRole(guildId, userId, roleId));
    }

    @Override
    public GuildSnapshot getGuild(long guildId) {
        return call("getGuild", () -> delegate.getGuild(guildId));
    }

    @Override
    public List<RoleSnapshot> listRoles(long guildId) {
        return call("listRoles", () -> delegate.listRoles(guildId));
    }

    @Override
    public List<ChannelSnapshot> listChannels(long guildId) {
        return call("listChannels", () -> delegate.listChannels(guildId));
    }

    @Override
    public MemberSnapshot getMember(long guildId, long userId) {
        return call("getMember", () -> delegate.getMember(guildId, userId));
    }

    @Override
    public MemberSnapshot getSelfMember(long guildId) {
        return call("getSelfMember", () -> delegate.getSelfMember(guildId));
    }

    @Override
    public Set<GuildPermission> getSelfPermissions(long guildId) {
        return call("getSelfPermissions", () -> delegate.getSelfPermissions(guildId));
    }

    @Override
    public boolean messageExists(long channelId, long messageId) {
        return call("messageExists", () -> delegate.messageExists(channelId, messageId));
    }

    @Override
    public void close() throws Exception {
        if (delegate instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
