package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.ChannelPermission;
import com.example.guardianservice.client.PermissionOverwrite;
import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ChannelKind;
import com.example.guardianservice.overhaul.model.ChannelTemplate;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import com.example.guardianservice.overhaul.model.TierTemplate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns template visibility rules into role overwrites, using identifiers of roles that already
 * exist in the run.
 * <ul>
 *   <li>category visibility: allow or deny VIEW per named role</li>
 *   <li>{@code staffOnly}: deny VIEW for everyone, allow it for protected roles</li>
 *   <li>{@code minimumTierToPost}: deny SEND for everyone, allow it for that tier and above
 *       and for protected roles</li>
 * </ul>
 */
final class OverwriteDeriver {

    private final long everyoneRoleId;
    private final KnownState state;
    private final List<RoleTemplate> roles;
    private final List<TierTemplate> tiers;

    OverwriteDeriver(long guildId, KnownState state, List<RoleTemplate> roles, List<TierTemplate> tiers) {
        this.everyoneRoleId = guildId;
        this.state = state;
        this.roles = roles;
        this.tiers = tiers;
    }

    List<PermissionOverwrite> forCategory(CategoryTemplate category) {
        Builder builder = new Builder();
        category.visibility().forEach((roleName, canView) -> {
            long roleId = resolve(roleName);
            if (canView) {
                builder.allow(roleId, ChannelPermission.VIEW_CHANNEL);
            } else {
                builder.deny(roleId, ChannelPermission.VIEW_CHANNEL);
            }
        });
        return builder.build();
    }

    List<PermissionOverwrite> forChannel(ChannelTemplate channel) {
        Builder builder = new Builder();
        if (channel.staffOnly()) {
            builder.deny(everyoneRoleId, ChannelPermission.VIEW_CHANNEL);
            for (RoleTemplate role : roles) {
                if (role.protectedRole()) {
                    builder.allow(resolve(role.name()), ChannelPermission.VIEW_CHANNEL);
                }
            }
        }
        if (channel.minimumTierToPost() != null) {
            ChannelPermission post = channel.kind() == ChannelKind.VOICE
                    ? ChannelPermission.CONNECT
                    : ChannelPermission.SEND_MESSAGES;
            builder.deny(everyoneRoleId, post);
            for (TierTemplate tier : tiers) {
                if (tier.level() >= channel.minimumTierToPost()) {
                    builder.allow(resolve(tier.roleName()), post);
                }
            }
            for (RoleTemplate role : roles) {
                if (role.protectedRole()) {
                    builder.allow(resolve(role.name()), post);
                }
            }
        }
        return builder.build();
    }

    private long resolve(String roleName) {
        if (CategoryTemplate.EVERYONE.equals(roleName)) {
            return everyoneRoleId;
        }
        return state.role(roleName).orElseThrow(
                () -> PermanentRemoteException.unknownResource("role '" + roleName + "' (not created in this guild)"));
    }

    private static final class Builder {

        private final Map<Long, Set<ChannelPermission>> allow = new LinkedHashMap<>();
        private final Map<Long, Set<ChannelPermission>> deny = new LinkedHashMap<>();

        void allow(long roleId, ChannelPermission permission) {
            allow.computeIfAbsent(roleId, id -> EnumSet.noneOf(ChannelPermission.class)).add(permission);
            deny.computeIfAbsent(roleId, id -> EnumSet.noneOf(ChannelPermission.class)).remove(permission);
        }

        void deny(long roleId, ChannelPermission permission) {
            deny.computeIfAbsent(roleId, id -> EnumSet.noneOf(ChannelPermission.class)).add(permission);
            allow.computeIfAbsent(roleId, id -> EnumSet.noneOf(ChannelPermission.class)).remove(permission);
        }

        List<PermissionOverwrite> build() {
            Set<Long> roleIds = new LinkedHashSet<>(allow.keySet());
            roleIds.addAll(deny.keySet());
            List<PermissionOverwrite> result = new ArrayList<>();
            for (Long roleId : roleIds) {
                Set<ChannelPermission> allowed = allow.getOrDefault(roleId, Set.of());
                Set<ChannelPermission> denied = deny.getOrDefault(roleId, Set.of());
                if (!allowed.isEmpty() || !denied.isEmpty()) {
                    result.add(new PermissionOverwrite(roleId, allowed, denied));
                }
            }
            return result;
        }
    }
}
