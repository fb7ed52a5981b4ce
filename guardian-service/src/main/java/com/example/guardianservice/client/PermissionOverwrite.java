package com.example.guardianservice.client;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-channel permission delta for one role.
 */
public record PermissionOverwrite(long roleId, Set<ChannelPermission> allow, Set<ChannelPermission> deny) {

    public PermissionOverwrite {
        allow = allow.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(allow));
        deny = deny.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(deny));
    }

    public static PermissionOverwrite allow(long roleId, ChannelPermission... permissions) {
        return new PermissionOverwrite(roleId, Set.of(permissions), Set.of());
    }

    public static PermissionOverwrite deny(long roleId, ChannelPermission... permissions) {
        return new PermissionOverwrite(roleId, Set.of(), Set.of(permissions));
    }
}
