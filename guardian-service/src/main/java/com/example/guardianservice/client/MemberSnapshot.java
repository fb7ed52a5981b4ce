package com.example.guardianservice.client;

import java.util.Set;

public record MemberSnapshot(long userId, Set<Long> roleIds) {

    public MemberSnapshot {
        roleIds = Set.copyOf(roleIds);
    }

    public boolean hasRole(long roleId) {
        return roleIds.contains(roleId);
    }
}
