package com.example.guardianservice.exception;

/**
 * Invalid change to the declarative reaction-role list.
 */
public class ReactionRoleConfigException extends BaseException {

    public ReactionRoleConfigException(String code, String message) {
        super(code, message);
    }

    public static ReactionRoleConfigException notConfigured(long guildId, long roleId) {
        return new ReactionRoleConfigException("ROLE_NOT_CONFIGURED",
                String.format("Role %d is not part of the reaction-role list of guild %d", roleId, guildId));
    }

    public static ReactionRoleConfigException rejected(long roleId, String why) {
        return new ReactionRoleConfigException("ROLE_REJECTED", "Role " + roleId + " cannot be offered: " + why);
    }
}
