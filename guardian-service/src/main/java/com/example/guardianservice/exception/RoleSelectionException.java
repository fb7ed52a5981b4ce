package com.example.guardianservice.exception;

import lombok.Getter;

/**
 * A member selection on the reaction panel was rejected before any remote mutation.
 */
@Getter
public class RoleSelectionException extends BaseException {

    private final Reason reason;
    private final long roleId;

    public RoleSelectionException(Reason reason, long roleId, String message) {
        super("SELECTION_" + reason.name(), message);
        this.reason = reason;
        this.roleId = roleId;
    }

    public enum Reason {
        NOT_CONFIGURED,
        DISABLED,
        UNKNOWN_ROLE,
        PROTECTED,
        MANAGED,
        ABOVE_BOT_HIERARCHY
    }
}
