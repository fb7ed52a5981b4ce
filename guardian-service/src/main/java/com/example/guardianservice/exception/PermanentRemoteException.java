package com.example.guardianservice.exception;

import lombok.Getter;

/**
 * Permission denial, conflicting resource or invalid payload. Never retried.
 */
@Getter
public class PermanentRemoteException extends RemoteApiException {

    private final Reason reason;

    public PermanentRemoteException(Reason reason, String message) {
        super("REMOTE_" + reason.name(), message);
        this.reason = reason;
    }

    public PermanentRemoteException(Reason reason, String message, Throwable cause) {
        super("REMOTE_" + reason.name(), message, cause);
        this.reason = reason;
    }

    public static PermanentRemoteException unknownResource(String what) {
        return new PermanentRemoteException(Reason.UNKNOWN_RESOURCE, "Unknown " + what);
    }

    public static PermanentRemoteException missingPermission(String message) {
        return new PermanentRemoteException(Reason.MISSING_PERMISSION, message);
    }

    public boolean isUnknownResource() {
        return reason == Reason.UNKNOWN_RESOURCE;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }

    public enum Reason {
        MISSING_PERMISSION,
        INVALID_PAYLOAD,
        CONFLICT,
        UNKNOWN_RESOURCE,
        HIERARCHY
    }
}
