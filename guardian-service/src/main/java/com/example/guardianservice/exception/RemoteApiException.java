package com.example.guardianservice.exception;

/**
 * Failure reported by the remote platform API.
 */
public abstract class RemoteApiException extends BaseException {

    protected RemoteApiException(String code, String message) {
        super(code, message);
    }

    protected RemoteApiException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public abstract boolean isRetryable();
}
