package com.example.guardianservice.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate limit, timeout or 5xx-class failure. Retried with backoff; a rate limit carries
 * the wait duration the platform asked for.
 */
public class TransientRemoteException extends RemoteApiException {

    private final Duration retryAfter;

    public TransientRemoteException(String message, Duration retryAfter) {
        super("REMOTE_TRANSIENT", message);
        this.retryAfter = retryAfter;
    }

    public TransientRemoteException(String message, Throwable cause) {
        super("REMOTE_TRANSIENT", message, cause);
        this.retryAfter = null;
    }

    public static TransientRemoteException rateLimited(Duration retryAfter) {
        return new TransientRemoteException("Rate limited, retry after " + retryAfter.toMillis() + "ms", retryAfter);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
