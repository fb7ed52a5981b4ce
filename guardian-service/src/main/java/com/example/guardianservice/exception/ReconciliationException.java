package com.example.guardianservice.exception;

/**
 * Tier role add/remove failed during leveling reconciliation.
 * Logged by the level engine; never fails the XP grant that triggered it.
 */
public class ReconciliationException extends BaseException {

    public ReconciliationException(long guildId, long userId, Throwable cause) {
        super("RECONCILIATION_FAILED",
                String.format("Tier role reconciliation failed for guildId=%d userId=%d: %s",
                        guildId, userId, cause.getMessage()),
                cause);
    }
}
