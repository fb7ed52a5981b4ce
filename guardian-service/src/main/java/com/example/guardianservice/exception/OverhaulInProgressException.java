package com.example.guardianservice.exception;

/**
 * A second overhaul was requested while one is active for the same guild.
 */
public class OverhaulInProgressException extends BaseException {

    public OverhaulInProgressException(long guildId) {
        super("OVERHAUL_IN_PROGRESS", "An overhaul is already running for guild " + guildId);
    }
}
