package com.example.guardianservice.exception;

public class InvalidConfirmationException extends BaseException {

    public InvalidConfirmationException(long guildId) {
        super("INVALID_CONFIRMATION",
                "Confirmation token is missing, expired or was issued for another configuration (guild " + guildId + ")");
    }
}
