package com.example.guardianservice.exception;

import lombok.Getter;

import java.util.List;

/**
 * A configuration violates one of its invariants.
 * Raised before any remote call is made, so no partial state exists.
 */
@Getter
public class ConfigurationValidationException extends BaseException {

    private final List<String> violations;

    public ConfigurationValidationException(List<String> violations) {
        super("INVALID_CONFIGURATION", "Configuration rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public static ConfigurationValidationException of(String violation) {
        return new ConfigurationValidationException(List.of(violation));
    }
}
