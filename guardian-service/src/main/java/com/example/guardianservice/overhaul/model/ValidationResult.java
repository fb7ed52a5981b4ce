package com.example.guardianservice.overhaul.model;

import com.example.guardianservice.exception.ConfigurationValidationException;

import java.util.List;

public record ValidationResult(List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public void throwIfInvalid() {
        if (!isOk()) {
            throw new ConfigurationValidationException(errors);
        }
    }
}
