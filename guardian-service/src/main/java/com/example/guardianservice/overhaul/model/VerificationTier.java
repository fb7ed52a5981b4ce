package com.example.guardianservice.overhaul.model;

public enum VerificationTier {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH
}
