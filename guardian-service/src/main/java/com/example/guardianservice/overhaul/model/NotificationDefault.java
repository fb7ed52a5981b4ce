package com.example.guardianservice.overhaul.model;

public enum NotificationDefault {
    ALL_MESSAGES,
    ONLY_MENTIONS
}
