package com.example.guardianservice.overhaul.model;

public enum ContentFilterTier {
    OFF,
    MEMBERS_WITHOUT_ROLES,
    ALL_MEMBERS
}
